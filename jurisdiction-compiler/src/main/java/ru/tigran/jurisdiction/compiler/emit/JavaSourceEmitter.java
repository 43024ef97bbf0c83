package ru.tigran.jurisdiction.compiler.emit;

import ru.tigran.jurisdiction.compiler.model.ClassificationValue;
import ru.tigran.jurisdiction.compiler.model.CompiledClassification;
import ru.tigran.jurisdiction.compiler.model.CompiledDefinition;
import ru.tigran.jurisdiction.compiler.model.HierarchyLevel;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

import static ru.tigran.jurisdiction.compiler.util.IdentifierUtils.escapeJava;

/**
 * Renders a {@link CompiledClassification} as Java sources for the runtime library.
 *
 * Produces:
 * - Alpha2, Alpha3: one constant per code, each carrying its numeric country code
 * - Region, SubRegion, IntermediateRegion: one constant per name plus UNDEFINED,
 *   each carrying its label and the country codes grouped under it
 * - GeneratedDefinitions: the definition table in feed order
 *
 * The generated types reference {@code Definition}, which the runtime library declares
 * in the same package. Output depends only on the input, so repeated runs are byte-identical.
 */
public class JavaSourceEmitter {

    static final String HEADER = "// Generated by the jurisdiction classification compiler. Do not edit.\n";

    private final String targetPackage;

    public JavaSourceEmitter(String targetPackage) {
        this.targetPackage = targetPackage;
    }

    /**
     * Renders every generated type.
     *
     * @param classification compiler output
     * @return sources in a fixed order
     */
    public List<GeneratedSource> emit(CompiledClassification classification) {
        List<GeneratedSource> sources = new ArrayList<>();
        sources.add(emitAlpha("Alpha2", "Two alpha character ISO 3166 country code classification.",
                classification.definitions(), CompiledDefinition::alpha2));
        sources.add(emitAlpha("Alpha3", "Three alpha character ISO 3166 country code classification.",
                classification.definitions(), CompiledDefinition::alpha3));
        for (HierarchyLevel level : HierarchyLevel.values()) {
            sources.add(emitHierarchy(level, classification));
        }
        sources.add(emitDefinitions(classification.definitions()));
        return sources;
    }

    private GeneratedSource emitAlpha(String typeName, String description, List<CompiledDefinition> definitions,
                                      Function<CompiledDefinition, String> code) {
        String constants = definitions.stream()
                .map(definition -> String.format(Locale.ROOT, "    %s(%d)", code.apply(definition), definition.countryCode()))
                .collect(Collectors.joining(",\n", "", ";"));

        String body = String.format(Locale.ROOT, """
                /**
                 * %2$s
                 */
                public enum %1$s {
                %3$s

                    private final short countryCode;

                    %1$s(int countryCode) {
                        this.countryCode = (short) countryCode;
                    }

                    /**
                     * Returns the ISO 3166 numeric country code this code stands for.
                     */
                    public int getCountryCode() {
                        return countryCode;
                    }
                }
                """, typeName, description, constants);
        return new GeneratedSource(typeName, preamble() + body);
    }

    private GeneratedSource emitHierarchy(HierarchyLevel level, CompiledClassification classification) {
        String typeName = level.getTypeName();
        String constants = classification.classes(level).stream()
                .map(value -> String.format(Locale.ROOT, "    %s(\"%s\", new short[] {%s})",
                        value.identifier(),
                        escapeJava(value.label()),
                        joinCodes(classification.members(level, value))))
                .collect(Collectors.joining(",\n", "", ";"));

        String body = String.format(Locale.ROOT, """
                /**
                 * %2$s
                 *
                 * <p>{@link #UNDEFINED} collects jurisdictions without an assignment at this level.
                 */
                public enum %1$s {
                %3$s

                    private final String label;
                    private final short[] members;

                    %1$s(String label, short[] members) {
                        this.label = label;
                        this.members = members;
                    }

                    /**
                     * Returns the name of this classification as published by the UN statistics division.
                     */
                    public String getLabel() {
                        return label;
                    }

                    short[] members() {
                        return members;
                    }

                    /**
                     * Returns the constant for a published name, or {@link #UNDEFINED} when absent or unknown.
                     */
                    public static %1$s fromLabel(String label) {
                        for (%1$s value : values()) {
                            if (value != UNDEFINED && value.label.equals(label)) {
                                return value;
                            }
                        }
                        return UNDEFINED;
                    }
                }
                """, typeName, level.getDescription(), constants);
        return new GeneratedSource(typeName, preamble() + body);
    }

    private GeneratedSource emitDefinitions(List<CompiledDefinition> definitions) {
        StringBuilder rows = new StringBuilder();
        Iterator<CompiledDefinition> it = definitions.iterator();
        while (it.hasNext()) {
            CompiledDefinition d = it.next();
            rows.append(String.format(Locale.ROOT, "            new Definition(%d, \"%s\", Alpha2.%s, Alpha3.%s, %s, %s, %s, %d, %d, %d)",
                    d.countryCode(),
                    escapeJava(d.name()),
                    d.alpha2(),
                    d.alpha3(),
                    constant(HierarchyLevel.REGION, d.region()),
                    constant(HierarchyLevel.SUB_REGION, d.subRegion()),
                    constant(HierarchyLevel.INTERMEDIATE_REGION, d.intermediateRegion()),
                    d.regionCode(),
                    d.subRegionCode(),
                    d.intermediateRegionCode().orElse(0)));
            rows.append(it.hasNext() ? ",\n" : "\n");
        }

        String body = String.format(Locale.ROOT, """
                /**
                 * Definition table in dataset order. An intermediate region code of 0 means "not applicable".
                 */
                final class GeneratedDefinitions {

                    static final int COUNT = %d;

                    static final Definition[] DEFINITIONS = {
                %s    };

                    private GeneratedDefinitions() {
                    }
                }
                """, definitions.size(), rows);
        return new GeneratedSource("GeneratedDefinitions", preamble() + body);
    }

    private String preamble() {
        return HEADER + "package " + targetPackage + ";\n\n";
    }

    private static String constant(HierarchyLevel level, ClassificationValue value) {
        return level.getTypeName() + "." + value.identifier();
    }

    private static String joinCodes(List<Integer> codes) {
        return codes.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
