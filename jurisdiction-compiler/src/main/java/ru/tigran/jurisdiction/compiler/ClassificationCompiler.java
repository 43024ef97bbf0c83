package ru.tigran.jurisdiction.compiler;

import lombok.extern.slf4j.Slf4j;
import ru.tigran.jurisdiction.compiler.exception.DatasetValidationException;
import ru.tigran.jurisdiction.compiler.exception.ErrorCode;
import ru.tigran.jurisdiction.compiler.feed.JurisdictionRecord;
import ru.tigran.jurisdiction.compiler.feed.RecordFeed;
import ru.tigran.jurisdiction.compiler.model.ClassificationValue;
import ru.tigran.jurisdiction.compiler.model.CompiledClassification;
import ru.tigran.jurisdiction.compiler.model.CompiledDefinition;
import ru.tigran.jurisdiction.compiler.model.HierarchyLevel;
import ru.tigran.jurisdiction.compiler.util.IdentifierUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiles the raw jurisdiction dataset into the closed classification tables.
 *
 * Principle:
 * - Every record becomes exactly one definition, in feed order
 * - Alpha-2, alpha-3 and numeric country codes must be unique across the feed
 * - Each distinct region, sub-region and intermediate-region name becomes one constant,
 *   blank names fall into the synthetic UNDEFINED constant present at every level
 * - For each constant the country codes carrying it are grouped into a reverse index
 *
 * Numeric codes:
 * - country code: unsigned integer in [1, 999], anything else aborts
 * - region, sub-region and intermediate-region codes: blank or 0 means "not applicable",
 *   anything else must be an unsigned 16-bit integer
 *
 * Every generated enum, UNDEFINED included, holds at most {@value #MAX_CONSTANTS} constants
 * so its ordinal fits in a byte.
 *
 * Any inconsistency throws {@link DatasetValidationException}; no partial result is returned.
 */
@Slf4j
public class ClassificationCompiler {

    static final int MAX_COUNTRY_CODE = 999;
    static final int MAX_CONSTANTS = 256;
    private static final int MAX_U16 = 0xFFFF;
    private static final Pattern DIGITS = Pattern.compile("[0-9]{1,5}");
    private static final Pattern ALPHA = Pattern.compile("[A-Z]+");

    /**
     * Reads the feed once and compiles it.
     *
     * @param feed source of raw records
     * @return compiled classification
     */
    public CompiledClassification compile(RecordFeed feed) {
        return compile(feed.records());
    }

    /**
     * Compiles an ordered list of raw records.
     *
     * @param records records in feed order
     * @return compiled classification
     */
    public CompiledClassification compile(List<JurisdictionRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new DatasetValidationException(ErrorCode.EMPTY_FEED, "nothing to compile");
        }

        Map<HierarchyLevel, ClassRegistry> classRegistries = new EnumMap<>(HierarchyLevel.class);
        for (HierarchyLevel level : HierarchyLevel.values()) {
            classRegistries.put(level, new ClassRegistry(level));
        }

        Set<Integer> countryCodes = new HashSet<>();
        Set<String> alpha2Codes = new HashSet<>();
        Set<String> alpha3Codes = new HashSet<>();
        List<CompiledDefinition> definitions = new ArrayList<>(records.size());

        for (int i = 0; i < records.size(); i++) {
            JurisdictionRecord record = records.get(i);
            String where = "record #" + i + " (" + record.name() + ")";

            int countryCode = parseCountryCode(record.countryCode(), where);
            String alpha2 = requireAlpha(record.alpha2(), 2, where);
            String alpha3 = requireAlpha(record.alpha3(), 3, where);

            if (!countryCodes.add(countryCode)) {
                throw new DatasetValidationException(ErrorCode.DUPLICATE_COUNTRY_CODE, countryCode + " at " + where);
            }
            if (!alpha2Codes.add(alpha2)) {
                throw new DatasetValidationException(ErrorCode.DUPLICATE_ALPHA2, alpha2 + " at " + where);
            }
            if (!alpha3Codes.add(alpha3)) {
                throw new DatasetValidationException(ErrorCode.DUPLICATE_ALPHA3, alpha3 + " at " + where);
            }

            int intermediateCode = parseHierarchyCode(record.intermediateRegionCode(), "intermediate-region-code", where);
            definitions.add(new CompiledDefinition(
                    countryCode,
                    record.name() == null ? "" : record.name(),
                    alpha2,
                    alpha3,
                    classRegistries.get(HierarchyLevel.REGION).classify(record.region(), where),
                    classRegistries.get(HierarchyLevel.SUB_REGION).classify(record.subRegion(), where),
                    classRegistries.get(HierarchyLevel.INTERMEDIATE_REGION).classify(record.intermediateRegion(), where),
                    parseHierarchyCode(record.regionCode(), "region-code", where),
                    parseHierarchyCode(record.subRegionCode(), "sub-region-code", where),
                    intermediateCode == 0 ? OptionalInt.empty() : OptionalInt.of(intermediateCode)
            ));
        }

        requireByteSized("Alpha2/Alpha3", definitions.size());

        Map<HierarchyLevel, List<ClassificationValue>> classes = new EnumMap<>(HierarchyLevel.class);
        Map<HierarchyLevel, Map<ClassificationValue, List<Integer>>> groupings = new EnumMap<>(HierarchyLevel.class);
        for (HierarchyLevel level : HierarchyLevel.values()) {
            List<ClassificationValue> values = classRegistries.get(level).values();
            requireByteSized(level.getTypeName(), values.size());
            classes.put(level, values);
            groupings.put(level, group(level, values, definitions));
        }

        log.info("Compiled {} jurisdiction definitions ({} regions, {} sub-regions, {} intermediate regions)",
                definitions.size(),
                classes.get(HierarchyLevel.REGION).size(),
                classes.get(HierarchyLevel.SUB_REGION).size(),
                classes.get(HierarchyLevel.INTERMEDIATE_REGION).size());

        return new CompiledClassification(
                Collections.unmodifiableList(definitions),
                Collections.unmodifiableMap(classes),
                Collections.unmodifiableMap(groupings)
        );
    }

    private Map<ClassificationValue, List<Integer>> group(HierarchyLevel level,
                                                          List<ClassificationValue> values,
                                                          List<CompiledDefinition> definitions) {
        Map<ClassificationValue, List<Integer>> grouping = new LinkedHashMap<>();
        for (ClassificationValue value : values) {
            grouping.put(value, new ArrayList<>());
        }
        for (CompiledDefinition definition : definitions) {
            grouping.get(definition.classification(level)).add(definition.countryCode());
        }

        Map<ClassificationValue, List<Integer>> frozen = new LinkedHashMap<>();
        grouping.forEach((value, codes) -> {
            log.debug("{} {} groups {} jurisdictions", level.getTypeName(), value.identifier(), codes.size());
            frozen.put(value, List.copyOf(codes));
        });
        return Collections.unmodifiableMap(frozen);
    }

    static int parseCountryCode(String text, String where) {
        int value = parseUnsigned16(text, "country-code", where);
        if (value < 1 || value > MAX_COUNTRY_CODE) {
            throw new DatasetValidationException(ErrorCode.MALFORMED_NUMERIC_CODE,
                    "country-code '" + text + "' outside [1, " + MAX_COUNTRY_CODE + "] at " + where);
        }
        return value;
    }

    /**
     * Parses a region, sub-region or intermediate-region code. Blank text yields the
     * "not applicable" sentinel 0, the same value the dataset uses explicitly.
     */
    static int parseHierarchyCode(String text, String field, String where) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return parseUnsigned16(text, field, where);
    }

    private static int parseUnsigned16(String text, String field, String where) {
        String trimmed = text == null ? "" : text.trim();
        if (!DIGITS.matcher(trimmed).matches()) {
            throw new DatasetValidationException(ErrorCode.MALFORMED_NUMERIC_CODE,
                    field + " '" + text + "' at " + where);
        }
        int value = Integer.parseInt(trimmed);
        if (value > MAX_U16) {
            throw new DatasetValidationException(ErrorCode.MALFORMED_NUMERIC_CODE,
                    field + " '" + text + "' exceeds " + MAX_U16 + " at " + where);
        }
        return value;
    }

    private static void requireByteSized(String typeName, int constants) {
        if (constants > MAX_CONSTANTS) {
            throw new DatasetValidationException(ErrorCode.TOO_MANY_CONSTANTS,
                    typeName + " has " + constants + " constants, at most " + MAX_CONSTANTS + " allowed");
        }
    }

    private static String requireAlpha(String code, int length, String where) {
        if (code == null || code.length() != length || !ALPHA.matcher(code).matches()) {
            throw new DatasetValidationException(ErrorCode.INVALID_ALPHA_CODE,
                    "expected " + length + " letters, got '" + code + "' at " + where);
        }
        return code;
    }

    /**
     * Collects the distinct names of one hierarchy level in first-seen order.
     */
    private static final class ClassRegistry {
        private final HierarchyLevel level;
        private final Map<String, ClassificationValue> byLabel = new LinkedHashMap<>();
        private final Map<String, String> labelByIdentifier = new HashMap<>();

        ClassRegistry(HierarchyLevel level) {
            this.level = level;
            labelByIdentifier.put(ClassificationValue.UNDEFINED.identifier(), ClassificationValue.UNDEFINED.label());
        }

        ClassificationValue classify(String label, String where) {
            if (label == null || label.isBlank()) {
                return ClassificationValue.UNDEFINED;
            }
            ClassificationValue known = byLabel.get(label);
            if (known != null) {
                return known;
            }

            String identifier = IdentifierUtils.toConstantName(label);
            String previous = labelByIdentifier.putIfAbsent(identifier, label);
            if (identifier.isEmpty() || previous != null) {
                throw new DatasetValidationException(ErrorCode.IDENTIFIER_COLLISION,
                        level.getTypeName() + " '" + label + "' maps to '" + identifier + "'"
                                + (previous == null ? "" : ", already used by '" + previous + "'")
                                + " at " + where);
            }

            ClassificationValue value = new ClassificationValue(identifier, label);
            byLabel.put(label, value);
            return value;
        }

        List<ClassificationValue> values() {
            List<ClassificationValue> values = new ArrayList<>(byLabel.values());
            values.add(ClassificationValue.UNDEFINED);
            return List.copyOf(values);
        }
    }
}
