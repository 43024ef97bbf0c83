package ru.tigran.jurisdiction.compiler.model;

import java.util.List;
import java.util.Map;

/**
 * Complete compiler output: definitions in feed order, the constants of every hierarchy level,
 * and the reverse index from each constant to the country codes carrying it.
 *
 * @param definitions one entry per feed record, feed order
 * @param classes     per level, distinct constants in first-seen order followed by UNDEFINED
 * @param groupings   per level, constant to member country codes in feed order
 */
public record CompiledClassification(
        List<CompiledDefinition> definitions,
        Map<HierarchyLevel, List<ClassificationValue>> classes,
        Map<HierarchyLevel, Map<ClassificationValue, List<Integer>>> groupings
) {

    /**
     * Alpha-2 codes in first-seen order.
     */
    public List<String> alpha2Codes() {
        return definitions.stream().map(CompiledDefinition::alpha2).toList();
    }

    /**
     * Alpha-3 codes in first-seen order.
     */
    public List<String> alpha3Codes() {
        return definitions.stream().map(CompiledDefinition::alpha3).toList();
    }

    public List<ClassificationValue> classes(HierarchyLevel level) {
        return classes.get(level);
    }

    public List<Integer> members(HierarchyLevel level, ClassificationValue value) {
        return groupings.get(level).getOrDefault(value, List.of());
    }
}
