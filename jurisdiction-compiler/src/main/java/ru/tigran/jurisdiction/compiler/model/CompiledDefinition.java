package ru.tigran.jurisdiction.compiler.model;

import java.util.OptionalInt;

/**
 * A validated dataset record joined with its classification constants.
 * Region and sub-region codes use 0 for "not applicable"; the intermediate code is absent instead.
 */
public record CompiledDefinition(
        int countryCode,
        String name,
        String alpha2,
        String alpha3,
        ClassificationValue region,
        ClassificationValue subRegion,
        ClassificationValue intermediateRegion,
        int regionCode,
        int subRegionCode,
        OptionalInt intermediateRegionCode
) {

    public ClassificationValue classification(HierarchyLevel level) {
        return switch (level) {
            case REGION -> region;
            case SUB_REGION -> subRegion;
            case INTERMEDIATE_REGION -> intermediateRegion;
        };
    }
}
