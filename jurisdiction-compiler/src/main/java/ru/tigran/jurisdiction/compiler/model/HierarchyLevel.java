package ru.tigran.jurisdiction.compiler.model;

/**
 * The three nested levels of the UN M49 grouping, each compiled into its own enum.
 */
public enum HierarchyLevel {
    REGION("Region", "The high level region a jurisdiction may zone to."),
    SUB_REGION("SubRegion", "A subdivision within a {@link Region}."),
    INTERMEDIATE_REGION("IntermediateRegion", "A subdivision within a {@link SubRegion}, defined for a few sub-regions only.");

    private final String typeName;
    private final String description;

    HierarchyLevel(String typeName, String description) {
        this.typeName = typeName;
        this.description = description;
    }

    /**
     * Simple name of the generated enum for this level.
     */
    public String getTypeName() {
        return typeName;
    }

    public String getDescription() {
        return description;
    }
}
