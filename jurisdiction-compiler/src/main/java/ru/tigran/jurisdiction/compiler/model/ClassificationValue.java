package ru.tigran.jurisdiction.compiler.model;

/**
 * One constant of a generated hierarchy enum.
 *
 * @param identifier Java constant name, e.g. NORTHERN_EUROPE
 * @param label      name as it appears in the dataset, empty for {@link #UNDEFINED}
 */
public record ClassificationValue(String identifier, String label) {

    /**
     * Synthetic constant present at every level, standing for "no assignment".
     */
    public static final ClassificationValue UNDEFINED = new ClassificationValue("UNDEFINED", "");

    public boolean isUndefined() {
        return UNDEFINED.equals(this);
    }
}
