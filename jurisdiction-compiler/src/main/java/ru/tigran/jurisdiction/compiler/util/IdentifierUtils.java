package ru.tigran.jurisdiction.compiler.util;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Utility class turning dataset names into Java identifiers and literals.
 */
public class IdentifierUtils {

    private IdentifierUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Converts a classification name into an enum constant name.
     *
     * Example:
     * Input:  "Latin America and the Caribbean"
     * Output: "LATIN_AMERICA_AND_THE_CARIBBEAN"
     *
     * @param name dataset name
     * @return upper snake case identifier, empty if the name has no letters or digits
     */
    public static String toConstantName(String name) {
        if (name == null) {
            return "";
        }
        String constant = Normalizer.normalize(name, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")              // Drop accents
                .replaceAll("[^A-Za-z0-9]+", "_")      // Any other run becomes a separator
                .replaceAll("^_+|_+$", "")
                .toUpperCase(Locale.ROOT);
        if (!constant.isEmpty() && Character.isDigit(constant.charAt(0))) {
            return "_" + constant;
        }
        return constant;
    }

    /**
     * Escapes a value for use inside a Java string literal.
     * Non-ASCII characters become unicode escapes so generated files are plain ASCII.
     *
     * @param value raw text
     * @return escaped text without surrounding quotes
     */
    public static String escapeJava(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
