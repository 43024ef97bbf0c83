package ru.tigran.jurisdiction.compiler.emit;

/**
 * A rendered compilation unit.
 *
 * @param typeName simple name of the top-level type, also the file name without extension
 * @param content  complete Java source text
 */
public record GeneratedSource(String typeName, String content) {

    public String fileName() {
        return typeName + ".java";
    }
}
