package ru.tigran.jurisdiction.compiler.config;

import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings of one compiler run.
 *
 * @param input         the dataset to compile
 * @param outputRoot    root directory receiving the generated sources
 * @param targetPackage Java package of the generated types
 */
public record CompilerProperties(Path input, Path outputRoot, String targetPackage) {

    public static final String INPUT_PROPERTY = "jurisdiction.compiler.input";
    public static final String OUTPUT_PROPERTY = "jurisdiction.compiler.output";
    public static final String PACKAGE_PROPERTY = "jurisdiction.compiler.package";
    public static final String DEFAULT_PACKAGE = "ru.tigran.jurisdiction";

    public CompilerProperties {
        if (input == null) {
            throw new IllegalArgumentException("Dataset path is not configured (argument 1 or " + INPUT_PROPERTY + ")");
        }
        if (outputRoot == null) {
            throw new IllegalArgumentException("Output directory is not configured (argument 2 or " + OUTPUT_PROPERTY + ")");
        }
        if (targetPackage == null || !targetPackage.matches("[a-z_][a-z0-9_]*(\\.[a-z_][a-z0-9_]*)*")) {
            throw new IllegalArgumentException("Invalid target package: " + targetPackage);
        }
    }

    /**
     * Resolves settings from positional arguments {@code <dataset> <output-dir> [package]},
     * falling back to the {@code jurisdiction.compiler.*} properties for anything not given.
     *
     * @param args       command line arguments
     * @param properties fallback properties, usually {@link System#getProperties()}
     * @return resolved settings
     */
    public static CompilerProperties resolve(String[] args, Properties properties) {
        String input = argumentOrProperty(args, 0, properties, INPUT_PROPERTY, null);
        String output = argumentOrProperty(args, 1, properties, OUTPUT_PROPERTY, null);
        String targetPackage = argumentOrProperty(args, 2, properties, PACKAGE_PROPERTY, DEFAULT_PACKAGE);
        return new CompilerProperties(
                input == null ? null : Path.of(input),
                output == null ? null : Path.of(output),
                targetPackage
        );
    }

    private static String argumentOrProperty(String[] args, int index, Properties properties,
                                             String key, String defaultValue) {
        if (args != null && args.length > index && !args[index].isBlank()) {
            return args[index].trim();
        }
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
