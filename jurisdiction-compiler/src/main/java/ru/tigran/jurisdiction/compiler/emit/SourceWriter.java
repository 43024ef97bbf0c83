package ru.tigran.jurisdiction.compiler.emit;

import lombok.extern.slf4j.Slf4j;
import ru.tigran.jurisdiction.compiler.exception.CompilerIoException;
import ru.tigran.jurisdiction.compiler.exception.ErrorCode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes generated sources below a source root, one directory level per package segment.
 * Files whose content is unchanged are left untouched so incremental builds stay incremental.
 */
@Slf4j
public class SourceWriter {

    private final Path outputRoot;

    public SourceWriter(Path outputRoot) {
        this.outputRoot = outputRoot;
    }

    /**
     * Writes all sources into the package directory.
     *
     * @param targetPackage package of the generated types
     * @param sources       rendered sources
     * @return number of files actually rewritten
     */
    public int write(String targetPackage, List<GeneratedSource> sources) {
        Path packageDir = outputRoot.resolve(targetPackage.replace('.', '/'));
        int written = 0;
        try {
            Files.createDirectories(packageDir);
            for (GeneratedSource source : sources) {
                Path file = packageDir.resolve(source.fileName());
                if (Files.exists(file) && Files.readString(file, StandardCharsets.UTF_8).equals(source.content())) {
                    log.debug("Generated source {} is up to date", file);
                    continue;
                }
                Files.writeString(file, source.content(), StandardCharsets.UTF_8);
                written++;
                log.info("Wrote {}", file);
            }
        } catch (IOException e) {
            throw new CompilerIoException(ErrorCode.OUTPUT_UNWRITABLE, packageDir.toString(), e);
        }
        return written;
    }
}
