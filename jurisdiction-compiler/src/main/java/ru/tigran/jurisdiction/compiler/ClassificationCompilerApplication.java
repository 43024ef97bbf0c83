package ru.tigran.jurisdiction.compiler;

import lombok.extern.slf4j.Slf4j;
import ru.tigran.jurisdiction.compiler.config.CompilerProperties;
import ru.tigran.jurisdiction.compiler.emit.GeneratedSource;
import ru.tigran.jurisdiction.compiler.emit.JavaSourceEmitter;
import ru.tigran.jurisdiction.compiler.emit.SourceWriter;
import ru.tigran.jurisdiction.compiler.feed.JsonRecordFeed;
import ru.tigran.jurisdiction.compiler.feed.RecordFeed;
import ru.tigran.jurisdiction.compiler.model.CompiledClassification;

import java.util.List;

/**
 * Build entry point: reads the dataset, compiles it and writes the generated sources.
 *
 * Usage: {@code ClassificationCompilerApplication <dataset.json> <output-dir> [package]}
 *
 * Runs inside the build JVM, so failures propagate as exceptions instead of exiting the process.
 */
@Slf4j
public class ClassificationCompilerApplication {

    private final ClassificationCompiler compiler;

    public ClassificationCompilerApplication(ClassificationCompiler compiler) {
        this.compiler = compiler;
    }

    public static void main(String[] args) {
        CompilerProperties properties = CompilerProperties.resolve(args, System.getProperties());
        new ClassificationCompilerApplication(new ClassificationCompiler())
                .run(new JsonRecordFeed(properties.input()), properties);
    }

    /**
     * Compiles the feed and writes the sources configured by {@code properties}.
     *
     * @param feed       dataset source
     * @param properties run settings
     * @return the compiled classification
     */
    public CompiledClassification run(RecordFeed feed, CompilerProperties properties) {
        log.info("Compiling jurisdiction classification from {} into package {}",
                properties.input(), properties.targetPackage());

        CompiledClassification classification = compiler.compile(feed);
        List<GeneratedSource> sources = new JavaSourceEmitter(properties.targetPackage()).emit(classification);
        int written = new SourceWriter(properties.outputRoot()).write(properties.targetPackage(), sources);

        log.info("Generated {} sources ({} rewritten) under {}",
                sources.size(), written, properties.outputRoot());
        return classification;
    }
}
