package ru.tigran.jurisdiction.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.jurisdiction.compiler.config.CompilerProperties;
import ru.tigran.jurisdiction.compiler.exception.DatasetValidationException;
import ru.tigran.jurisdiction.compiler.feed.RecordFeed;
import ru.tigran.jurisdiction.compiler.model.CompiledClassification;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClassificationCompilerApplication unit tests")
class ClassificationCompilerApplicationTest {

    @Mock
    private RecordFeed feed;

    @TempDir
    Path outputRoot;

    @Test
    @DisplayName("run - compiles the feed and writes all sources into the package directory")
    void runWritesSources() throws Exception {
        when(feed.records()).thenReturn(List.of(ClassificationCompilerTest.norway(), ClassificationCompilerTest.antarctica()));
        CompilerProperties properties = new CompilerProperties(Path.of("feed.json"), outputRoot, "com.example.geo");

        CompiledClassification classification = new ClassificationCompilerApplication(new ClassificationCompiler())
                .run(feed, properties);

        assertEquals(2, classification.definitions().size());
        Path packageDir = outputRoot.resolve("com/example/geo");
        for (String type : List.of("Alpha2", "Alpha3", "Region", "SubRegion", "IntermediateRegion", "GeneratedDefinitions")) {
            assertTrue(Files.isRegularFile(packageDir.resolve(type + ".java")), type + " written");
        }
        assertTrue(Files.readString(packageDir.resolve("Alpha3.java"), StandardCharsets.UTF_8).contains("NOR(578)"));
    }

    @Test
    @DisplayName("run - invalid dataset writes nothing")
    void runFailsWithoutOutput() {
        when(feed.records()).thenReturn(List.of());
        CompilerProperties properties = new CompilerProperties(Path.of("feed.json"), outputRoot, "com.example.geo");

        assertThrows(DatasetValidationException.class,
                () -> new ClassificationCompilerApplication(new ClassificationCompiler()).run(feed, properties));

        assertFalse(Files.exists(outputRoot.resolve("com")));
    }

    @Test
    @DisplayName("main - compiles the dataset given on the command line")
    void mainCompilesDataset() throws Exception {
        Path dataset = Path.of(getClass().getResource("/feed/sample-records.json").toURI());

        ClassificationCompilerApplication.main(new String[] {dataset.toString(), outputRoot.toString(), "com.example.geo"});

        String definitions = Files.readString(outputRoot.resolve("com/example/geo/GeneratedDefinitions.java"),
                StandardCharsets.UTF_8);
        assertTrue(definitions.contains("static final int COUNT = 3;"));
    }
}
