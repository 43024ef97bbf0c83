package ru.tigran.jurisdiction.compiler.feed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.tigran.jurisdiction.compiler.exception.CompilerIoException;
import ru.tigran.jurisdiction.compiler.exception.ErrorCode;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonRecordFeed unit tests")
class JsonRecordFeedTest {

    private static Path sampleFeed() throws URISyntaxException {
        return Path.of(JsonRecordFeedTest.class.getResource("/feed/sample-records.json").toURI());
    }

    @Test
    @DisplayName("records - maps hyphenated keys and ignores unknown ones")
    void readsSampleFeed() throws Exception {
        List<JurisdictionRecord> records = new JsonRecordFeed(sampleFeed()).records();

        assertEquals(3, records.size());
        JurisdictionRecord norway = records.get(0);
        assertEquals("Norway", norway.name());
        assertEquals("NO", norway.alpha2());
        assertEquals("NOR", norway.alpha3());
        assertEquals("578", norway.countryCode());
        assertEquals("ISO 3166-2:NO", norway.iso31662());
        assertEquals("Europe", norway.region());
        assertEquals("Northern Europe", norway.subRegion());
        assertEquals("", norway.intermediateRegion());
        assertEquals("150", norway.regionCode());
        assertEquals("154", norway.subRegionCode());
        assertEquals("", norway.intermediateRegionCode());
    }

    @Test
    @DisplayName("records - keeps feed order and non-ASCII names")
    void keepsOrderAndNames() throws Exception {
        List<JurisdictionRecord> records = new JsonRecordFeed(sampleFeed()).records();

        assertEquals(List.of("NO", "AQ", "CI"), records.stream().map(JurisdictionRecord::alpha2).toList());
        assertEquals("Côte d'Ivoire", records.get(2).name());
        assertEquals("011", records.get(2).intermediateRegionCode());
    }

    @Test
    @DisplayName("records - returned list is immutable")
    void returnsImmutableList() throws Exception {
        List<JurisdictionRecord> records = new JsonRecordFeed(sampleFeed()).records();

        assertThrows(UnsupportedOperationException.class, () -> records.add(records.get(0)));
    }

    @Test
    @DisplayName("records - missing file fails with FEED_UNREADABLE")
    void missingFile(@TempDir Path dir) {
        Path missing = dir.resolve("missing.json");

        CompilerIoException exception = assertThrows(CompilerIoException.class,
                () -> new JsonRecordFeed(missing).records());

        assertEquals(ErrorCode.FEED_UNREADABLE.getCode(), exception.getErrorCode());
        assertTrue(exception.getMessage().contains("missing.json"));
    }

    @Test
    @DisplayName("records - malformed JSON fails with FEED_UNREADABLE")
    void malformedJson(@TempDir Path dir) throws Exception {
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "[{\"name\": \"Norway\",", StandardCharsets.UTF_8);

        CompilerIoException exception = assertThrows(CompilerIoException.class,
                () -> new JsonRecordFeed(broken).records());

        assertEquals(ErrorCode.FEED_UNREADABLE.getCode(), exception.getErrorCode());
        assertNotNull(exception.getCause());
    }
}
