package ru.tigran.jurisdiction.compiler.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import ru.tigran.jurisdiction.compiler.exception.CompilerIoException;
import ru.tigran.jurisdiction.compiler.exception.ErrorCode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Record feed backed by the JSON array published alongside the ISO 3166 / M49 tables.
 */
@Slf4j
@RequiredArgsConstructor
public class JsonRecordFeed implements RecordFeed {

    private static final TypeReference<List<JurisdictionRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path dataset;
    private final ObjectMapper objectMapper;

    public JsonRecordFeed(Path dataset) {
        this(dataset, new ObjectMapper());
    }

    @Override
    public List<JurisdictionRecord> records() {
        log.debug("Reading jurisdiction records from {}", dataset);
        try (InputStream in = Files.newInputStream(dataset)) {
            List<JurisdictionRecord> records = objectMapper.readValue(in, RECORD_LIST);
            log.info("Read {} jurisdiction records from {}", records.size(), dataset);
            return List.copyOf(records);
        } catch (IOException e) {
            throw new CompilerIoException(ErrorCode.FEED_UNREADABLE, dataset.toString(), e);
        }
    }
}
