package ru.tigran.jurisdiction.compiler.feed;

import java.util.List;

/**
 * Source of raw jurisdiction records, consumed once per compilation.
 */
public interface RecordFeed {
    /**
     * Reads every record of the dataset.
     *
     * @return records in stable feed order
     */
    List<JurisdictionRecord> records();
}
