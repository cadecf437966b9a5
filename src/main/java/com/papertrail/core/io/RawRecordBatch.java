package com.papertrail.core.io;

import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.RawRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw records read from one collector batch, with the lines that could not be
 * turned into records.
 *
 * @param records  parsed records, in input order
 * @param warnings skipped or malformed entries
 */
public record RawRecordBatch(List<RawRecord> records, List<DataQualityWarning> warnings) {

    public RawRecordBatch {
        records = records != null ? List.copyOf(records) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static RawRecordBatch of(List<RawRecord> records) {
        return new RawRecordBatch(records, List.of());
    }

    public List<RawRecord> ofKind(EntityKind kind) {
        return records.stream().filter(r -> r.getKind() == kind).toList();
    }

    /**
     * Concatenates two batches, keeping both warning lists.
     */
    public RawRecordBatch merge(RawRecordBatch other) {
        List<RawRecord> allRecords = new ArrayList<>(records);
        allRecords.addAll(other.records);
        List<DataQualityWarning> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(other.warnings);
        return new RawRecordBatch(allRecords, allWarnings);
    }

    public int size() {
        return records.size();
    }
}
