package com.openrangelabs.donpetre.pipeline.model;

import java.util.List;

/**
 * Ordered, bounded group of records handed to storage as one unit.
 */
public class RecordBatch {

    private final long sequence;
    private final List<DataRecord> records;

    public RecordBatch(long sequence, List<DataRecord> records) {
        this.sequence = sequence;
        this.records = List.copyOf(records);
    }

    public long getSequence() { return sequence; }
    public List<DataRecord> getRecords() { return records; }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        return "RecordBatch{" +
                "sequence=" + sequence +
                ", size=" + records.size() +
                '}';
    }
}
