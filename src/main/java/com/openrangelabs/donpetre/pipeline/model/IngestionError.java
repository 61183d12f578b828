package com.openrangelabs.donpetre.pipeline.model;

import lombok.Value;

/**
 * One reconciliation-ready failure: which backend, which record of the batch, what happened.
 * {@code recordIndex} is -1 when the failure covers the whole batch.
 */
@Value
public class IngestionError {

    String backend;
    int recordIndex;
    String message;

    public static IngestionError forBatch(String backend, String message) {
        return new IngestionError(backend, -1, message);
    }

    public static IngestionError forRecord(String backend, int recordIndex, String message) {
        return new IngestionError(backend, recordIndex, message);
    }
}
