package com.openrangelabs.donpetre.pipeline.exception;

import com.openrangelabs.donpetre.pipeline.model.IngestionError;

import java.util.List;

/**
 * Thrown when no storage backend accepted a batch.
 *
 * <p>Partial failures are not exceptions; they are reported through
 * {@link com.openrangelabs.donpetre.pipeline.model.UpsertOutcome}.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class StorageWriteException extends IngestionException {

    private final List<IngestionError> errors;

    public StorageWriteException(String message, List<IngestionError> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public List<IngestionError> getErrors() {
        return errors;
    }
}
