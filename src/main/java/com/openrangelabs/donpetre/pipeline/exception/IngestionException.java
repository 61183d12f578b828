package com.openrangelabs.donpetre.pipeline.exception;

/**
 * Base exception for ingestion operations.
 *
 * <p>Represents source-exhaustion errors such as a malformed file, an unreachable API
 * or a storage backend that rejected a whole batch. These propagate out of
 * {@code ingest} unless the pipeline has an error handler registered.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class IngestionException extends RuntimeException {

    /**
     * Constructs a new ingestion exception with the specified detail message.
     *
     * @param message the detail message
     */
    public IngestionException(String message) {
        super(message);
    }

    /**
     * Constructs a new ingestion exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new ingestion exception with the specified cause.
     *
     * @param cause the cause
     */
    public IngestionException(Throwable cause) {
        super(cause);
    }
}
