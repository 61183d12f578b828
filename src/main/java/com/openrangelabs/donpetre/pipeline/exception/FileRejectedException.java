package com.openrangelabs.donpetre.pipeline.exception;

/**
 * Raised at the upload boundary, before any processor runs, when a file breaks the
 * caller's extension or size policy.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class FileRejectedException extends IngestionException {

    public enum Reason {
        UNSUPPORTED_EXTENSION,
        TOO_LARGE
    }

    private final Reason reason;

    public FileRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
