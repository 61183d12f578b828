package com.openrangelabs.donpetre.pipeline.service;

/**
 * Receives processor failures when registered on the pipeline. The failing run then
 * completes with a failed result instead of an error signal.
 */
@FunctionalInterface
public interface IngestionErrorHandler {

    void handle(Throwable error, IngestionContext context);
}
