package com.openrangelabs.donpetre.pipeline.processor;

/**
 * Notified after every batch with the running total of ingested records and the number
 * of records accepted from that batch.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(long totalIngested, int batchCount);
}
