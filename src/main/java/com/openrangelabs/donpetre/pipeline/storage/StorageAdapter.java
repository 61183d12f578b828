package com.openrangelabs.donpetre.pipeline.storage;

import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.UpsertOutcome;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Pluggable sink for ingested batches.
 *
 * <p>Implementations must be idempotent under repeated upserts of the same fingerprinted
 * record and must never mutate the records they are given. An instance may be shared by
 * concurrent ingestion runs only if its own methods are safe for concurrent use; the
 * framework adds no locking.
 */
public interface StorageAdapter {

    /**
     * Whether a record with this fingerprint has already been stored.
     */
    Mono<Boolean> exists(String fingerprint);

    /**
     * Write one batch. Called at most once per assembled batch and never retried by the
     * framework. Signal an error, or return a {@code FAILURE} outcome, when nothing was written.
     */
    Mono<UpsertOutcome> upsertBatch(List<DataRecord> records);

    default Mono<Void> close() {
        return Mono.empty();
    }
}
