package com.openrangelabs.donpetre.pipeline.processor;

import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.RecordBatch;
import reactor.core.publisher.Flux;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lazy, finite, single-pass sequence of batches produced from one source.
 *
 * <p>Batches are pulled on demand, so a consumer that stops requesting (or cancels)
 * stops the source from being read further. The stream can be consumed once; a second
 * subscription fails with {@link IllegalStateException}.
 */
public final class BatchStream {

    private final Flux<RecordBatch> batches;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    private BatchStream(Flux<RecordBatch> batches) {
        this.batches = batches;
    }

    public static BatchStream of(Flux<RecordBatch> batches) {
        return new BatchStream(batches);
    }

    /**
     * Chunks a record stream into batches of {@code batchSize}, flushing the final partial batch.
     */
    public static BatchStream fromRecords(Flux<DataRecord> records, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        return new BatchStream(records
                .buffer(batchSize)
                .index()
                .map(indexed -> new RecordBatch(indexed.getT1(), indexed.getT2())));
    }

    public static BatchStream failed(Throwable error) {
        return new BatchStream(Flux.error(error));
    }

    public Flux<RecordBatch> consume() {
        return Flux.defer(() -> consumed.compareAndSet(false, true)
                ? batches
                : Flux.error(new IllegalStateException("Batch stream is single-pass and was already consumed")));
    }

    public boolean isConsumed() {
        return consumed.get();
    }
}
