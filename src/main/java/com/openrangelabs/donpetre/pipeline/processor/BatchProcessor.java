package com.openrangelabs.donpetre.pipeline.processor;

import com.openrangelabs.donpetre.pipeline.model.IngestionResult;
import reactor.core.publisher.Mono;

/**
 * Source-format-specific component that turns a source into stored batches.
 */
public interface BatchProcessor {

    /**
     * Key under which the pipeline routes sources to this processor, e.g. {@code csv}.
     */
    String getSourceType();

    /**
     * Ingest one source. The returned {@link IngestionResult} counts stored records,
     * excluding duplicates and records dropped by validation. Source and storage errors are
     * signalled as errors; partial backend failures are reported in the result.
     */
    Mono<IngestionResult> ingest(IngestionSource source, IngestionHooks hooks);

    default Mono<IngestionResult> ingest(IngestionSource source) {
        return ingest(source, IngestionHooks.none());
    }
}
