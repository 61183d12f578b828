package com.openrangelabs.donpetre.pipeline.processor;

import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import lombok.Builder;
import lombok.Value;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Caller-supplied hooks for one ingestion run. Every hook is optional.
 */
@Value
@Builder
public class IngestionHooks {

    private static final IngestionHooks NONE = IngestionHooks.builder().build();

    Predicate<DataRecord> validation;

    UnaryOperator<DataRecord> enrichment;

    ProgressListener progressListener;

    public static IngestionHooks none() {
        return NONE;
    }

    public boolean accepts(DataRecord record) {
        return validation == null || validation.test(record);
    }

    /**
     * Applies the enrichment hook. A hook returning null keeps the record as it was.
     */
    public DataRecord enrich(DataRecord record) {
        if (enrichment == null) {
            return record;
        }
        DataRecord enriched = enrichment.apply(record);
        return enriched != null ? enriched : record;
    }

    public void reportProgress(long totalIngested, int batchCount) {
        if (progressListener != null) {
            progressListener.onProgress(totalIngested, batchCount);
        }
    }
}
