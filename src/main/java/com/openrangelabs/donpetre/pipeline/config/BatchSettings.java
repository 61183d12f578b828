package com.openrangelabs.donpetre.pipeline.config;

import com.openrangelabs.donpetre.pipeline.fingerprint.ContentFingerprinter;
import com.openrangelabs.donpetre.pipeline.fingerprint.FingerprintFunction;
import lombok.Builder;
import lombok.Value;

/**
 * Batch-source configuration shared by every batch processor.
 */
@Value
@Builder(toBuilder = true)
public class BatchSettings {

    @Builder.Default
    int batchSize = 100;

    @Builder.Default
    boolean deduplication = true;

    /**
     * Advisory only: batches of one run are always written one after another.
     */
    @Builder.Default
    int maxConcurrentBatches = 1;

    /**
     * Replaces the content fingerprint, e.g. for partial-key dedup. Null means default.
     */
    FingerprintFunction fingerprintFunction;

    public static BatchSettings defaults() {
        return BatchSettings.builder().build();
    }

    public FingerprintFunction resolveFingerprintFunction() {
        return fingerprintFunction != null ? fingerprintFunction : new ContentFingerprinter();
    }

    public void validate() {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batch_size must be greater than 0, got " + batchSize);
        }
        if (maxConcurrentBatches <= 0) {
            throw new IllegalArgumentException("max_concurrent_batches must be greater than 0, got "
                    + maxConcurrentBatches);
        }
    }
}
