package com.openrangelabs.donpetre.pipeline.fingerprint;

import com.openrangelabs.donpetre.pipeline.model.DataRecord;

/**
 * Computes the deduplication key of a record. Must be deterministic.
 */
@FunctionalInterface
public interface FingerprintFunction {

    String fingerprint(DataRecord record);
}
