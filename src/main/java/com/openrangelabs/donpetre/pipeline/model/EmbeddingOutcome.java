package com.openrangelabs.donpetre.pipeline.model;

/**
 * Outcome of one embedding call inside a batch fan-out: exactly one of
 * {@code vector} and {@code error} is set.
 */
public final class EmbeddingOutcome {

    private final int recordIndex;
    private final float[] vector;
    private final Throwable error;

    private EmbeddingOutcome(int recordIndex, float[] vector, Throwable error) {
        this.recordIndex = recordIndex;
        this.vector = vector;
        this.error = error;
    }

    public static EmbeddingOutcome success(int recordIndex, float[] vector) {
        return new EmbeddingOutcome(recordIndex, vector, null);
    }

    public static EmbeddingOutcome failure(int recordIndex, Throwable error) {
        return new EmbeddingOutcome(recordIndex, null, error);
    }

    public int getRecordIndex() { return recordIndex; }
    public float[] getVector() { return vector; }
    public Throwable getError() { return error; }

    public boolean isSuccess() {
        return error == null;
    }
}
