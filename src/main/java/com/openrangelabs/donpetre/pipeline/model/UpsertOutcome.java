package com.openrangelabs.donpetre.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of writing one batch to storage.
 *
 * <p>The status distinguishes a fully written batch, a batch that landed on some
 * backends or for some records only, and a batch that no backend accepted. Callers
 * switch on {@link #getStatus()} and handle all three.
 */
public final class UpsertOutcome {

    private final UpsertStatus status;
    private final int writtenCount;
    private final Map<String, Boolean> backendSuccess;
    private final List<IngestionError> errors;

    private UpsertOutcome(UpsertStatus status, int writtenCount,
                          Map<String, Boolean> backendSuccess, List<IngestionError> errors) {
        this.status = status;
        this.writtenCount = writtenCount;
        this.backendSuccess = Collections.unmodifiableMap(new LinkedHashMap<>(backendSuccess));
        this.errors = List.copyOf(errors);
    }

    public static UpsertOutcome success(int writtenCount) {
        return new UpsertOutcome(UpsertStatus.SUCCESS, writtenCount, Map.of(), List.of());
    }

    public static UpsertOutcome success(int writtenCount, Map<String, Boolean> backendSuccess) {
        return new UpsertOutcome(UpsertStatus.SUCCESS, writtenCount, backendSuccess, List.of());
    }

    public static UpsertOutcome partialFailure(int writtenCount, Map<String, Boolean> backendSuccess,
                                               List<IngestionError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A partial failure must carry at least one error");
        }
        return new UpsertOutcome(UpsertStatus.PARTIAL_FAILURE, writtenCount, backendSuccess, errors);
    }

    public static UpsertOutcome failure(Map<String, Boolean> backendSuccess, List<IngestionError> errors) {
        return new UpsertOutcome(UpsertStatus.FAILURE, 0, backendSuccess, errors);
    }

    public UpsertStatus getStatus() { return status; }
    public int getWrittenCount() { return writtenCount; }
    public Map<String, Boolean> getBackendSuccess() { return backendSuccess; }
    public List<IngestionError> getErrors() { return errors; }

    public boolean isBackendSuccessful(String backend) {
        return Boolean.TRUE.equals(backendSuccess.get(backend));
    }

    public boolean isSuccess() {
        return status == UpsertStatus.SUCCESS;
    }

    public boolean isPartialFailure() {
        return status == UpsertStatus.PARTIAL_FAILURE;
    }

    public boolean isFailure() {
        return status == UpsertStatus.FAILURE;
    }

    @Override
    public String toString() {
        return "UpsertOutcome{" +
                "status=" + status +
                ", writtenCount=" + writtenCount +
                ", backendSuccess=" + backendSuccess +
                ", errors=" + errors.size() +
                '}';
    }
}
