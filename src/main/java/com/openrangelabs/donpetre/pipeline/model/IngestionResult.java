package com.openrangelabs.donpetre.pipeline.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one ingestion run.
 *
 * <p>{@code ingestedCount} never includes duplicates or records dropped by validation.
 * Backend flags are the conjunction over every batch written during the run.
 */
public class IngestionResult {

    private final String sourceType;
    private final String sourceName;
    private final LocalDateTime startTime;
    private final LocalDateTime endTime;
    private final long ingestedCount;
    private final long duplicateCount;
    private final long droppedCount;
    private final int batchCount;
    private final List<IngestionError> errors;
    private final Map<String, Boolean> backendSuccess;
    private final UpsertStatus status;

    private IngestionResult(Builder builder) {
        this.sourceType = builder.sourceType;
        this.sourceName = builder.sourceName;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.ingestedCount = builder.ingestedCount;
        this.duplicateCount = builder.duplicateCount;
        this.droppedCount = builder.droppedCount;
        this.batchCount = builder.batchCount;
        this.errors = List.copyOf(builder.errors);
        this.backendSuccess = Collections.unmodifiableMap(new LinkedHashMap<>(builder.backendSuccess));
        this.status = builder.resolveStatus();
    }

    public static Builder builder(String sourceType, String sourceName) {
        return new Builder(sourceType, sourceName);
    }

    public static IngestionResult failed(String sourceType, String sourceName, Throwable error) {
        return builder(sourceType, sourceName)
                .addError(IngestionError.forBatch(sourceType, error.getMessage()))
                .failed()
                .build();
    }

    /**
     * Aggregates several results, e.g. one per file of a directory.
     */
    public static IngestionResult combine(String sourceType, String sourceName, List<IngestionResult> results) {
        Builder builder = builder(sourceType, sourceName);
        boolean anyFailed = false;
        boolean anySucceeded = false;
        for (IngestionResult result : results) {
            builder.ingestedCount += result.ingestedCount;
            builder.duplicateCount += result.duplicateCount;
            builder.droppedCount += result.droppedCount;
            builder.batchCount += result.batchCount;
            builder.errors.addAll(result.errors);
            result.backendSuccess.forEach(builder::backend);
            if (result.status == UpsertStatus.FAILURE) {
                anyFailed = true;
            } else {
                anySucceeded = true;
            }
        }
        if (anyFailed && !anySucceeded) {
            builder.failed();
        }
        if (!results.isEmpty()) {
            builder.startTime(results.get(0).startTime);
        }
        return builder.build();
    }

    public String getSourceType() { return sourceType; }
    public String getSourceName() { return sourceName; }
    public LocalDateTime getStartTime() { return startTime; }
    public LocalDateTime getEndTime() { return endTime; }
    public long getIngestedCount() { return ingestedCount; }
    public long getDuplicateCount() { return duplicateCount; }
    public long getDroppedCount() { return droppedCount; }
    public int getBatchCount() { return batchCount; }
    public List<IngestionError> getErrors() { return errors; }
    public Map<String, Boolean> getBackendSuccess() { return backendSuccess; }
    public UpsertStatus getStatus() { return status; }

    public boolean isFullyIngested() {
        return status == UpsertStatus.SUCCESS;
    }

    public boolean isPartialFailure() {
        return status == UpsertStatus.PARTIAL_FAILURE;
    }

    public boolean isFailed() {
        return status == UpsertStatus.FAILURE;
    }

    public static class Builder {
        private final String sourceType;
        private final String sourceName;
        private LocalDateTime startTime = LocalDateTime.now();
        private LocalDateTime endTime;
        private long ingestedCount = 0;
        private long duplicateCount = 0;
        private long droppedCount = 0;
        private int batchCount = 0;
        private final List<IngestionError> errors = new ArrayList<>();
        private final Map<String, Boolean> backendSuccess = new LinkedHashMap<>();
        private boolean failed = false;

        private Builder(String sourceType, String sourceName) {
            this.sourceType = sourceType;
            this.sourceName = sourceName;
        }

        public Builder startTime(LocalDateTime startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(LocalDateTime endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder addIngested(long count) {
            this.ingestedCount += count;
            return this;
        }

        public Builder addDuplicates(long count) {
            this.duplicateCount += count;
            return this;
        }

        public Builder addDropped(long count) {
            this.droppedCount += count;
            return this;
        }

        public Builder addError(IngestionError error) {
            this.errors.add(error);
            return this;
        }

        public Builder backend(String backend, boolean success) {
            this.backendSuccess.merge(backend, success, Boolean::logicalAnd);
            return this;
        }

        /**
         * Folds one batch write's errors and backend flags into the run. Counts are added
         * separately through {@link #addIngested(long)}.
         */
        public Builder addOutcome(UpsertOutcome outcome) {
            this.batchCount++;
            this.errors.addAll(outcome.getErrors());
            outcome.getBackendSuccess().forEach(this::backend);
            return this;
        }

        public Builder failed() {
            this.failed = true;
            return this;
        }

        public long getIngestedCount() {
            return ingestedCount;
        }

        public int getBatchCount() {
            return batchCount;
        }

        private UpsertStatus resolveStatus() {
            if (failed) {
                return UpsertStatus.FAILURE;
            }
            return errors.isEmpty() ? UpsertStatus.SUCCESS : UpsertStatus.PARTIAL_FAILURE;
        }

        public IngestionResult build() {
            if (endTime == null) {
                endTime = LocalDateTime.now();
            }
            return new IngestionResult(this);
        }
    }

    @Override
    public String toString() {
        return "IngestionResult{" +
                "sourceType='" + sourceType + '\'' +
                ", sourceName='" + sourceName + '\'' +
                ", ingestedCount=" + ingestedCount +
                ", duplicateCount=" + duplicateCount +
                ", droppedCount=" + droppedCount +
                ", batchCount=" + batchCount +
                ", errors=" + errors.size() +
                ", status=" + status +
                ", duration=" + (endTime != null ?
                Duration.between(startTime, endTime) : "ongoing") +
                '}';
    }
}
