package com.openrangelabs.donpetre.pipeline.processor;

import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.exception.StorageWriteException;
import com.openrangelabs.donpetre.pipeline.fingerprint.FingerprintFunction;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.IngestionResult;
import com.openrangelabs.donpetre.pipeline.model.RecordBatch;
import com.openrangelabs.donpetre.pipeline.model.UpsertOutcome;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Abstract base class for batch processors.
 *
 * <p>Subclasses only produce batches through {@link #batchGenerator(IngestionSource)}. For each
 * batch this class validates, enriches and fingerprints every record, skips duplicates, writes
 * what is left with a single {@link StorageAdapter#upsertBatch(List)} call and reports progress.
 * Batches are handled strictly one after another: the next batch is not pulled from the source
 * while the current one is being written.
 */
public abstract class AbstractBatchProcessor implements BatchProcessor {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final StorageAdapter storageAdapter;
    protected final BatchSettings settings;
    protected final FingerprintFunction fingerprintFunction;

    protected AbstractBatchProcessor(StorageAdapter storageAdapter, BatchSettings settings) {
        settings.validate();
        this.storageAdapter = storageAdapter;
        this.settings = settings;
        this.fingerprintFunction = settings.resolveFingerprintFunction();
        if (settings.getMaxConcurrentBatches() > 1) {
            logger.debug("max_concurrent_batches={} is advisory; batches are written sequentially",
                    settings.getMaxConcurrentBatches());
        }
    }

    /**
     * Template method producing the batches of one source.
     */
    protected abstract BatchStream batchGenerator(IngestionSource source);

    /**
     * Variant that may report source-level errors into the running result. Defaults to
     * {@link #batchGenerator(IngestionSource)}.
     */
    protected BatchStream batchGenerator(IngestionSource source, IngestionResult.Builder result) {
        return batchGenerator(source);
    }

    @Override
    public Mono<IngestionResult> ingest(IngestionSource source, IngestionHooks hooks) {
        return Mono.defer(() -> {
                    IngestionResult.Builder result = IngestionResult.builder(getSourceType(), source.getName());
                    Set<String> seenFingerprints = new HashSet<>();

                    return batchGenerator(source, result).consume()
                            .concatMap(batch -> processBatch(batch, hooks, result, seenFingerprints))
                            .then(Mono.fromCallable(result::build));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> logger.info("Ingested {} from {}: {} records in {} batches ({} duplicates, {} dropped)",
                        getSourceType(), source.getName(), result.getIngestedCount(), result.getBatchCount(),
                        result.getDuplicateCount(), result.getDroppedCount()))
                .doOnError(error -> logger.error("Ingestion of {} source {} failed: {}",
                        getSourceType(), source.getName(), error.getMessage()));
    }

    private Mono<Void> processBatch(RecordBatch batch, IngestionHooks hooks,
                                    IngestionResult.Builder result, Set<String> seenFingerprints) {
        return Flux.fromIterable(batch.getRecords())
                .concatMap(record -> prepare(record, hooks, result, seenFingerprints))
                .collectList()
                .flatMap(accepted -> write(batch, accepted, result))
                .doOnNext(accepted -> hooks.reportProgress(result.getIngestedCount(), accepted))
                .then();
    }

    /**
     * Validate, enrich and fingerprint one record. Empty when the record is dropped or a duplicate.
     */
    private Mono<DataRecord> prepare(DataRecord record, IngestionHooks hooks,
                                     IngestionResult.Builder result, Set<String> seenFingerprints) {
        if (!hooks.accepts(record)) {
            result.addDropped(1);
            return Mono.empty();
        }
        DataRecord enriched = hooks.enrich(record);
        String fingerprint = fingerprintFunction.fingerprint(enriched);

        if (!settings.isDeduplication()) {
            return Mono.just(enriched.stampFingerprint(fingerprint));
        }
        if (!seenFingerprints.add(fingerprint)) {
            result.addDuplicates(1);
            return Mono.empty();
        }
        return storageAdapter.exists(fingerprint)
                .flatMap(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        result.addDuplicates(1);
                        return Mono.<DataRecord>empty();
                    }
                    return Mono.just(enriched.stampFingerprint(fingerprint));
                });
    }

    private Mono<Integer> write(RecordBatch batch, List<DataRecord> accepted, IngestionResult.Builder result) {
        if (accepted.isEmpty()) {
            logger.debug("Batch {} had nothing new to write", batch.getSequence());
            return Mono.just(0);
        }
        return storageAdapter.upsertBatch(accepted)
                .flatMap(outcome -> handleOutcome(batch, accepted, outcome, result));
    }

    private Mono<Integer> handleOutcome(RecordBatch batch, List<DataRecord> accepted, UpsertOutcome outcome,
                                        IngestionResult.Builder result) {
        switch (outcome.getStatus()) {
            case FAILURE:
                return Mono.error(new StorageWriteException(
                        "No storage backend accepted batch " + batch.getSequence(), outcome.getErrors()));
            case PARTIAL_FAILURE:
                logger.warn("Batch {} partially written: {}", batch.getSequence(), outcome);
                break;
            default:
                logger.debug("Batch {} written: {} records", batch.getSequence(), accepted.size());
        }
        result.addIngested(accepted.size());
        result.addOutcome(outcome);
        return Mono.just(accepted.size());
    }
}
