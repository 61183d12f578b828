package com.openrangelabs.donpetre.pipeline.storage.dual;

import com.openrangelabs.donpetre.pipeline.fingerprint.ContentFingerprinter;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.EmbeddingOutcome;
import com.openrangelabs.donpetre.pipeline.model.IngestionError;
import com.openrangelabs.donpetre.pipeline.model.UpsertOutcome;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes each batch to a structured store and a vector store, embedding every record first.
 *
 * <p>Embedding calls for a batch run concurrently, capped by {@code embeddingConcurrency}
 * independently of the batch size. Every call settles before the writes start and a failed
 * call never cancels its siblings. The structured store is always written before the vector
 * store; a failure of either write is collected and the other write still happens.
 *
 * <p>Records whose embedding failed are written to the structured store only, flagged
 * {@code embedded=false}.
 */
public class DualBackendStorageAdapter implements StorageAdapter {

    public static final String STRUCTURED_BACKEND = "structured";
    public static final String VECTOR_BACKEND = "vector";
    public static final String EMBEDDING_STAGE = "embedding";

    static final int PAYLOAD_CONTENT_LIMIT = 1000;

    private static final Logger logger = LoggerFactory.getLogger(DualBackendStorageAdapter.class);

    private final StructuredStore structuredStore;
    private final VectorStore vectorStore;
    private final EmbeddingService embeddingService;
    private final String embeddingModel;
    private final int embeddingConcurrency;
    private final ContentFingerprinter fingerprinter;

    public DualBackendStorageAdapter(StructuredStore structuredStore,
                                     VectorStore vectorStore,
                                     EmbeddingService embeddingService,
                                     String embeddingModel,
                                     int embeddingConcurrency) {
        if (embeddingConcurrency <= 0) {
            throw new IllegalArgumentException("embeddingConcurrency must be positive");
        }
        this.structuredStore = structuredStore;
        this.vectorStore = vectorStore;
        this.embeddingService = embeddingService;
        this.embeddingModel = embeddingModel;
        this.embeddingConcurrency = embeddingConcurrency;
        this.fingerprinter = new ContentFingerprinter();
    }

    @Override
    public Mono<Boolean> exists(String fingerprint) {
        return structuredStore.exists(fingerprint);
    }

    @Override
    public Mono<UpsertOutcome> upsertBatch(List<DataRecord> records) {
        if (records.isEmpty()) {
            return Mono.just(UpsertOutcome.success(0));
        }
        List<DataRecord> snapshot = records.stream()
                .map(DataRecord::copy)
                .collect(Collectors.toList());

        return Flux.range(0, snapshot.size())
                .flatMapSequential(index -> embed(index, snapshot.get(index)), embeddingConcurrency)
                .collectList()
                .flatMap(outcomes -> writeBoth(snapshot, outcomes));
    }

    @Override
    public Mono<Void> close() {
        return Mono.when(structuredStore.close(), vectorStore.close());
    }

    private Mono<EmbeddingOutcome> embed(int index, DataRecord record) {
        return Mono.defer(() -> embeddingService.generate(fingerprinter.canonicalJson(record), embeddingModel))
                .map(vector -> EmbeddingOutcome.success(index, vector))
                .switchIfEmpty(Mono.fromSupplier(() ->
                        EmbeddingOutcome.failure(index, new IllegalStateException("empty embedding"))))
                .onErrorResume(error -> {
                    logger.warn("Embedding failed for record {}: {}", index, error.getMessage());
                    return Mono.just(EmbeddingOutcome.failure(index, error));
                });
    }

    /**
     * Name-based UUID of the record's fingerprint, so a re-upserted record keeps its id in both
     * stores. Unstamped records are fingerprinted here.
     */
    private String documentId(DataRecord record) {
        String fingerprint = record.getFingerprint() != null
                ? record.getFingerprint()
                : fingerprinter.fingerprint(record);
        return UUID.nameUUIDFromBytes(fingerprint.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private Mono<UpsertOutcome> writeBoth(List<DataRecord> records, List<EmbeddingOutcome> outcomes) {
        List<IngestionError> errors = new ArrayList<>();
        List<StructuredDocument> structuredDocuments = new ArrayList<>(records.size());
        List<VectorDocument> vectorDocuments = new ArrayList<>(records.size());

        for (EmbeddingOutcome outcome : outcomes) {
            DataRecord record = records.get(outcome.getRecordIndex());
            String content = fingerprinter.canonicalJson(record);
            String id = documentId(record);

            structuredDocuments.add(StructuredDocument.builder()
                    .id(id)
                    .fingerprint(record.getFingerprint())
                    .content(content)
                    .fields(record.fields())
                    .embedded(outcome.isSuccess())
                    .build());

            if (outcome.isSuccess()) {
                vectorDocuments.add(VectorDocument.builder()
                        .id(id)
                        .fingerprint(record.getFingerprint())
                        .values(outcome.getVector())
                        .payload(vectorPayload(record, content))
                        .build());
            } else {
                errors.add(IngestionError.forRecord(EMBEDDING_STAGE, outcome.getRecordIndex(),
                        outcome.getError().getMessage()));
            }
        }

        Mono<Boolean> structuredWrite = write(STRUCTURED_BACKEND,
                Mono.defer(() -> structuredStore.upsert(structuredDocuments)), errors);
        Mono<Boolean> vectorWrite = vectorDocuments.isEmpty()
                ? Mono.just(false)
                : write(VECTOR_BACKEND, Mono.defer(() -> vectorStore.upsert(vectorDocuments)), errors);

        return structuredWrite.flatMap(structuredOk -> vectorWrite
                .map(vectorOk -> toOutcome(records.size(), vectorDocuments.size(), structuredOk, vectorOk, errors)));
    }

    private Mono<Boolean> write(String backend, Mono<Void> upsert, List<IngestionError> errors) {
        return upsert
                .thenReturn(true)
                .onErrorResume(error -> {
                    logger.warn("Upsert to {} backend failed: {}", backend, error.getMessage());
                    errors.add(IngestionError.forBatch(backend, error.getMessage()));
                    return Mono.just(false);
                });
    }

    private UpsertOutcome toOutcome(int recordCount, int vectorCount, boolean structuredOk, boolean vectorOk,
                                    List<IngestionError> errors) {
        Map<String, Boolean> backends = new LinkedHashMap<>();
        backends.put(STRUCTURED_BACKEND, structuredOk);
        backends.put(VECTOR_BACKEND, vectorOk);

        if (!structuredOk && !vectorOk) {
            return UpsertOutcome.failure(backends, errors);
        }
        if (errors.isEmpty()) {
            return UpsertOutcome.success(recordCount, backends);
        }
        int written = structuredOk ? recordCount : vectorCount;
        logger.info("Partial batch write: structured={}, vector={}, errors={}",
                structuredOk, vectorOk, errors.size());
        return UpsertOutcome.partialFailure(written, backends, errors);
    }

    private Map<String, Object> vectorPayload(DataRecord record, String content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("content", content.length() > PAYLOAD_CONTENT_LIMIT
                ? content.substring(0, PAYLOAD_CONTENT_LIMIT)
                : content);
        payload.put("fingerprint", record.getFingerprint());
        return payload;
    }
}
