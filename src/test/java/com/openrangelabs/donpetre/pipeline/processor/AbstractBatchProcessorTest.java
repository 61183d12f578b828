package com.openrangelabs.donpetre.pipeline.processor;

import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.exception.StorageWriteException;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.IngestionError;
import com.openrangelabs.donpetre.pipeline.model.UpsertOutcome;
import com.openrangelabs.donpetre.pipeline.storage.InMemoryStorageAdapter;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AbstractBatchProcessorTest {

    @Mock
    private StorageAdapter mockStorage;

    private InMemoryStorageAdapter storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageAdapter();
    }

    @Test
    void ingest_SplitsIntoCeilOfRecordsOverBatchSize() {
        // Arrange
        ListProcessor processor = new ListProcessor(storage, settings(2), records(5));
        List<long[]> progress = new ArrayList<>();
        IngestionHooks hooks = IngestionHooks.builder()
                .progressListener((total, batch) -> progress.add(new long[]{total, batch}))
                .build();

        // Act & Assert
        StepVerifier.create(processor.ingest(IngestionSource.named("list"), hooks))
                .assertNext(result -> {
                    assertThat(result.getIngestedCount()).isEqualTo(5);
                    assertThat(result.getBatchCount()).isEqualTo(3);
                    assertThat(result.isFullyIngested()).isTrue();
                })
                .verifyComplete();

        assertThat(storage.getBatches()).extracting(List::size).containsExactly(2, 2, 1);
        assertThat(progress).extracting(p -> p[0]).containsExactly(2L, 4L, 5L);
        assertThat(progress).extracting(p -> p[1]).containsExactly(2L, 2L, 1L);
    }

    @Test
    void ingest_SecondRunIsAllDuplicates() {
        List<DataRecord> records = records(4);

        StepVerifier.create(new ListProcessor(storage, settings(3), records).ingest(IngestionSource.named("one")))
                .assertNext(result -> assertThat(result.getIngestedCount()).isEqualTo(4))
                .verifyComplete();
        StepVerifier.create(new ListProcessor(storage, settings(3), records).ingest(IngestionSource.named("two")))
                .assertNext(result -> {
                    assertThat(result.getIngestedCount()).isZero();
                    assertThat(result.getDuplicateCount()).isEqualTo(4);
                })
                .verifyComplete();

        assertThat(storage.size()).isEqualTo(4);
        assertThat(storage.getBatches()).hasSize(2);
    }

    @Test
    void ingest_SkipsDuplicatesWithinOneRun() {
        List<DataRecord> records = List.of(DataRecord.of("id", 1), DataRecord.of("id", 1), DataRecord.of("id", 2));

        StepVerifier.create(new ListProcessor(storage, settings(10), records).ingest(IngestionSource.named("dupes")))
                .assertNext(result -> {
                    assertThat(result.getIngestedCount()).isEqualTo(2);
                    assertThat(result.getDuplicateCount()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    void ingest_DropsInvalidRecordsWithoutError() {
        IngestionHooks hooks = IngestionHooks.builder()
                .validation(record -> ((Integer) record.get("id")) % 2 == 0)
                .build();

        StepVerifier.create(new ListProcessor(storage, settings(10), records(5))
                        .ingest(IngestionSource.named("valid"), hooks))
                .assertNext(result -> {
                    assertThat(result.getIngestedCount()).isEqualTo(3);
                    assertThat(result.getDroppedCount()).isEqualTo(2);
                    assertThat(result.getErrors()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void ingest_EnrichesBeforeFingerprinting() {
        IngestionHooks hooks = IngestionHooks.builder()
                .enrichment(record -> record.put("tenant", "acme"))
                .build();

        StepVerifier.create(new ListProcessor(storage, settings(10), records(2))
                        .ingest(IngestionSource.named("enrich"), hooks))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(storage.getRecords())
                .allSatisfy(record -> {
                    assertThat(record.get("tenant")).isEqualTo("acme");
                    assertThat(record.getFingerprint()).isNotBlank();
                });
    }

    @Test
    void ingest_StampsFingerprintWhenDeduplicationDisabled() {
        BatchSettings settings = BatchSettings.builder().batchSize(10).deduplication(false).build();
        List<DataRecord> records = List.of(DataRecord.of("id", 1), DataRecord.of("id", 1));

        StepVerifier.create(new ListProcessor(storage, settings, records).ingest(IngestionSource.named("nodedup")))
                .assertNext(result -> assertThat(result.getIngestedCount()).isEqualTo(2))
                .verifyComplete();

        assertThat(storage.getBatches().get(0)).allSatisfy(record -> assertThat(record.getFingerprint()).isNotNull());
    }

    @Test
    void ingest_UsesCustomFingerprintFunction() {
        BatchSettings settings = BatchSettings.builder()
                .batchSize(10)
                .fingerprintFunction(record -> String.valueOf(record.get("key")))
                .build();
        List<DataRecord> records = List.of(DataRecord.of("key", "a", "v", 1), DataRecord.of("key", "a", "v", 2));

        StepVerifier.create(new ListProcessor(storage, settings, records).ingest(IngestionSource.named("custom")))
                .assertNext(result -> assertThat(result.getDuplicateCount()).isEqualTo(1))
                .verifyComplete();
    }

    @Test
    void ingest_PropagatesUpsertError() {
        when(mockStorage.exists(anyString())).thenReturn(Mono.just(false));
        when(mockStorage.upsertBatch(anyList())).thenReturn(Mono.error(new IllegalStateException("backend down")));

        StepVerifier.create(new ListProcessor(mockStorage, settings(10), records(3)).ingest(IngestionSource.named("err")))
                .expectErrorMessage("backend down")
                .verify();
    }

    @Test
    void ingest_FailureOutcomeRaisesStorageWriteException() {
        when(mockStorage.exists(anyString())).thenReturn(Mono.just(false));
        when(mockStorage.upsertBatch(anyList())).thenReturn(Mono.just(UpsertOutcome.failure(
                Map.of("structured", false, "vector", false),
                List.of(IngestionError.forBatch("structured", "down")))));

        StepVerifier.create(new ListProcessor(mockStorage, settings(10), records(1)).ingest(IngestionSource.named("fail")))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(StorageWriteException.class);
                    assertThat(((StorageWriteException) error).getErrors()).hasSize(1);
                })
                .verify();
    }

    @Test
    void constructor_RejectsZeroBatchSize() {
        assertThatThrownBy(() -> new ListProcessor(storage, BatchSettings.builder().batchSize(0).build(), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batch_size");
    }

    private static BatchSettings settings(int batchSize) {
        return BatchSettings.builder().batchSize(batchSize).build();
    }

    private static List<DataRecord> records(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> DataRecord.of("id", i, "name", "record-" + i))
                .collect(Collectors.toList());
    }

    private static class ListProcessor extends AbstractBatchProcessor {

        private final List<DataRecord> records;

        ListProcessor(StorageAdapter storageAdapter, BatchSettings settings, List<DataRecord> records) {
            super(storageAdapter, settings);
            this.records = records;
        }

        @Override
        public String getSourceType() {
            return "list";
        }

        @Override
        protected BatchStream batchGenerator(IngestionSource source) {
            return BatchStream.fromRecords(Flux.fromIterable(records).map(DataRecord::copy), settings.getBatchSize());
        }
    }
}
