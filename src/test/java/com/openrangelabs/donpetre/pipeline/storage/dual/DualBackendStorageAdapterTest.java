package com.openrangelabs.donpetre.pipeline.storage.dual;

import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.UpsertStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DualBackendStorageAdapterTest {

    private static final String MODEL = "test-model";

    @Mock
    private StructuredStore structuredStore;

    @Mock
    private VectorStore vectorStore;

    @Mock
    private EmbeddingService embeddingService;

    @Test
    void upsertBatch_WritesBothBackendsStructuredFirst() {
        // Arrange
        when(embeddingService.generate(anyString(), anyString())).thenReturn(Mono.just(new float[]{0.1f, 0.2f}));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());
        when(vectorStore.upsert(anyList())).thenReturn(Mono.empty());
        DualBackendStorageAdapter adapter = adapter(4);

        // Act & Assert
        StepVerifier.create(adapter.upsertBatch(records(3)))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(UpsertStatus.SUCCESS);
                    assertThat(outcome.getWrittenCount()).isEqualTo(3);
                    assertThat(outcome.isBackendSuccessful(DualBackendStorageAdapter.VECTOR_BACKEND)).isTrue();
                })
                .verifyComplete();

        InOrder order = inOrder(structuredStore, vectorStore);
        order.verify(structuredStore).upsert(anyList());
        order.verify(vectorStore).upsert(anyList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertBatch_StructuredAndVectorDocumentsShareIds() {
        when(embeddingService.generate(anyString(), anyString())).thenReturn(Mono.just(new float[]{1f}));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());
        when(vectorStore.upsert(anyList())).thenReturn(Mono.empty());

        StepVerifier.create(adapter(2).upsertBatch(records(2))).expectNextCount(1).verifyComplete();

        ArgumentCaptor<List<StructuredDocument>> structured = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<VectorDocument>> vectors = ArgumentCaptor.forClass(List.class);
        verify(structuredStore).upsert(structured.capture());
        verify(vectorStore).upsert(vectors.capture());
        assertThat(structured.getValue()).extracting(StructuredDocument::getId)
                .containsExactlyElementsOf(vectors.getValue().stream().map(VectorDocument::getId).collect(Collectors.toList()));
        assertThat(vectors.getValue().get(0).getPayload()).containsKeys("content", "fingerprint");
    }

    @Test
    void upsertBatch_VectorFailureIsPartialNotException() {
        when(embeddingService.generate(anyString(), anyString())).thenReturn(Mono.just(new float[]{0.5f}));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());
        when(vectorStore.upsert(anyList())).thenReturn(Mono.error(new IllegalStateException("vector store offline")));

        StepVerifier.create(adapter(4).upsertBatch(records(2)))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(UpsertStatus.PARTIAL_FAILURE);
                    assertThat(outcome.getBackendSuccess())
                            .containsEntry(DualBackendStorageAdapter.STRUCTURED_BACKEND, true)
                            .containsEntry(DualBackendStorageAdapter.VECTOR_BACKEND, false);
                    assertThat(outcome.getErrors()).singleElement()
                            .satisfies(error -> assertThat(error.getMessage()).contains("offline"));
                })
                .verifyComplete();
    }

    @Test
    void upsertBatch_FailedEmbeddingDoesNotCancelSiblings() {
        AtomicInteger calls = new AtomicInteger();
        when(embeddingService.generate(anyString(), anyString())).thenAnswer(invocation -> {
            int call = calls.incrementAndGet();
            return call == 2
                    ? Mono.error(new IllegalStateException("rate limited"))
                    : Mono.just(new float[]{call});
        });
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());
        when(vectorStore.upsert(anyList())).thenReturn(Mono.empty());

        StepVerifier.create(adapter(4).upsertBatch(records(4)))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(UpsertStatus.PARTIAL_FAILURE);
                    assertThat(outcome.getWrittenCount()).isEqualTo(4);
                    assertThat(outcome.getErrors()).singleElement()
                            .satisfies(error -> assertThat(error.getBackend()).isEqualTo(DualBackendStorageAdapter.EMBEDDING_STAGE));
                })
                .verifyComplete();

        assertThat(calls.get()).isEqualTo(4);
    }

    @Test
    void upsertBatch_AllEmbeddingsFailSkipsVectorStore() {
        when(embeddingService.generate(anyString(), anyString()))
                .thenReturn(Mono.error(new IllegalStateException("embedding service down")));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());

        StepVerifier.create(adapter(2).upsertBatch(records(2)))
                .assertNext(outcome -> {
                    assertThat(outcome.isPartialFailure()).isTrue();
                    assertThat(outcome.isBackendSuccessful(DualBackendStorageAdapter.VECTOR_BACKEND)).isFalse();
                })
                .verifyComplete();

        verify(vectorStore, never()).upsert(anyList());
    }

    @Test
    void upsertBatch_BothBackendsFailingIsFailure() {
        when(embeddingService.generate(anyString(), anyString())).thenReturn(Mono.just(new float[]{1f}));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.error(new IllegalStateException("db down")));
        when(vectorStore.upsert(anyList())).thenReturn(Mono.error(new IllegalStateException("index down")));

        StepVerifier.create(adapter(2).upsertBatch(records(1)))
                .assertNext(outcome -> {
                    assertThat(outcome.isFailure()).isTrue();
                    assertThat(outcome.getErrors()).hasSize(2);
                })
                .verifyComplete();
    }

    @Test
    void upsertBatch_ConcurrencyNeverExceedsCap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(embeddingService.generate(anyString(), anyString())).thenAnswer(invocation -> Mono.defer(() -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            return Mono.delay(Duration.ofMillis(5))
                    .doOnNext(tick -> inFlight.decrementAndGet())
                    .thenReturn(new float[]{1f});
        }));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());
        when(vectorStore.upsert(anyList())).thenReturn(Mono.empty());

        StepVerifier.create(adapter(3).upsertBatch(records(20)))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(peak.get()).isLessThanOrEqualTo(3).isPositive();
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertBatch_EmptyEmbeddingIsReportedNotDropped() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        when(embeddingService.generate(anyString(), anyString())).thenAnswer(invocation ->
                calls.incrementAndGet() == 1 ? Mono.empty() : Mono.just(new float[]{1f}));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());
        when(vectorStore.upsert(anyList())).thenReturn(Mono.empty());

        // Act & Assert
        StepVerifier.create(adapter(1).upsertBatch(records(2)))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(UpsertStatus.PARTIAL_FAILURE);
                    assertThat(outcome.getErrors()).singleElement()
                            .satisfies(error -> assertThat(error.getMessage()).contains("empty embedding"));
                })
                .verifyComplete();

        ArgumentCaptor<List<StructuredDocument>> structured = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<VectorDocument>> vectors = ArgumentCaptor.forClass(List.class);
        verify(structuredStore).upsert(structured.capture());
        verify(vectorStore).upsert(vectors.capture());
        assertThat(structured.getValue()).hasSize(2);
        assertThat(structured.getValue().get(0).isEmbedded()).isFalse();
        assertThat(vectors.getValue()).singleElement()
                .satisfies(document -> assertThat(document.getFingerprint()).isEqualTo("fp-1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertBatch_SameRecordTwiceKeepsItsId() {
        when(embeddingService.generate(anyString(), anyString())).thenReturn(Mono.just(new float[]{1f}));
        when(structuredStore.upsert(anyList())).thenReturn(Mono.empty());
        when(vectorStore.upsert(anyList())).thenReturn(Mono.empty());
        DualBackendStorageAdapter adapter = adapter(2);

        StepVerifier.create(adapter.upsertBatch(records(1))).expectNextCount(1).verifyComplete();
        StepVerifier.create(adapter.upsertBatch(records(1))).expectNextCount(1).verifyComplete();

        ArgumentCaptor<List<StructuredDocument>> structured = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<VectorDocument>> vectors = ArgumentCaptor.forClass(List.class);
        verify(structuredStore, times(2)).upsert(structured.capture());
        verify(vectorStore, times(2)).upsert(vectors.capture());
        String firstId = structured.getAllValues().get(0).get(0).getId();
        assertThat(structured.getAllValues().get(1).get(0).getId()).isEqualTo(firstId);
        assertThat(vectors.getAllValues()).allSatisfy(batch ->
                assertThat(batch.get(0).getId()).isEqualTo(firstId));
    }

    @Test
    void exists_DelegatesToStructuredStore() {
        when(structuredStore.exists("abc")).thenReturn(Mono.just(true));

        StepVerifier.create(adapter(1).exists("abc")).expectNext(true).verifyComplete();
    }

    @Test
    void constructor_RejectsNonPositiveConcurrency() {
        assertThatThrownBy(() -> adapter(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private DualBackendStorageAdapter adapter(int concurrency) {
        return new DualBackendStorageAdapter(structuredStore, vectorStore, embeddingService, MODEL, concurrency);
    }

    private static List<DataRecord> records(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> DataRecord.of("id", i).stampFingerprint("fp-" + i))
                .collect(Collectors.toList());
    }
}
