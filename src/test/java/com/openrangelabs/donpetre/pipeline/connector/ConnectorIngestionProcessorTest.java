package com.openrangelabs.donpetre.pipeline.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.fingerprint.ContentFingerprinter;
import com.openrangelabs.donpetre.pipeline.model.ProcessedData;
import com.openrangelabs.donpetre.pipeline.model.SourceType;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.InMemoryStorageAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectorIngestionProcessorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ApiConnector<String> connector;

    @Test
    void ingest_StoresContentItemsAndReportsErrorItems() {
        // Arrange
        when(connector.fetchData("cfg")).thenReturn(Flux.just(
                item("{\"id\":1}", 0),
                item("{\"id\":1}", 1),
                ProcessedData.builder()
                        .raw(TextNode.valueOf("timeout"))
                        .content("timeout")
                        .sourceType(SourceType.REST)
                        .error(true)
                        .errorMessage("timeout")
                        .build(),
                item("{\"id\":2}", 2)));
        when(connector.getConnectorType()).thenReturn("rest");
        InMemoryStorageAdapter storage = new InMemoryStorageAdapter();
        ConnectorIngestionProcessor<String> processor = new ConnectorIngestionProcessor<>(
                "orders-api", connector, "cfg", storage, BatchSettings.defaults(), objectMapper);

        // Act & Assert
        StepVerifier.create(processor.ingest(IngestionSource.named("orders")))
                .assertNext(result -> {
                    assertThat(result.getSourceType()).isEqualTo("orders-api");
                    assertThat(result.getIngestedCount()).isEqualTo(2);
                    assertThat(result.getDuplicateCount()).isEqualTo(1);
                    assertThat(result.getErrors()).singleElement()
                            .satisfies(error -> assertThat(error.getMessage()).isEqualTo("timeout"));
                    assertThat(result.isPartialFailure()).isTrue();
                })
                .verifyComplete();

        assertThat(storage.getRecords())
                .allSatisfy(record -> {
                    assertThat(record.get(ConnectorIngestionProcessor.DATA_FIELD)).isInstanceOf(Map.class);
                    assertThat(record.getFingerprint()).isEqualTo(record.get(ConnectorIngestionProcessor.CHECKSUM_FIELD));
                });
    }

    private ProcessedData item(String json, int index) {
        try {
            return ProcessedData.builder()
                    .raw(objectMapper.readTree(json))
                    .content(json)
                    .sourceType(SourceType.REST)
                    .sourceUrl("https://api.example.com/orders")
                    .meta("item_index", index)
                    .checksum(ContentFingerprinter.sha256(json))
                    .build();
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
