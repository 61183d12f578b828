package com.openrangelabs.donpetre.pipeline.processor.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.exception.IngestionException;
import com.openrangelabs.donpetre.pipeline.exception.UnsupportedFormatException;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.InMemoryStorageAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class JsonProcessorsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryStorageAdapter storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageAdapter();
    }

    @Test
    void jsonLines_SkipsBlankLinesAndWrapsScalars() {
        String jsonl = "{\"id\":1,\"tags\":[\"a\",\"b\"]}\n\n{\"id\":2,\"nested\":{\"k\":\"v\"}}\n42\n";
        JsonLinesProcessor processor = new JsonLinesProcessor(storage, BatchSettings.defaults(), objectMapper);

        StepVerifier.create(processor.ingest(source("events.jsonl", jsonl)))
                .assertNext(result -> assertThat(result.getIngestedCount()).isEqualTo(3))
                .verifyComplete();

        assertThat(storage.getRecords())
                .anySatisfy(record -> assertThat(record.get(JsonRecords.VALUE_FIELD)).isEqualTo(42))
                .anySatisfy(record -> assertThat(record.get("nested")).isEqualTo(Map.of("k", "v")));
    }

    @Test
    void jsonLines_MalformedLineFailsWithLineNumber() {
        String jsonl = "{\"id\":1}\n{broken\n";
        JsonLinesProcessor processor = new JsonLinesProcessor(storage, BatchSettings.defaults(), objectMapper);

        StepVerifier.create(processor.ingest(source("bad.jsonl", jsonl)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(IngestionException.class);
                    assertThat(error.getMessage()).contains("line 2");
                })
                .verify();
    }

    @Test
    void jsonArray_IteratesTopLevelArray() {
        String json = "[{\"id\":1},{\"id\":2},{\"id\":3}]";
        JsonArrayProcessor processor = new JsonArrayProcessor(storage, BatchSettings.builder().batchSize(2).build(),
                objectMapper);

        StepVerifier.create(processor.ingest(source("items.json", json)))
                .assertNext(result -> {
                    assertThat(result.getIngestedCount()).isEqualTo(3);
                    assertThat(result.getBatchCount()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    void jsonArray_RejectsNonArrayDocument() {
        JsonArrayProcessor processor = new JsonArrayProcessor(storage, BatchSettings.defaults(), objectMapper);

        StepVerifier.create(processor.ingest(source("object.json", "{\"id\":1}")))
                .expectError(IngestionException.class)
                .verify();
    }

    @Test
    void unsupportedFormat_FailsWithoutOpeningSource() {
        AtomicBoolean opened = new AtomicBoolean();
        IngestionSource source = IngestionSource.ofStream("doc.pdf", () -> {
            opened.set(true);
            throw new IllegalStateException("should not be opened");
        });

        StepVerifier.create(new UnsupportedFormatProcessor("pdf", storage).ingest(source))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(UnsupportedFormatException.class);
                    assertThat(error.getMessage()).isEqualTo("Format not implemented: pdf");
                })
                .verify();
        assertThat(opened).isFalse();
        assertThat(storage.size()).isZero();
    }

    @Test
    void fileFormat_MapsExtensions() {
        assertThat(FileFormat.fromExtension("NDJSON")).contains(FileFormat.JSONL);
        assertThat(FileFormat.fromExtension(".xlsx")).contains(FileFormat.EXCEL);
        assertThat(FileFormat.fromExtension("exe")).isEmpty();
        assertThat(FileFormat.PARQUET.isSupported()).isFalse();
    }

    @Test
    void jsonRecords_CopiesObjectFields() {
        DataRecord record = JsonRecords.toRecord(objectMapper, objectMapper.createObjectNode().put("a", "b"));

        assertThat(record.fields()).containsExactly(Map.entry("a", "b"));
    }

    private static IngestionSource source(String name, String content) {
        return IngestionSource.ofBytes(name, content.getBytes(StandardCharsets.UTF_8));
    }
}
