package com.openrangelabs.donpetre.pipeline.processor.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.exception.IngestionException;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.processor.AbstractBatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.BatchStream;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import reactor.core.publisher.Flux;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Streams newline-delimited JSON, one value per non-blank line.
 */
public class JsonLinesProcessor extends AbstractBatchProcessor {

    public static final String SOURCE_TYPE = "jsonl";

    private final ObjectMapper objectMapper;

    public JsonLinesProcessor(StorageAdapter storageAdapter, BatchSettings settings, ObjectMapper objectMapper) {
        super(storageAdapter, settings);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSourceType() {
        return SOURCE_TYPE;
    }

    @Override
    protected BatchStream batchGenerator(IngestionSource source) {
        Flux<DataRecord> records = Flux.using(
                () -> new BufferedReader(new InputStreamReader(source.openStream(), StandardCharsets.UTF_8)),
                reader -> Flux.fromStream(reader.lines())
                        .index()
                        .filter(line -> !line.getT2().isBlank())
                        .map(line -> parse(source, line.getT1() + 1, line.getT2())),
                this::closeReader);
        return BatchStream.fromRecords(records, settings.getBatchSize());
    }

    private DataRecord parse(IngestionSource source, long lineNumber, String line) {
        try {
            return JsonRecords.toRecord(objectMapper, objectMapper.readTree(line));
        } catch (JsonProcessingException e) {
            throw new IngestionException("Malformed JSON on line " + lineNumber + " of " + source.getName(), e);
        }
    }

    private void closeReader(BufferedReader reader) {
        try {
            reader.close();
        } catch (java.io.IOException e) {
            logger.warn("Failed to close reader: {}", e.getMessage());
        }
    }
}
