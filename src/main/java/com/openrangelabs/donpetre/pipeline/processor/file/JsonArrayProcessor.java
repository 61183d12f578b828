package com.openrangelabs.donpetre.pipeline.processor.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.exception.IngestionException;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.processor.AbstractBatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.BatchStream;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.InputStream;

/**
 * Reads a document whose top level is a JSON array and emits one record per element.
 *
 * <p>Unlike the CSV and JSON Lines processors this one is not streaming: the whole array is
 * parsed into memory before the first batch is produced, so very large documents should be
 * converted to JSON Lines first.
 */
public class JsonArrayProcessor extends AbstractBatchProcessor {

    public static final String SOURCE_TYPE = "json";

    private final ObjectMapper objectMapper;

    public JsonArrayProcessor(StorageAdapter storageAdapter, BatchSettings settings, ObjectMapper objectMapper) {
        super(storageAdapter, settings);
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSourceType() {
        return SOURCE_TYPE;
    }

    @Override
    protected BatchStream batchGenerator(IngestionSource source) {
        Flux<DataRecord> records = Mono.fromCallable(() -> readArray(source))
                .flatMapMany(Flux::fromIterable)
                .map(node -> JsonRecords.toRecord(objectMapper, node));
        return BatchStream.fromRecords(records, settings.getBatchSize());
    }

    private JsonNode readArray(IngestionSource source) throws java.io.IOException {
        try (InputStream in = source.openStream()) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isArray()) {
                throw new IngestionException("Expected a top-level JSON array in " + source.getName());
            }
            logger.debug("Loaded JSON array of {} elements from {}", root.size(), source.getName());
            return root;
        }
    }
}
