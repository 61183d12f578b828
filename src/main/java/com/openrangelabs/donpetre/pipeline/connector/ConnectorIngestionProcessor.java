package com.openrangelabs.donpetre.pipeline.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.IngestionError;
import com.openrangelabs.donpetre.pipeline.model.IngestionResult;
import com.openrangelabs.donpetre.pipeline.model.ProcessedData;
import com.openrangelabs.donpetre.pipeline.processor.AbstractBatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.BatchStream;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import reactor.core.publisher.Flux;

import java.util.function.Consumer;

/**
 * Routes an API connector through the batch pipeline so its items get the same validation,
 * dedup and storage treatment as file records.
 *
 * <p>Content items become records; error items are reported on the result and never stored.
 * Unless the settings override it, records are fingerprinted by the checksum of their content,
 * so the same payload seen on two pages is stored once.
 */
public class ConnectorIngestionProcessor<C> extends AbstractBatchProcessor {

    public static final String CONTENT_FIELD = "content";
    public static final String DATA_FIELD = "data";
    public static final String SOURCE_TYPE_FIELD = "source_type";
    public static final String SOURCE_URL_FIELD = "source_url";
    public static final String CHECKSUM_FIELD = "checksum";
    public static final String METADATA_FIELD = "metadata";

    private final String sourceType;
    private final ApiConnector<C> connector;
    private final C config;
    private final ObjectMapper objectMapper;

    public ConnectorIngestionProcessor(String sourceType, ApiConnector<C> connector, C config,
                                       StorageAdapter storageAdapter, BatchSettings settings,
                                       ObjectMapper objectMapper) {
        super(storageAdapter, withChecksumFingerprint(settings));
        this.sourceType = sourceType;
        this.connector = connector;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSourceType() {
        return sourceType;
    }

    @Override
    protected BatchStream batchGenerator(IngestionSource source) {
        return stream(error -> { });
    }

    @Override
    protected BatchStream batchGenerator(IngestionSource source, IngestionResult.Builder result) {
        return stream(result::addError);
    }

    private BatchStream stream(Consumer<IngestionError> errors) {
        Flux<DataRecord> records = connector.fetchData(config)
                .filter(item -> {
                    if (item.isError()) {
                        logger.warn("{} connector reported an error item: {}", connector.getConnectorType(),
                                item.getErrorMessage());
                        errors.accept(IngestionError.forBatch(connector.getConnectorType(), item.getErrorMessage()));
                        return false;
                    }
                    return true;
                })
                .map(this::toRecord);
        return BatchStream.fromRecords(records, settings.getBatchSize());
    }

    DataRecord toRecord(ProcessedData item) {
        DataRecord record = new DataRecord();
        record.put(CONTENT_FIELD, item.getContent());
        if (item.getRaw() != null && item.getRaw().isContainerNode()) {
            record.put(DATA_FIELD, objectMapper.convertValue(item.getRaw(), Object.class));
        }
        record.put(SOURCE_TYPE_FIELD, item.getSourceType() != null ? item.getSourceType().name() : null);
        record.put(SOURCE_URL_FIELD, item.getSourceUrl());
        record.put(CHECKSUM_FIELD, item.getChecksum());
        record.put(METADATA_FIELD, item.getMetadata());
        return record;
    }

    private static BatchSettings withChecksumFingerprint(BatchSettings settings) {
        if (settings.getFingerprintFunction() != null) {
            return settings;
        }
        return settings.toBuilder()
                .fingerprintFunction(record -> String.valueOf(record.get(CHECKSUM_FIELD)))
                .build();
    }
}
