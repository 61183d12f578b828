package com.openrangelabs.donpetre.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.donpetre.pipeline.processor.file.CsvProcessor;
import com.openrangelabs.donpetre.pipeline.processor.file.FileFormat;
import com.openrangelabs.donpetre.pipeline.processor.file.JsonArrayProcessor;
import com.openrangelabs.donpetre.pipeline.processor.file.JsonLinesProcessor;
import com.openrangelabs.donpetre.pipeline.processor.file.TextChunker;
import com.openrangelabs.donpetre.pipeline.processor.file.TextProcessor;
import com.openrangelabs.donpetre.pipeline.processor.file.UnsupportedFormatProcessor;
import com.openrangelabs.donpetre.pipeline.processor.zip.ZipArchiveProcessor;
import com.openrangelabs.donpetre.pipeline.storage.InMemoryStorageAdapter;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import com.openrangelabs.donpetre.pipeline.storage.dual.DualBackendStorageAdapter;
import com.openrangelabs.donpetre.pipeline.storage.dual.EmbeddingService;
import com.openrangelabs.donpetre.pipeline.storage.dual.StructuredStore;
import com.openrangelabs.donpetre.pipeline.storage.dual.VectorStore;
import com.openrangelabs.donpetre.pipeline.upload.UploadPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.util.Arrays;
import java.util.Locale;

/**
 * Wires the batch processors, storage and upload policy from {@code ingestion.*} properties.
 */
@Configuration
public class IngestionConfig {

    private static final Logger logger = LoggerFactory.getLogger(IngestionConfig.class);

    @Value("${ingestion.batch.size:100}")
    private int batchSize;

    @Value("${ingestion.batch.deduplication:true}")
    private boolean deduplication;

    @Value("${ingestion.batch.max-concurrent-batches:1}")
    private int maxConcurrentBatches;

    @Value("${ingestion.csv.delimiter:,}")
    private char csvDelimiter;

    @Value("${ingestion.text.chunk-size:4000}")
    private int textChunkSize;

    @Value("${ingestion.text.chunk-overlap:800}")
    private int textChunkOverlap;

    @Value("${ingestion.embedding.model:text-embedding-3-small}")
    private String embeddingModel;

    @Value("${ingestion.embedding.concurrency:8}")
    private int embeddingConcurrency;

    @Value("${ingestion.upload.max-bytes:104857600}")
    private long uploadMaxBytes;

    @Value("${ingestion.upload.allowed-extensions:csv,tsv,jsonl,ndjson,json,txt,md,zip}")
    private String uploadAllowedExtensions;

    @Bean
    public BatchSettings batchSettings() {
        BatchSettings settings = BatchSettings.builder()
                .batchSize(batchSize)
                .deduplication(deduplication)
                .maxConcurrentBatches(maxConcurrentBatches)
                .build();
        settings.validate();
        return settings;
    }

    /**
     * Dual-backend storage when structured, vector and embedding beans are all present,
     * in-memory storage otherwise.
     */
    @Bean
    @ConditionalOnMissingBean(StorageAdapter.class)
    public StorageAdapter storageAdapter(ObjectProvider<StructuredStore> structuredStore,
                                         ObjectProvider<VectorStore> vectorStore,
                                         ObjectProvider<EmbeddingService> embeddingService) {
        StructuredStore structured = structuredStore.getIfAvailable();
        VectorStore vector = vectorStore.getIfAvailable();
        EmbeddingService embeddings = embeddingService.getIfAvailable();
        if (structured != null && vector != null && embeddings != null) {
            logger.info("Using dual-backend storage (model={}, embedding concurrency={})",
                    embeddingModel, embeddingConcurrency);
            return new DualBackendStorageAdapter(structured, vector, embeddings, embeddingModel, embeddingConcurrency);
        }
        logger.info("No external stores configured, using in-memory storage");
        return new InMemoryStorageAdapter();
    }

    @Bean
    public CsvProcessor csvProcessor(StorageAdapter storageAdapter, BatchSettings batchSettings) {
        return new CsvProcessor(storageAdapter, batchSettings, csvDelimiter);
    }

    @Bean
    public CsvProcessor tsvProcessor(StorageAdapter storageAdapter, BatchSettings batchSettings) {
        return CsvProcessor.tabSeparated(storageAdapter, batchSettings);
    }

    @Bean
    public TextProcessor textProcessor(StorageAdapter storageAdapter, BatchSettings batchSettings) {
        return new TextProcessor(storageAdapter, batchSettings, new TextChunker(textChunkSize, textChunkOverlap));
    }

    @Bean
    public JsonLinesProcessor jsonLinesProcessor(StorageAdapter storageAdapter, BatchSettings batchSettings,
                                                 ObjectMapper objectMapper) {
        return new JsonLinesProcessor(storageAdapter, batchSettings, objectMapper);
    }

    @Bean
    public JsonArrayProcessor jsonArrayProcessor(StorageAdapter storageAdapter, BatchSettings batchSettings,
                                                 ObjectMapper objectMapper) {
        return new JsonArrayProcessor(storageAdapter, batchSettings, objectMapper);
    }

    @Bean
    public ZipArchiveProcessor zipArchiveProcessor(StorageAdapter storageAdapter) {
        return new ZipArchiveProcessor(storageAdapter);
    }

    @Bean
    public UnsupportedFormatProcessor xmlProcessor(StorageAdapter storageAdapter) {
        return failClosed(FileFormat.XML, storageAdapter);
    }

    @Bean
    public UnsupportedFormatProcessor pdfProcessor(StorageAdapter storageAdapter) {
        return failClosed(FileFormat.PDF, storageAdapter);
    }

    @Bean
    public UnsupportedFormatProcessor excelProcessor(StorageAdapter storageAdapter) {
        return failClosed(FileFormat.EXCEL, storageAdapter);
    }

    @Bean
    public UnsupportedFormatProcessor parquetProcessor(StorageAdapter storageAdapter) {
        return failClosed(FileFormat.PARQUET, storageAdapter);
    }

    @Bean
    public UnsupportedFormatProcessor avroProcessor(StorageAdapter storageAdapter) {
        return failClosed(FileFormat.AVRO, storageAdapter);
    }

    @Bean
    public WebSocketClient webSocketClient() {
        return new ReactorNettyWebSocketClient();
    }

    @Bean
    public UploadPolicy uploadPolicy() {
        UploadPolicy.UploadPolicyBuilder builder = UploadPolicy.builder().maxBytes(uploadMaxBytes);
        Arrays.stream(uploadAllowedExtensions.split(","))
                .map(String::trim)
                .filter(extension -> !extension.isEmpty())
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .forEach(builder::allowedExtension);
        return builder.build();
    }

    private static UnsupportedFormatProcessor failClosed(FileFormat format, StorageAdapter storageAdapter) {
        return new UnsupportedFormatProcessor(format.getSourceType(), storageAdapter);
    }
}
