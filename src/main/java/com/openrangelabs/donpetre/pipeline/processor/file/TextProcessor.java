package com.openrangelabs.donpetre.pipeline.processor.file;

import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.processor.AbstractBatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.BatchStream;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Plain text and markdown. The document is read whole and emitted as one record per
 * overlapping chunk: {@code content}, {@code source}, {@code chunk_index}, {@code char_count},
 * {@code start_char} and {@code end_char}.
 */
public class TextProcessor extends AbstractBatchProcessor {

    public static final String SOURCE_TYPE = "text";

    public static final String CONTENT_FIELD = "content";
    public static final String SOURCE_FIELD = "source";
    public static final String CHUNK_INDEX_FIELD = "chunk_index";
    public static final String CHAR_COUNT_FIELD = "char_count";
    public static final String START_FIELD = "start_char";
    public static final String END_FIELD = "end_char";

    private final TextChunker chunker;

    public TextProcessor(StorageAdapter storageAdapter, BatchSettings settings, TextChunker chunker) {
        super(storageAdapter, settings);
        this.chunker = chunker;
    }

    @Override
    public String getSourceType() {
        return SOURCE_TYPE;
    }

    @Override
    protected BatchStream batchGenerator(IngestionSource source) {
        Flux<DataRecord> records = Mono.fromCallable(() -> readText(source))
                .flatMapIterable(chunker::chunk)
                .map(chunk -> DataRecord.of(
                        CONTENT_FIELD, chunk.getContent(),
                        SOURCE_FIELD, source.getName(),
                        CHUNK_INDEX_FIELD, chunk.getIndex(),
                        CHAR_COUNT_FIELD, chunk.getContent().length(),
                        START_FIELD, chunk.getStart(),
                        END_FIELD, chunk.getEnd()));
        return BatchStream.fromRecords(records, settings.getBatchSize());
    }

    private String readText(IngestionSource source) throws IOException {
        try (InputStream in = source.openStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            logger.debug("Read {} characters from {}", text.length(), source.getName());
            return text;
        }
    }
}
