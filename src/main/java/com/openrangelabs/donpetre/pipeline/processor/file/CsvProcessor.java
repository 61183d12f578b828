package com.openrangelabs.donpetre.pipeline.processor.file;

import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.processor.AbstractBatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.BatchStream;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import reactor.core.publisher.Flux;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Streams delimited text. The first row names the fields; blank lines are skipped.
 *
 * <p>Cells beyond the header are kept as {@code column_N}; missing trailing cells are null.
 */
public class CsvProcessor extends AbstractBatchProcessor {

    public static final String SOURCE_TYPE = "csv";
    public static final String TSV_SOURCE_TYPE = "tsv";

    private final String sourceType;
    private final char delimiter;

    public CsvProcessor(StorageAdapter storageAdapter, BatchSettings settings) {
        this(storageAdapter, settings, ',');
    }

    public CsvProcessor(StorageAdapter storageAdapter, BatchSettings settings, char delimiter) {
        this(storageAdapter, settings, SOURCE_TYPE, delimiter);
    }

    public CsvProcessor(StorageAdapter storageAdapter, BatchSettings settings, String sourceType, char delimiter) {
        super(storageAdapter, settings);
        this.sourceType = sourceType;
        this.delimiter = delimiter;
    }

    /**
     * Tab-separated values, registered under {@value #TSV_SOURCE_TYPE}.
     */
    public static CsvProcessor tabSeparated(StorageAdapter storageAdapter, BatchSettings settings) {
        return new CsvProcessor(storageAdapter, settings, TSV_SOURCE_TYPE, '\t');
    }

    @Override
    public String getSourceType() {
        return sourceType;
    }

    @Override
    protected BatchStream batchGenerator(IngestionSource source) {
        Flux<DataRecord> records = Flux.using(
                () -> {
                    CsvParser parser = newParser();
                    parser.beginParsing(new InputStreamReader(source.openStream(), StandardCharsets.UTF_8));
                    return parser;
                },
                parser -> {
                    String[] header = parser.parseNext();
                    if (header == null) {
                        return Flux.<DataRecord>empty();
                    }
                    return Flux.<DataRecord>generate(sink -> {
                        String[] row = parser.parseNext();
                        if (row == null) {
                            sink.complete();
                        } else {
                            sink.next(toRecord(header, row));
                        }
                    });
                },
                CsvParser::stopParsing);
        return BatchStream.fromRecords(records, settings.getBatchSize());
    }

    CsvParser newParser() {
        CsvParserSettings parserSettings = new CsvParserSettings();
        parserSettings.getFormat().setDelimiter(delimiter);
        parserSettings.setLineSeparatorDetectionEnabled(true);
        parserSettings.setSkipEmptyLines(true);
        // trimming must not eat a whitespace delimiter
        boolean trim = !Character.isWhitespace(delimiter);
        parserSettings.setIgnoreLeadingWhitespaces(trim);
        parserSettings.setIgnoreTrailingWhitespaces(trim);
        parserSettings.setHeaderExtractionEnabled(false);
        parserSettings.setMaxCharsPerColumn(-1);
        logger.debug("Created CsvParser with delimiter='{}'", delimiter);
        return new CsvParser(parserSettings);
    }

    private static DataRecord toRecord(String[] header, String[] row) {
        DataRecord record = new DataRecord();
        int width = Math.max(header.length, row.length);
        for (int i = 0; i < width; i++) {
            String name = i < header.length && header[i] != null && !header[i].isBlank()
                    ? header[i]
                    : "column_" + (i + 1);
            record.put(name, i < row.length ? row[i] : null);
        }
        return record;
    }
}
