package com.openrangelabs.donpetre.pipeline.processor.file;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * File formats known to the pipeline, keyed by extension.
 */
public enum FileFormat {

    CSV("csv", true, "csv"),
    TSV("tsv", true, "tsv"),
    TEXT("text", true, "txt", "md", "markdown"),
    JSONL("jsonl", true, "jsonl", "ndjson"),
    JSON("json", true, "json"),
    ZIP("zip", true, "zip"),
    XML("xml", false, "xml"),
    PDF("pdf", false, "pdf"),
    EXCEL("excel", false, "xls", "xlsx"),
    PARQUET("parquet", false, "parquet"),
    AVRO("avro", false, "avro");

    private final String sourceType;
    private final boolean supported;
    private final List<String> extensions;

    FileFormat(String sourceType, boolean supported, String... extensions) {
        this.sourceType = sourceType;
        this.supported = supported;
        this.extensions = List.of(extensions);
    }

    public static Optional<FileFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.startsWith(".") ? extension.substring(1) : extension;
        String lower = normalized.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(format -> format.extensions.contains(lower))
                .findFirst();
    }

    public String getSourceType() { return sourceType; }
    public boolean isSupported() { return supported; }
    public List<String> getExtensions() { return extensions; }
}
