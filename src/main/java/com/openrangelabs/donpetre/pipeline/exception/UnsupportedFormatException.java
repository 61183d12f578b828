package com.openrangelabs.donpetre.pipeline.exception;

/**
 * Thrown for source formats this core deliberately does not parse (XML, PDF, Excel,
 * Parquet, Avro).
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class UnsupportedFormatException extends IngestionException {

    private final String format;

    public UnsupportedFormatException(String format) {
        super("Format not implemented: " + format);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
