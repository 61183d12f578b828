package com.openrangelabs.donpetre.pipeline.processor.file;

import com.openrangelabs.donpetre.pipeline.config.BatchSettings;
import com.openrangelabs.donpetre.pipeline.exception.UnsupportedFormatException;
import com.openrangelabs.donpetre.pipeline.processor.AbstractBatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.BatchStream;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;

/**
 * Placeholder for formats this core does not parse. Fails closed without opening the source.
 */
public class UnsupportedFormatProcessor extends AbstractBatchProcessor {

    private final String format;

    public UnsupportedFormatProcessor(String format, StorageAdapter storageAdapter) {
        super(storageAdapter, BatchSettings.defaults());
        this.format = format;
    }

    @Override
    public String getSourceType() {
        return format;
    }

    @Override
    protected BatchStream batchGenerator(IngestionSource source) {
        return BatchStream.failed(new UnsupportedFormatException(format));
    }
}
