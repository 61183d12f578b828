package com.openrangelabs.donpetre.pipeline.storage;

import com.openrangelabs.donpetre.pipeline.fingerprint.ContentFingerprinter;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.UpsertOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Thread-safe in-process storage keyed by fingerprint.
 *
 * <p>Records arriving without a stamped fingerprint are keyed by their content fingerprint,
 * so repeated upserts stay idempotent. Every accepted batch is also kept in arrival order,
 * which makes this adapter the default sink for local runs and tests.
 */
public class InMemoryStorageAdapter implements StorageAdapter {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStorageAdapter.class);

    private final Map<String, DataRecord> records = new ConcurrentHashMap<>();
    private final List<List<DataRecord>> batches = new CopyOnWriteArrayList<>();
    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();

    @Override
    public Mono<Boolean> exists(String fingerprint) {
        return Mono.fromCallable(() -> records.containsKey(fingerprint));
    }

    @Override
    public Mono<UpsertOutcome> upsertBatch(List<DataRecord> batch) {
        return Mono.fromCallable(() -> {
            List<DataRecord> copies = batch.stream()
                    .map(DataRecord::copy)
                    .collect(Collectors.toList());
            for (DataRecord record : copies) {
                String key = record.getFingerprint() != null
                        ? record.getFingerprint()
                        : fingerprinter.fingerprint(record);
                records.put(key, record);
            }
            batches.add(Collections.unmodifiableList(copies));
            logger.debug("Stored batch of {} records ({} total)", copies.size(), records.size());
            return UpsertOutcome.success(copies.size());
        });
    }

    public Collection<DataRecord> getRecords() {
        return Collections.unmodifiableCollection(records.values());
    }

    public List<List<DataRecord>> getBatches() {
        return Collections.unmodifiableList(batches);
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
        batches.clear();
    }
}
