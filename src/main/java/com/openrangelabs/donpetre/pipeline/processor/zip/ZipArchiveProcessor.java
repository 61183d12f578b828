package com.openrangelabs.donpetre.pipeline.processor.zip;

import com.openrangelabs.donpetre.pipeline.exception.IngestionException;
import com.openrangelabs.donpetre.pipeline.exception.StorageWriteException;
import com.openrangelabs.donpetre.pipeline.fingerprint.ContentFingerprinter;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.IngestionResult;
import com.openrangelabs.donpetre.pipeline.model.UpsertOutcome;
import com.openrangelabs.donpetre.pipeline.processor.BatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.IngestionHooks;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.storage.StorageAdapter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.springframework.util.FileSystemUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ingests the members of a zip archive as opaque files.
 *
 * <p>The archive is extracted into a scratch directory that is removed however the run ends.
 * Each regular file is identified by the SHA-256 of its bytes; a file whose digest is already
 * stored, or was already seen earlier in the same archive, is skipped. Every new file becomes
 * a single-record batch {@code {path, _fingerprint}}.
 *
 * <p>Validation and enrichment hooks do not apply to archive members; progress is reported
 * after each stored file.
 */
@Slf4j
public class ZipArchiveProcessor implements BatchProcessor {

    public static final String SOURCE_TYPE = "zip";
    public static final String PATH_FIELD = "path";

    private static final String SCRATCH_PREFIX = "ingest-zip-";
    private static final int SIGNATURE_LENGTH = 4;

    private final StorageAdapter storageAdapter;
    private final Path scratchRoot;

    public ZipArchiveProcessor(StorageAdapter storageAdapter) {
        this(storageAdapter, null);
    }

    /**
     * @param scratchRoot parent of the per-run extraction directories, null for the system temp directory
     */
    public ZipArchiveProcessor(StorageAdapter storageAdapter, Path scratchRoot) {
        this.storageAdapter = storageAdapter;
        this.scratchRoot = scratchRoot;
    }

    @Override
    public String getSourceType() {
        return SOURCE_TYPE;
    }

    @Override
    public Mono<IngestionResult> ingest(IngestionSource source, IngestionHooks hooks) {
        return Mono.using(
                        this::createScratch,
                        scratch -> Mono.fromCallable(() -> extract(source, scratch))
                                .flatMap(files -> storeFiles(source, scratch, files, hooks)),
                        this::deleteScratch)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> log.info("Ingested zip {}: {} new files, {} duplicates",
                        source.getName(), result.getIngestedCount(), result.getDuplicateCount()))
                .doOnError(error -> log.error("Ingestion of zip {} failed: {}", source.getName(), error.getMessage()));
    }

    private Mono<IngestionResult> storeFiles(IngestionSource source, Path scratch, List<Path> files,
                                             IngestionHooks hooks) {
        IngestionResult.Builder result = IngestionResult.builder(SOURCE_TYPE, source.getName());
        Set<String> seenDigests = new HashSet<>();

        return Flux.fromIterable(files)
                .concatMap(file -> storeFile(scratch, file, result, seenDigests, hooks))
                .then(Mono.fromCallable(result::build));
    }

    private Mono<Void> storeFile(Path scratch, Path file, IngestionResult.Builder result,
                                 Set<String> seenDigests, IngestionHooks hooks) {
        String digest = ContentFingerprinter.sha256(file);
        if (!seenDigests.add(digest)) {
            log.debug("Skipping {}: same content as an earlier member", file.getFileName());
            result.addDuplicates(1);
            return Mono.empty();
        }
        return storageAdapter.exists(digest)
                .flatMap(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        result.addDuplicates(1);
                        return Mono.<Void>empty();
                    }
                    DataRecord record = DataRecord.of(PATH_FIELD, relativeName(scratch, file))
                            .stampFingerprint(digest);
                    return storageAdapter.upsertBatch(List.of(record))
                            .flatMap(outcome -> recordOutcome(file, outcome, result))
                            .doOnSuccess(ignored -> hooks.reportProgress(result.getIngestedCount(), 1));
                });
    }

    private Mono<Void> recordOutcome(Path file, UpsertOutcome outcome, IngestionResult.Builder result) {
        if (outcome.isFailure()) {
            return Mono.error(new StorageWriteException(
                    "No storage backend accepted " + file.getFileName(), outcome.getErrors()));
        }
        result.addIngested(1);
        result.addOutcome(outcome);
        return Mono.empty();
    }

    /**
     * Extracts regular files into {@code scratch} and returns them in sorted path order.
     */
    List<Path> extract(IngestionSource source, Path scratch) throws IOException {
        Path root = scratch.toRealPath();
        try (InputStream in = new BufferedInputStream(source.openStream());
             ZipArchiveInputStream zip = new ZipArchiveInputStream(in)) {
            requireZipSignature(source, in);
            ZipArchiveEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IngestionException("Zip entry escapes the extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                if (!zip.canReadEntryData(entry)) {
                    log.warn("Skipping unreadable zip entry {}", entry.getName());
                    continue;
                }
                Files.createDirectories(target.getParent());
                Files.copy(zip, target);
            }
        }

        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            log.debug("Extracted {} files from {}", files.size(), source.getName());
            return files;
        }
    }

    /**
     * {@link ZipArchiveInputStream} reports no entries for bytes that are not a zip at all, so
     * the leading signature is checked up front. The stream is reset afterwards.
     */
    private static void requireZipSignature(IngestionSource source, InputStream in) throws IOException {
        byte[] signature = new byte[SIGNATURE_LENGTH];
        in.mark(SIGNATURE_LENGTH);
        int read = in.readNBytes(signature, 0, SIGNATURE_LENGTH);
        in.reset();
        if (!ZipArchiveInputStream.matches(signature, read)) {
            throw new IngestionException("Not a zip archive: " + source.getName());
        }
    }

    private Path createScratch() throws IOException {
        return scratchRoot != null
                ? Files.createTempDirectory(scratchRoot, SCRATCH_PREFIX)
                : Files.createTempDirectory(SCRATCH_PREFIX);
    }

    private static String relativeName(Path scratch, Path file) {
        try {
            return scratch.toRealPath().relativize(file).toString().replace('\\', '/');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void deleteScratch(Path scratch) {
        try {
            FileSystemUtils.deleteRecursively(scratch);
        } catch (IOException e) {
            log.warn("Failed to delete scratch directory {}: {}", scratch, e.getMessage());
        }
    }
}
