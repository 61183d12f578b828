package com.openrangelabs.donpetre.pipeline.service;

import com.openrangelabs.donpetre.pipeline.exception.UnsupportedFormatException;
import com.openrangelabs.donpetre.pipeline.fingerprint.ContentFingerprinter;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;
import com.openrangelabs.donpetre.pipeline.model.IngestionResult;
import com.openrangelabs.donpetre.pipeline.processor.BatchProcessor;
import com.openrangelabs.donpetre.pipeline.processor.IngestionHooks;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.processor.ProgressListener;
import com.openrangelabs.donpetre.pipeline.processor.file.FileFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Routes sources to their registered processor and injects the shared hooks.
 *
 * <p>Processors and hooks can be replaced at any time; a run picks up the hooks that are
 * registered when it starts.
 */
@Service
public class IngestionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

    static final String DIRECTORY_SOURCE_TYPE = "directory";

    private final Map<String, BatchProcessor> processors = new ConcurrentHashMap<>();

    private volatile UnaryOperator<DataRecord> enrichmentFunction;
    private volatile Predicate<DataRecord> validationFunction;
    private volatile ProgressListener progressCallback;
    private volatile IngestionErrorHandler errorHandler;

    public IngestionPipeline(List<BatchProcessor> processorList) {
        this.processors.putAll(processorList.stream()
                .collect(Collectors.toMap(BatchProcessor::getSourceType, Function.identity(),
                        (first, second) -> second)));

        logger.info("Initialized ingestion pipeline with processors: {}", processors.keySet());
    }

    public void registerProcessor(String sourceType, BatchProcessor processor) {
        BatchProcessor previous = processors.put(sourceType, processor);
        logger.info("Registered processor {} for source type {}{}", processor.getClass().getSimpleName(),
                sourceType, previous != null ? " (replaced " + previous.getClass().getSimpleName() + ")" : "");
    }

    public void setEnrichmentFunction(UnaryOperator<DataRecord> enrichmentFunction) {
        this.enrichmentFunction = enrichmentFunction;
    }

    public void setValidationFunction(Predicate<DataRecord> validationFunction) {
        this.validationFunction = validationFunction;
    }

    public void setProgressCallback(ProgressListener progressCallback) {
        this.progressCallback = progressCallback;
    }

    public void setErrorHandler(IngestionErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    public Set<String> getSourceTypes() {
        return Set.copyOf(processors.keySet());
    }

    /**
     * Ingest one source with the processor registered for {@code sourceType}.
     *
     * @throws IllegalArgumentException when no processor is registered for the type
     */
    public Mono<IngestionResult> ingest(String sourceType, IngestionSource source) {
        BatchProcessor processor = processors.get(sourceType);
        if (processor == null) {
            throw new IllegalArgumentException("No processor registered for source type: " + sourceType);
        }
        IngestionHooks hooks = currentHooks();
        IngestionErrorHandler handler = errorHandler;
        LocalDateTime startedAt = LocalDateTime.now();

        Mono<IngestionResult> run = Mono.defer(() -> processor.ingest(source, hooks));
        if (handler == null) {
            return run;
        }
        return run.onErrorResume(error -> {
            handler.handle(error, new IngestionContext(sourceType, source.getName(), startedAt));
            return Mono.just(IngestionResult.failed(sourceType, source.getName(), error));
        });
    }

    /**
     * Ingest a file, choosing the processor by its extension.
     */
    public Mono<IngestionResult> ingestFile(Path file) {
        IngestionSource source = IngestionSource.ofPath(file);
        FileFormat format = FileFormat.fromExtension(source.getExtension())
                .orElseThrow(() -> new UnsupportedFormatException(source.getExtension()));
        return ingest(format.getSourceType(), source);
    }

    /**
     * Ingest every file of a known format under {@code directory}, one after another, and
     * aggregate the results. A failing file is reported in the aggregate and does not stop the
     * remaining files. Files whose bytes match an earlier file of the same run are skipped.
     */
    public Mono<IngestionResult> ingestDirectory(Path directory, boolean recursive) {
        return Mono.fromCallable(() -> listFiles(directory, recursive))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(files -> {
                    Set<String> seenHashes = new HashSet<>();
                    return Flux.fromIterable(files)
                            .filter(file -> {
                                if (!seenHashes.add(ContentFingerprinter.sha256(file))) {
                                    logger.info("Skipping {}: identical to a file already ingested", file);
                                    return false;
                                }
                                return true;
                            })
                            .concatMap(file -> Mono.defer(() -> ingestFile(file))
                                    .onErrorResume(error -> {
                                        logger.error("Failed to ingest {}: {}", file, error.getMessage());
                                        return Mono.just(IngestionResult.failed(extension(file), file.toString(), error));
                                    }))
                            .collectList();
                })
                .map(results -> IngestionResult.combine(DIRECTORY_SOURCE_TYPE, directory.toString(), results))
                .doOnSuccess(result -> logger.info("Directory {} ingested: {}", directory, result));
    }

    private List<Path> listFiles(Path directory, boolean recursive) throws IOException {
        try (Stream<Path> walk = recursive ? Files.walk(directory) : Files.list(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(file -> {
                        boolean known = FileFormat.fromExtension(extension(file)).isPresent();
                        if (!known) {
                            logger.debug("Skipping {}: unknown file type", file);
                        }
                        return known;
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static String extension(Path file) {
        return IngestionSource.ofPath(file).getExtension();
    }

    private IngestionHooks currentHooks() {
        return IngestionHooks.builder()
                .enrichment(enrichmentFunction)
                .validation(validationFunction)
                .progressListener(progressCallback)
                .build();
    }
}
