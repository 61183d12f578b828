package com.openrangelabs.donpetre.pipeline.upload;

import com.openrangelabs.donpetre.pipeline.exception.FileRejectedException;
import com.openrangelabs.donpetre.pipeline.model.IngestionResult;
import com.openrangelabs.donpetre.pipeline.processor.IngestionSource;
import com.openrangelabs.donpetre.pipeline.processor.file.FileFormat;
import com.openrangelabs.donpetre.pipeline.service.IngestionPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Entry point for caller-supplied uploads.
 *
 * <p>The extension is checked first, then the stream is spooled to a temporary file while its
 * size is counted; an upload over the limit is rejected before the pipeline runs. The spooled
 * file is deleted however the run ends.
 */
@Slf4j
@Component
public class UploadGate {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final IngestionPipeline pipeline;
    private final UploadPolicy policy;

    public UploadGate(IngestionPipeline pipeline, UploadPolicy policy) {
        policy.validate();
        this.pipeline = pipeline;
        this.policy = policy;
    }

    public Mono<IngestionResult> accept(String fileName, InputStream content) {
        String extension = IngestionSource.named(fileName).getExtension();
        FileFormat format = FileFormat.fromExtension(extension)
                .filter(FileFormat::isSupported)
                .filter(known -> policy.isAllowed(extension))
                .orElse(null);
        if (format == null) {
            return Mono.error(new FileRejectedException(FileRejectedException.Reason.UNSUPPORTED_EXTENSION,
                    "File type not accepted: " + (extension.isEmpty() ? fileName : extension)));
        }

        return Mono.using(
                        () -> Files.createTempFile("upload-", "." + extension),
                        spooled -> Mono.fromCallable(() -> spool(content, spooled))
                                .flatMap(size -> {
                                    log.debug("Spooled upload {} ({} bytes)", fileName, size);
                                    return pipeline.ingest(format.getSourceType(),
                                            renamed(fileName, spooled));
                                }),
                        this::deleteSpooled)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Copies at most {@code maxBytes}; one more byte rejects the upload.
     */
    private long spool(InputStream content, Path target) throws IOException {
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = content; OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (total > policy.getMaxBytes()) {
                    throw new FileRejectedException(FileRejectedException.Reason.TOO_LARGE,
                            String.format(Locale.ROOT, "Upload exceeds %d bytes", policy.getMaxBytes()));
                }
                out.write(buffer, 0, read);
            }
        }
        return total;
    }

    private static IngestionSource renamed(String fileName, Path spooled) {
        return IngestionSource.ofStream(fileName, () -> Files.newInputStream(spooled));
    }

    private void deleteSpooled(Path spooled) {
        try {
            Files.deleteIfExists(spooled);
        } catch (IOException e) {
            log.warn("Failed to delete spooled upload {}: {}", spooled, e.getMessage());
        }
    }
}
