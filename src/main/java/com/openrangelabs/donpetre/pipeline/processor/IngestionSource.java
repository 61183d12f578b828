package com.openrangelabs.donpetre.pipeline.processor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A named byte source, opened lazily by the processor that reads it.
 *
 * <p>Every call to {@link #openStream()} yields a fresh stream that the caller must close.
 */
public final class IngestionSource {

    @FunctionalInterface
    public interface StreamOpener {
        InputStream open() throws IOException;
    }

    private final String name;
    private final Path path;
    private final StreamOpener opener;

    private IngestionSource(String name, Path path, StreamOpener opener) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = path;
        this.opener = Objects.requireNonNull(opener, "opener");
    }

    public static IngestionSource ofPath(Path path) {
        Path fileName = path.getFileName();
        return new IngestionSource(fileName != null ? fileName.toString() : path.toString(), path,
                () -> Files.newInputStream(path));
    }

    public static IngestionSource ofBytes(String name, byte[] content) {
        byte[] copy = content.clone();
        return new IngestionSource(name, null, () -> new ByteArrayInputStream(copy));
    }

    public static IngestionSource ofStream(String name, StreamOpener opener) {
        return new IngestionSource(name, null, opener);
    }

    /**
     * A source with no byte content, for processors that pull from elsewhere (API connectors).
     */
    public static IngestionSource named(String name) {
        return new IngestionSource(name, null, InputStream::nullInputStream);
    }

    public InputStream openStream() throws IOException {
        return opener.open();
    }

    public String getName() {
        return name;
    }

    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    /**
     * Lower-case extension of the source name without the dot, or an empty string.
     */
    public String getExtension() {
        int dot = name.lastIndexOf('.');
        return dot >= 0 && dot < name.length() - 1
                ? name.substring(dot + 1).toLowerCase(Locale.ROOT)
                : "";
    }

    @Override
    public String toString() {
        return "IngestionSource{name='" + name + "'}";
    }
}
