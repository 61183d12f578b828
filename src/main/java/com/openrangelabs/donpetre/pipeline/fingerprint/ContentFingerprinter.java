package com.openrangelabs.donpetre.pipeline.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openrangelabs.donpetre.pipeline.exception.IngestionException;
import com.openrangelabs.donpetre.pipeline.model.DataRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Default fingerprint: SHA-256 over the key-sorted {@code (field, stringified value)} pairs.
 *
 * <p>Nested maps are serialized with sorted keys, so two records that differ only in key
 * order at any depth share a fingerprint. The stamped {@value DataRecord#FINGERPRINT_FIELD}
 * field never contributes.
 */
public class ContentFingerprinter implements FingerprintFunction {

    private static final int BUFFER_SIZE = 8192;

    private final ObjectMapper canonicalMapper;

    public ContentFingerprinter() {
        this(new ObjectMapper());
    }

    public ContentFingerprinter(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Override
    public String fingerprint(DataRecord record) {
        Map<String, Object> sorted = new TreeMap<>(record.fields());
        sorted.remove(DataRecord.FINGERPRINT_FIELD);

        List<List<String>> pairs = new ArrayList<>(sorted.size());
        sorted.forEach((key, value) -> pairs.add(List.of(key, stringify(value))));

        try {
            return sha256(canonicalMapper.writeValueAsString(pairs));
        } catch (JsonProcessingException e) {
            throw new IngestionException("Cannot serialize record for fingerprinting", e);
        }
    }

    /**
     * Key-sorted JSON of the record's content, without the stamped fingerprint.
     */
    public String canonicalJson(DataRecord record) {
        Map<String, Object> sorted = new TreeMap<>(record.fields());
        sorted.remove(DataRecord.FINGERPRINT_FIELD);
        try {
            return canonicalMapper.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IngestionException("Cannot serialize record", e);
        }
    }

    private String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map || value instanceof Iterable || value.getClass().isArray()) {
            try {
                return canonicalMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IngestionException("Cannot serialize nested value for fingerprinting", e);
            }
        }
        return String.valueOf(value);
    }

    public static String sha256(String text) {
        return toHex(newDigest().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    public static String sha256(InputStream in) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return toHex(digest.digest());
    }

    public static String sha256(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return sha256(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot digest " + file, e);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
