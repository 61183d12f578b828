package com.openrangelabs.donpetre.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Normalized output of an API or stream connector, one per yielded item.
 *
 * <p>Instances are consumed immediately by the caller; the framework never persists them.
 * Items with {@code error == true} describe a failure (GraphQL errors, a dropped socket)
 * instead of source content.
 */
@Value
@Builder(toBuilder = true)
public class ProcessedData {

    JsonNode raw;

    String content;

    SourceType sourceType;

    String sourceUrl;

    @Singular("meta")
    Map<String, Object> metadata;

    String checksum;

    @Singular("stat")
    Map<String, Object> stats;

    boolean error;

    String errorMessage;

    @Builder.Default
    LocalDateTime createdAt = LocalDateTime.now();
}
