package com.openrangelabs.donpetre.pipeline.service;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * What was being ingested when an error handler is invoked.
 */
@Value
public class IngestionContext {

    String sourceType;

    String sourceName;

    LocalDateTime startedAt;
}
