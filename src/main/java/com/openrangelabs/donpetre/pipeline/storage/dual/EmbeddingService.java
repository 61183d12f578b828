package com.openrangelabs.donpetre.pipeline.storage.dual;

import reactor.core.publisher.Mono;

/**
 * External embedding generator. Treated as a single-call dependency: any retry or
 * backoff lives in the implementation, never in the adapter calling it.
 */
@FunctionalInterface
public interface EmbeddingService {

    Mono<float[]> generate(String text, String model);
}
