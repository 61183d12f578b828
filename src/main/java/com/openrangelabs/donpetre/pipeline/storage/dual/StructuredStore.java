package com.openrangelabs.donpetre.pipeline.storage.dual;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Document-store side of a dual write.
 */
public interface StructuredStore {

    Mono<Void> upsert(List<StructuredDocument> documents);

    Mono<Boolean> exists(String fingerprint);

    default Mono<Void> close() {
        return Mono.empty();
    }
}
