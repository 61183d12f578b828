package com.openrangelabs.donpetre.pipeline.storage.dual;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Vector/object-store side of a dual write.
 */
public interface VectorStore {

    Mono<Void> upsert(List<VectorDocument> documents);

    default Mono<Void> close() {
        return Mono.empty();
    }
}
