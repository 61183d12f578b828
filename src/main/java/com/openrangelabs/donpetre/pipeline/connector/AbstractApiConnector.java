package com.openrangelabs.donpetre.pipeline.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openrangelabs.donpetre.pipeline.fingerprint.ContentFingerprinter;
import com.openrangelabs.donpetre.pipeline.model.ConnectorMetrics;
import com.openrangelabs.donpetre.pipeline.model.ProcessedData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Abstract base class for API connectors.
 * Validates the configuration before any request, keeps the metric counters and builds
 * {@link ProcessedData} items.
 */
public abstract class AbstractApiConnector<C> implements ApiConnector<C> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final ObjectMapper objectMapper;

    private final AtomicLong itemsFetched = new AtomicLong(0);
    private final AtomicLong errorItems = new AtomicLong(0);
    private final AtomicLong requests = new AtomicLong(0);
    private volatile LocalDateTime lastActivity;

    protected AbstractApiConnector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Flux<ProcessedData> fetchData(C config) {
        return validateConfiguration(config)
                .thenMany(Flux.defer(() -> doFetch(config)))
                .doOnNext(item -> {
                    lastActivity = item.getCreatedAt();
                    if (item.isError()) {
                        errorItems.incrementAndGet();
                    } else {
                        itemsFetched.incrementAndGet();
                    }
                });
    }

    @Override
    public Mono<ConnectorMetrics> getMetrics() {
        return Mono.fromCallable(() -> new ConnectorMetrics(
                getConnectorType(),
                itemsFetched.get(),
                errorItems.get(),
                requests.get(),
                lastActivity
        ));
    }

    /**
     * Template method producing the items of one fetch.
     */
    protected abstract Flux<ProcessedData> doFetch(C config);

    protected void recordRequest() {
        requests.incrementAndGet();
    }

    /**
     * Builds a content item. Textual payloads keep their text; anything else is serialized as JSON.
     */
    protected ProcessedData processedData(JsonNode raw, String sourceUrl,
                                          Map<String, Object> metadata, Map<String, Object> stats) {
        String content = raw.isTextual() ? raw.textValue() : raw.toString();
        return ProcessedData.builder()
                .raw(raw)
                .content(content)
                .sourceType(getSourceType())
                .sourceUrl(sourceUrl)
                .metadata(metadata)
                .stats(stats)
                .checksum(ContentFingerprinter.sha256(content))
                .build();
    }

    /**
     * Builds an item describing a failure instead of source content.
     */
    protected ProcessedData errorItem(String sourceUrl, String message, JsonNode detail,
                                      Map<String, Object> metadata) {
        JsonNode raw = detail != null ? detail : TextNode.valueOf(message);
        String content = raw.isTextual() ? raw.textValue() : raw.toString();
        return ProcessedData.builder()
                .raw(raw)
                .content(content)
                .sourceType(getSourceType())
                .sourceUrl(sourceUrl)
                .metadata(metadata != null ? metadata : Map.of())
                .checksum(ContentFingerprinter.sha256(content))
                .error(true)
                .errorMessage(message)
                .build();
    }
}
