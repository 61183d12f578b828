package com.openrangelabs.donpetre.pipeline.connector.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.openrangelabs.donpetre.pipeline.connector.AbstractApiConnector;
import com.openrangelabs.donpetre.pipeline.connector.JsonPaths;
import com.openrangelabs.donpetre.pipeline.exception.ConnectorException;
import com.openrangelabs.donpetre.pipeline.model.PaginationState;
import com.openrangelabs.donpetre.pipeline.model.ProcessedData;
import com.openrangelabs.donpetre.pipeline.model.SourceType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paginated REST connector.
 *
 * <p>Pages are requested one after another and the next request is only issued once the
 * current page's items have been consumed. Every item carries the coordinates of the page it
 * came from plus its index within that page.
 */
@Component
public class RestApiConnector extends AbstractApiConnector<RestConnectorConfig> {

    private static final String CONNECTOR_TYPE = "rest";

    private final WebClient webClient;

    public RestApiConnector(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(objectMapper);
        this.webClient = webClientBuilder.build();
    }

    @Override
    public String getConnectorType() {
        return CONNECTOR_TYPE;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.REST;
    }

    @Override
    public Mono<Void> validateConfiguration(RestConnectorConfig config) {
        return Mono.fromRunnable(config::validate);
    }

    @Override
    protected Flux<ProcessedData> doFetch(RestConnectorConfig config) {
        PaginationState state = new PaginationState(config.getPaginationType(), config.getPageSize(),
                config.getMaxPages());
        return crawl(config, state);
    }

    private Flux<ProcessedData> crawl(RestConnectorConfig config, PaginationState state) {
        if (!state.hasNext()) {
            logger.debug("Pagination finished for {} after {} pages", config.getUrl(), state.getPagesFetched());
            return Flux.empty();
        }
        Map<String, Object> coordinates = state.coordinates();
        URI uri = buildUri(config, state);

        return requestPage(config, uri)
                .flatMapMany(body -> {
                    List<JsonNode> items = extractItems(body, config.getResultsPath());
                    String nextCursor = config.getCursorPath() != null
                            ? JsonPaths.text(body, config.getCursorPath())
                            : null;
                    long itemsBefore = state.getItemsFetched();
                    state.advance(items.size(), nextCursor);
                    logger.debug("Fetched page {} of {}: {} items", state.getPagesFetched(), config.getUrl(), items.size());

                    int pagesFetched = state.getPagesFetched();
                    List<ProcessedData> page = new ArrayList<>(items.size());
                    for (int i = 0; i < items.size(); i++) {
                        Map<String, Object> metadata = new LinkedHashMap<>(coordinates);
                        metadata.put("item_index", i);
                        Map<String, Object> stats = new LinkedHashMap<>();
                        stats.put("total_items", itemsBefore + i + 1);
                        stats.put("pages_fetched", pagesFetched);
                        page.add(processedData(items.get(i), uri.toString(), metadata, stats));
                    }
                    return Flux.fromIterable(page)
                            .concatWith(Flux.defer(() -> crawl(config, state)));
                });
    }

    URI buildUri(RestConnectorConfig config, PaginationState state) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(config.getUrl());
        config.getQueryParams().forEach((name, value) -> builder.queryParam(name, value));

        switch (state.getType()) {
            case PAGE:
                builder.queryParam(config.getPageParam(), state.getPage());
                if (config.getPageSize() != null) {
                    builder.queryParam(config.getPageSizeParam(), config.getPageSize());
                }
                break;
            case OFFSET:
                builder.queryParam(config.getOffsetParam(), state.getOffset());
                if (config.getPageSize() != null) {
                    builder.queryParam(config.getLimitParam(), config.getPageSize());
                }
                break;
            case CURSOR:
                if (state.getCursor() != null) {
                    builder.queryParam(config.getCursorParam(), state.getCursor());
                }
                if (config.getPageSize() != null) {
                    builder.queryParam(config.getLimitParam(), config.getPageSize());
                }
                break;
            default:
                break;
        }
        return builder.encode().build().toUri();
    }

    private Mono<JsonNode> requestPage(RestConnectorConfig config, URI uri) {
        recordRequest();
        return webClient.get()
                .uri(uri)
                .headers(headers -> config.getHeaders().forEach(headers::set))
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(JsonNode.class)
                                .defaultIfEmpty(MissingNode.getInstance());
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> {
                                logger.warn("REST request to {} returned {}: {}", uri, response.statusCode().value(),
                                        body.length() > 200 ? body.substring(0, 200) : body);
                                return Mono.<JsonNode>error(new ConnectorException(uri.toString(),
                                        response.statusCode().value(), "REST request failed"));
                            });
                })
                .timeout(config.getRequestTimeout())
                .onErrorMap(WebClientRequestException.class,
                        error -> new ConnectorException(uri.toString(), "REST request could not be sent", error));
    }

    private static List<JsonNode> extractItems(JsonNode body, String resultsPath) {
        JsonNode results = JsonPaths.resolve(body, resultsPath);
        List<JsonNode> items = new ArrayList<>();
        if (results.isArray()) {
            results.forEach(items::add);
        } else if (!results.isMissingNode() && !results.isNull()) {
            items.add(results);
        }
        return items;
    }
}
