package com.openrangelabs.donpetre.pipeline.connector.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.openrangelabs.donpetre.pipeline.connector.AbstractApiConnector;
import com.openrangelabs.donpetre.pipeline.exception.ConnectorException;
import com.openrangelabs.donpetre.pipeline.model.ProcessedData;
import com.openrangelabs.donpetre.pipeline.model.SourceType;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends one GraphQL request and flattens the {@code data} object into items.
 *
 * <p>A response carrying a top-level {@code errors} array never fails the fetch: it yields one
 * error item holding those errors, followed by whatever data could still be flattened.
 * Flattening rules: list-valued fields become one item per element, object fields are
 * recursed into, and an object without nested objects or lists is a single item.
 */
@Component
public class GraphQlConnector extends AbstractApiConnector<GraphQlConnectorConfig> {

    private static final String CONNECTOR_TYPE = "graphql";
    static final String FIELD_PATH = "field_path";

    private final WebClient webClient;

    public GraphQlConnector(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(objectMapper);
        this.webClient = webClientBuilder.build();
    }

    @Override
    public String getConnectorType() {
        return CONNECTOR_TYPE;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.GRAPHQL;
    }

    @Override
    public Mono<Void> validateConfiguration(GraphQlConnectorConfig config) {
        return Mono.fromRunnable(config::validate);
    }

    @Override
    protected Flux<ProcessedData> doFetch(GraphQlConnectorConfig config) {
        return execute(config).flatMapIterable(response -> toItems(config, response));
    }

    private Mono<JsonNode> execute(GraphQlConnectorConfig config) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("query", config.getQuery());
        request.put("variables", config.getVariables());
        if (config.getOperationName() != null) {
            request.put("operationName", config.getOperationName());
        }

        recordRequest();
        return webClient.post()
                .uri(config.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> config.getHeaders().forEach(headers::set))
                .bodyValue(request)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(JsonNode.class)
                                .defaultIfEmpty(MissingNode.getInstance());
                    }
                    return response.releaseBody()
                            .then(Mono.<JsonNode>error(new ConnectorException(config.getUrl(),
                                    response.statusCode().value(), "GraphQL request failed")));
                })
                .timeout(config.getRequestTimeout())
                .onErrorMap(WebClientRequestException.class,
                        error -> new ConnectorException(config.getUrl(), "GraphQL request could not be sent", error));
    }

    private List<ProcessedData> toItems(GraphQlConnectorConfig config, JsonNode response) {
        List<ProcessedData> items = new ArrayList<>();

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            logger.warn("GraphQL response from {} carried {} errors", config.getUrl(), errors.size());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("error_count", errors.size());
            if (config.getOperationName() != null) {
                metadata.put("operation_name", config.getOperationName());
            }
            items.add(errorItem(config.getUrl(), "GraphQL errors: " + firstMessage(errors), errors, metadata));
        }

        JsonNode data = response.path("data");
        if (data.isObject() || data.isArray()) {
            List<Map.Entry<String, JsonNode>> flattened = new ArrayList<>();
            flatten(data, "data", flattened);
            for (Map.Entry<String, JsonNode> entry : flattened) {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put(FIELD_PATH, entry.getKey());
                if (config.getOperationName() != null) {
                    metadata.put("operation_name", config.getOperationName());
                }
                items.add(processedData(entry.getValue(), config.getUrl(), metadata,
                        Map.of("total_items", flattened.size())));
            }
        }
        return items;
    }

    static void flatten(JsonNode node, String path, List<Map.Entry<String, JsonNode>> out) {
        if (node.isArray()) {
            node.forEach(element -> out.add(Map.entry(path, element)));
            return;
        }
        if (!node.isObject()) {
            return;
        }
        boolean nested = false;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            String fieldPath = path + "." + field.getKey();
            if (value.isArray()) {
                nested = true;
                value.forEach(element -> out.add(Map.entry(fieldPath, element)));
            } else if (value.isObject()) {
                nested = true;
                flatten(value, fieldPath, out);
            }
        }
        if (!nested && !node.isEmpty()) {
            out.add(Map.entry(path, node));
        }
    }

    private static String firstMessage(JsonNode errors) {
        String message = errors.get(0).path("message").asText("");
        return message.isEmpty() ? errors.get(0).toString() : message;
    }
}
