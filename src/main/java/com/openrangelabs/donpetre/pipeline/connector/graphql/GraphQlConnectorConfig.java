package com.openrangelabs.donpetre.pipeline.connector.graphql;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class GraphQlConnectorConfig {

    String url;

    String query;

    @Singular
    Map<String, Object> variables;

    String operationName;

    @Singular
    Map<String, String> headers;

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);

    public void validate() {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("GraphQL url is required");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("GraphQL query is required");
        }
    }
}
