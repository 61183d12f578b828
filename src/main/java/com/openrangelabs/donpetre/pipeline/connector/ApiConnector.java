package com.openrangelabs.donpetre.pipeline.connector;

import com.openrangelabs.donpetre.pipeline.model.ConnectorMetrics;
import com.openrangelabs.donpetre.pipeline.model.ProcessedData;
import com.openrangelabs.donpetre.pipeline.model.SourceType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Base interface for API and stream connectors.
 *
 * @param <C> connector-specific configuration
 */
public interface ApiConnector<C> {

    /**
     * Get the connector type identifier
     */
    String getConnectorType();

    SourceType getSourceType();

    /**
     * Validate connector configuration
     */
    Mono<Void> validateConfiguration(C config);

    /**
     * Lazily fetch items from the remote source. Nothing is requested until subscription.
     */
    Flux<ProcessedData> fetchData(C config);

    /**
     * Get connector-specific metrics
     */
    Mono<ConnectorMetrics> getMetrics();
}
