package com.openrangelabs.donpetre.pipeline.connector.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.openrangelabs.donpetre.pipeline.connector.AbstractApiConnector;
import com.openrangelabs.donpetre.pipeline.connector.JsonPaths;
import com.openrangelabs.donpetre.pipeline.model.ConnectionState;
import com.openrangelabs.donpetre.pipeline.model.ProcessedData;
import com.openrangelabs.donpetre.pipeline.model.SourceType;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams messages from a WebSocket endpoint with bounded reconnects.
 *
 * <p>Each transport failure yields an error item and counts as one attempt; while attempts
 * remain and {@code reconnectOnError} is set, the connector waits
 * {@code min(attempts * 2s, 30s)} and connects again. A successful connect resets the attempt
 * counter. A clean close by the server ends the stream, as do {@code maxMessages} and
 * {@code timeout}. Cancelling the subscription closes the session.
 *
 * <p>With a {@code cursorPath} the latest cursor seen in a message survives reconnects and is
 * sent back as {@code resumeParam} on the next connect. At most {@code maxBufferedMessages}
 * items wait for a slow consumer; beyond that the oldest are dropped and counted.
 */
@Component
public class WebSocketConnector extends AbstractApiConnector<WebSocketConnectorConfig> {

    private static final String CONNECTOR_TYPE = "websocket";
    static final String MESSAGE_COUNT = "message_count";
    static final String LAST_CURSOR = "last_cursor";

    private final WebSocketClient client;

    public WebSocketConnector(WebSocketClient client, ObjectMapper objectMapper) {
        super(objectMapper);
        this.client = client;
    }

    @Override
    public String getConnectorType() {
        return CONNECTOR_TYPE;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.WEBSOCKET;
    }

    @Override
    public Mono<Void> validateConfiguration(WebSocketConnectorConfig config) {
        return Mono.fromRunnable(config::validate);
    }

    @Override
    protected Flux<ProcessedData> doFetch(WebSocketConnectorConfig config) {
        ConnectionState state = new ConnectionState(config.getMaxReconnectAttempts());
        Flux<ProcessedData> stream = connect(config, state)
                .onBackpressureBuffer(config.getMaxBufferedMessages(), dropped -> {
                    state.recordDropped();
                    logger.warn("Consumer of {} is behind, dropped buffered message", config.getUrl());
                }, BufferOverflowStrategy.DROP_OLDEST)
                .takeUntil(item -> isLastMessage(item, config.getMaxMessages()));
        if (config.getTimeout() != null) {
            stream = stream.take(config.getTimeout());
        }
        return stream.doFinally(signal -> logger.info("WebSocket stream {} ended ({}): {}",
                config.getUrl(), signal, state));
    }

    private Flux<ProcessedData> connect(WebSocketConnectorConfig config, ConnectionState state) {
        URI uri = connectUri(config, state);
        HttpHeaders headers = new HttpHeaders();
        config.getHeaders().forEach(headers::set);

        return Flux.<ProcessedData>create(sink -> {
                    recordRequest();
                    Disposable connection = client.execute(uri, headers,
                                    session -> handle(session, config, state, sink))
                            .subscribe(null, sink::error, sink::complete);
                    sink.onDispose(connection);
                })
                .onErrorResume(error -> {
                    int attempts = state.recordFailure();
                    logger.warn("WebSocket {} failed (attempt {}/{}): {}", config.getUrl(), attempts,
                            state.getMaxReconnectAttempts(), error.getMessage());
                    ProcessedData failure = errorItem(config.getUrl(), String.valueOf(error.getMessage()), null,
                            failureMetadata(error, attempts, state.getLastCursor()));
                    if (config.isReconnectOnError() && state.canReconnect()) {
                        Duration backoff = state.backoff();
                        logger.info("Reconnecting to {} in {}", config.getUrl(), backoff);
                        return Flux.just(failure)
                                .concatWith(Mono.delay(backoff).thenMany(Flux.defer(() -> connect(config, state))));
                    }
                    return Flux.just(failure);
                });
    }

    static URI connectUri(WebSocketConnectorConfig config, ConnectionState state) {
        String cursor = state.getLastCursor();
        if (config.getResumeParam() == null || cursor == null) {
            return URI.create(config.getUrl());
        }
        return UriComponentsBuilder.fromUriString(config.getUrl())
                .queryParam(config.getResumeParam(), cursor)
                .build()
                .encode()
                .toUri();
    }

    private Mono<Void> handle(WebSocketSession session, WebSocketConnectorConfig config,
                              ConnectionState state, FluxSink<ProcessedData> sink) {
        state.onConnected();
        logger.debug("Connected to {} (connection #{})", config.getUrl(), state.getConnections());

        Mono<Void> inbound = session.receive()
                .map(message -> toProcessedData(message.getPayloadAsText(), config, state))
                .doOnNext(sink::next)
                .takeUntil(item -> state.isMessageLimitReached(config.getMaxMessages()))
                .then();

        Flux<WebSocketMessage> outbound = outbound(session, config);
        if (outbound == null) {
            return inbound;
        }
        return Mono.firstWithSignal(inbound, session.send(outbound).then(Mono.never()));
    }

    private Flux<WebSocketMessage> outbound(WebSocketSession session, WebSocketConnectorConfig config) {
        Flux<WebSocketMessage> subscribe = config.getSubscribeMessage() != null
                ? Flux.just(session.textMessage(config.getSubscribeMessage()))
                : null;
        Flux<WebSocketMessage> heartbeat = config.getHeartbeatInterval() != null
                ? Flux.interval(config.getHeartbeatInterval())
                        .map(tick -> session.pingMessage(factory -> factory.wrap(new byte[0])))
                : null;
        if (subscribe != null && heartbeat != null) {
            return subscribe.concatWith(heartbeat);
        }
        return subscribe != null ? subscribe : heartbeat;
    }

    private static boolean isLastMessage(ProcessedData item, Long maxMessages) {
        if (item.isError() || maxMessages == null) {
            return false;
        }
        Object count = item.getStats().get(MESSAGE_COUNT);
        return count instanceof Long && (Long) count >= maxMessages;
    }

    private ProcessedData toProcessedData(String text, WebSocketConnectorConfig config, ConnectionState state) {
        JsonNode payload = decode(text);
        if (config.getCursorPath() != null) {
            String cursor = JsonPaths.text(payload, config.getCursorPath());
            if (cursor != null && !cursor.isBlank()) {
                state.setLastCursor(cursor);
            }
        }
        if (config.getTransform() != null) {
            JsonNode transformed = config.getTransform().apply(payload);
            payload = transformed != null ? transformed : payload;
        }
        long count = state.recordMessage();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("connection", state.getConnections());
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put(MESSAGE_COUNT, count);
        stats.put("connection_duration_ms", state.connectionDuration().toMillis());
        if (state.getLastCursor() != null) {
            stats.put(LAST_CURSOR, state.getLastCursor());
        }
        return processedData(payload, config.getUrl(), metadata, stats);
    }

    /**
     * JSON when the frame parses, otherwise the raw text.
     */
    private JsonNode decode(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && !node.isMissingNode() ? node : TextNode.valueOf(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private static Map<String, Object> failureMetadata(Throwable error, int attempts, String lastCursor) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_type", error.getClass().getSimpleName());
        metadata.put("reconnect_attempt", attempts);
        if (lastCursor != null) {
            metadata.put(LAST_CURSOR, lastCursor);
        }
        return metadata;
    }
}
