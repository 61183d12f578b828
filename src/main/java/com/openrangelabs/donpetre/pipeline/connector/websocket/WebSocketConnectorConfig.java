package com.openrangelabs.donpetre.pipeline.connector.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Streaming settings. {@code maxMessages} and {@code timeout} are optional stop conditions.
 */
@Value
@Builder(toBuilder = true)
public class WebSocketConnectorConfig {

    String url;

    @Singular
    Map<String, String> headers;

    /**
     * Sent once after every (re)connect, e.g. a channel subscription.
     */
    String subscribeMessage;

    /**
     * Interval of ping frames. Null disables heartbeats.
     */
    Duration heartbeatInterval;

    /**
     * Dotted path of a resume cursor inside each message. The latest value is kept across
     * reconnects and reported in the item stats.
     */
    String cursorPath;

    /**
     * Query parameter that carries the last cursor when reconnecting. Null reconnects to the
     * plain url.
     */
    String resumeParam;

    /**
     * Messages held for a slow consumer before the oldest are dropped.
     */
    @Builder.Default
    int maxBufferedMessages = 1024;

    @Builder.Default
    int maxReconnectAttempts = 5;

    @Builder.Default
    boolean reconnectOnError = true;

    Long maxMessages;

    Duration timeout;

    UnaryOperator<JsonNode> transform;

    public void validate() {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("WebSocket url is required");
        }
        if (maxReconnectAttempts <= 0) {
            throw new IllegalArgumentException("max_reconnect_attempts must be greater than 0, got "
                    + maxReconnectAttempts);
        }
        if (maxMessages != null && maxMessages <= 0) {
            throw new IllegalArgumentException("max_messages must be greater than 0, got " + maxMessages);
        }
        if (maxBufferedMessages <= 0) {
            throw new IllegalArgumentException("max_buffered_messages must be greater than 0, got "
                    + maxBufferedMessages);
        }
        if (heartbeatInterval != null && (heartbeatInterval.isZero() || heartbeatInterval.isNegative())) {
            throw new IllegalArgumentException("heartbeat_interval must be positive");
        }
    }
}
