package com.openrangelabs.donpetre.pipeline.model;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reconnect and message bookkeeping for one streaming ingestion run.
 *
 * <p>The message counter spans reconnects; the attempt counter resets on every
 * successful connect.
 */
public class ConnectionState {

    static final Duration BACKOFF_STEP = Duration.ofSeconds(2);
    static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final int maxReconnectAttempts;
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicLong messageCount = new AtomicLong();
    private final AtomicInteger connections = new AtomicInteger();
    private final AtomicLong droppedMessages = new AtomicLong();
    private volatile Instant connectedAt;
    private volatile String lastCursor;

    public ConnectionState(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public void onConnected() {
        reconnectAttempts.set(0);
        connections.incrementAndGet();
        connectedAt = Instant.now();
    }

    /**
     * @return the attempt count after this failure
     */
    public int recordFailure() {
        return reconnectAttempts.incrementAndGet();
    }

    public boolean canReconnect() {
        return reconnectAttempts.get() < maxReconnectAttempts;
    }

    /**
     * Linear backoff capped at thirty seconds: {@code min(attempts * 2s, 30s)}.
     */
    public Duration backoff() {
        return backoff(reconnectAttempts.get());
    }

    public static Duration backoff(int attempts) {
        Duration delay = BACKOFF_STEP.multipliedBy(Math.max(attempts, 1));
        return delay.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay;
    }

    public long recordMessage() {
        return messageCount.incrementAndGet();
    }

    public boolean isMessageLimitReached(Long maxMessages) {
        return maxMessages != null && messageCount.get() >= maxMessages;
    }

    public void recordDropped() {
        droppedMessages.incrementAndGet();
    }

    public Duration connectionDuration() {
        Instant since = connectedAt;
        return since != null ? Duration.between(since, Instant.now()) : Duration.ZERO;
    }

    public void setLastCursor(String lastCursor) {
        this.lastCursor = lastCursor;
    }

    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public int getReconnectAttempts() { return reconnectAttempts.get(); }
    public long getMessageCount() { return messageCount.get(); }
    public int getConnections() { return connections.get(); }
    public String getLastCursor() { return lastCursor; }
    public long getDroppedMessages() { return droppedMessages.get(); }

    @Override
    public String toString() {
        return "ConnectionState{" +
                "reconnectAttempts=" + reconnectAttempts.get() + "/" + maxReconnectAttempts +
                ", messageCount=" + messageCount.get() +
                ", connections=" + connections.get() +
                ", droppedMessages=" + droppedMessages.get() +
                ", lastCursor=" + lastCursor +
                '}';
    }
}
