package com.openrangelabs.donpetre.pipeline.model;

import java.time.LocalDateTime;

/**
 * Running counters of one API connector instance.
 */
public class ConnectorMetrics {

    private final String connectorType;
    private final long itemsFetched;
    private final long errorItems;
    private final long requests;
    private final LocalDateTime lastActivity;

    public ConnectorMetrics(String connectorType, long itemsFetched, long errorItems, long requests,
                            LocalDateTime lastActivity) {
        this.connectorType = connectorType;
        this.itemsFetched = itemsFetched;
        this.errorItems = errorItems;
        this.requests = requests;
        this.lastActivity = lastActivity;
    }

    public double getErrorRate() {
        long total = itemsFetched + errorItems;
        return total > 0 ? (double) errorItems / total : 0.0;
    }

    public String getConnectorType() { return connectorType; }
    public long getItemsFetched() { return itemsFetched; }
    public long getErrorItems() { return errorItems; }
    public long getRequests() { return requests; }
    public LocalDateTime getLastActivity() { return lastActivity; }

    @Override
    public String toString() {
        return "ConnectorMetrics{" +
                "connectorType='" + connectorType + '\'' +
                ", itemsFetched=" + itemsFetched +
                ", errorItems=" + errorItems +
                ", requests=" + requests +
                ", errorRate=" + String.format("%.2f%%", getErrorRate() * 100) +
                ", lastActivity=" + lastActivity +
                '}';
    }
}
