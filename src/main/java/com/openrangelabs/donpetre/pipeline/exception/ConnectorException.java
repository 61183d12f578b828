package com.openrangelabs.donpetre.pipeline.exception;

/**
 * Raised when an API connector cannot obtain a usable response from its endpoint.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class ConnectorException extends IngestionException {

    private final String url;
    private final int statusCode;

    public ConnectorException(String url, int statusCode, String message) {
        super(message + " [" + url + ", status " + statusCode + "]");
        this.url = url;
        this.statusCode = statusCode;
    }

    public ConnectorException(String url, String message, Throwable cause) {
        super(message + " [" + url + "]", cause);
        this.url = url;
        this.statusCode = -1;
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return the HTTP status, or -1 when the request never got a response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
