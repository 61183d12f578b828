package com.openrangelabs.donpetre.pipeline.connector.rest;

import com.openrangelabs.donpetre.pipeline.model.PaginationType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Endpoint and pagination settings of one REST crawl.
 */
@Value
@Builder(toBuilder = true)
public class RestConnectorConfig {

    String url;

    @Singular
    Map<String, String> headers;

    @Singular
    Map<String, String> queryParams;

    @Builder.Default
    PaginationType paginationType = PaginationType.NONE;

    @Builder.Default
    String pageParam = "page";

    @Builder.Default
    String pageSizeParam = "page_size";

    @Builder.Default
    String offsetParam = "offset";

    @Builder.Default
    String limitParam = "limit";

    @Builder.Default
    String cursorParam = "cursor";

    /**
     * Items per request; sent as page size (page mode) or limit (offset and cursor mode).
     */
    Integer pageSize;

    Integer maxPages;

    /**
     * Dotted path to the item list, e.g. {@code data.items}. Null means the body itself.
     */
    String resultsPath;

    /**
     * Dotted path to the next cursor, e.g. {@code meta.next_cursor}.
     */
    String cursorPath;

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);

    public void validate() {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("REST url is required");
        }
        if (pageSize != null && pageSize <= 0) {
            throw new IllegalArgumentException("page_size must be greater than 0, got " + pageSize);
        }
        if (maxPages != null && maxPages <= 0) {
            throw new IllegalArgumentException("max_pages must be greater than 0, got " + maxPages);
        }
        if (paginationType == PaginationType.CURSOR && (cursorPath == null || cursorPath.isBlank())) {
            throw new IllegalArgumentException("cursor pagination requires a cursor path");
        }
    }
}
