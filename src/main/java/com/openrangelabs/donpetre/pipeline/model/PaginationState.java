package com.openrangelabs.donpetre.pipeline.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Position and termination rule of a paged REST crawl.
 *
 * <ul>
 *   <li>{@code NONE}: exactly one request</li>
 *   <li>{@code PAGE}: 1-based counter, stops on an empty page, a page shorter than the page size,
 *       or the page limit</li>
 *   <li>{@code OFFSET}: advances by the number of items returned, stops on an empty page or the
 *       page limit</li>
 *   <li>{@code CURSOR}: follows the next cursor, stops when it is absent or on the page limit</li>
 * </ul>
 */
public class PaginationState {

    private final PaginationType type;
    private final Integer pageSize;
    private final Integer maxPages;

    private int page = 1;
    private long offset;
    private String cursor;
    private int pagesFetched;
    private long itemsFetched;
    private boolean exhausted;

    public PaginationState(PaginationType type, Integer pageSize, Integer maxPages) {
        this(type, pageSize, maxPages, 0L, null);
    }

    public PaginationState(PaginationType type, Integer pageSize, Integer maxPages,
                           long initialOffset, String initialCursor) {
        this.type = type != null ? type : PaginationType.NONE;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        this.offset = initialOffset;
        this.cursor = initialCursor;
    }

    /**
     * Records a fetched page and moves to the next position, or marks the crawl exhausted.
     *
     * @param itemCount  number of items the page returned
     * @param nextCursor next cursor extracted from the response, may be null
     */
    public void advance(int itemCount, String nextCursor) {
        pagesFetched++;
        itemsFetched += itemCount;

        switch (type) {
            case PAGE:
                if (itemCount == 0 || (pageSize != null && itemCount < pageSize)) {
                    exhausted = true;
                } else {
                    page++;
                }
                break;
            case OFFSET:
                if (itemCount == 0) {
                    exhausted = true;
                } else {
                    offset += itemCount;
                }
                break;
            case CURSOR:
                if (nextCursor == null || nextCursor.isBlank()) {
                    exhausted = true;
                } else {
                    cursor = nextCursor;
                }
                break;
            default:
                exhausted = true;
        }

        if (maxPages != null && pagesFetched >= maxPages) {
            exhausted = true;
        }
    }

    public boolean hasNext() {
        return !exhausted;
    }

    /**
     * The coordinates of the page about to be fetched, recorded on every item it yields.
     */
    public Map<String, Object> coordinates() {
        Map<String, Object> coordinates = new LinkedHashMap<>();
        coordinates.put("pagination_type", type.name().toLowerCase(Locale.ROOT));
        switch (type) {
            case PAGE:
                coordinates.put("page", page);
                break;
            case OFFSET:
                coordinates.put("offset", offset);
                break;
            case CURSOR:
                coordinates.put("cursor", cursor);
                break;
            default:
                break;
        }
        coordinates.put("page_index", pagesFetched);
        return coordinates;
    }

    public PaginationType getType() { return type; }
    public Integer getPageSize() { return pageSize; }
    public Integer getMaxPages() { return maxPages; }
    public int getPage() { return page; }
    public long getOffset() { return offset; }
    public String getCursor() { return cursor; }
    public int getPagesFetched() { return pagesFetched; }
    public long getItemsFetched() { return itemsFetched; }

    @Override
    public String toString() {
        return "PaginationState{" +
                "type=" + type +
                ", page=" + page +
                ", offset=" + offset +
                ", cursor='" + cursor + '\'' +
                ", pagesFetched=" + pagesFetched +
                ", exhausted=" + exhausted +
                '}';
    }
}
