package com.anchorinsights.metrics.dto;

import com.anchorinsights.metrics.filter.CorridorFilter;

/**
 * Parsed {@code GET /api/corridors} parameters.
 *
 * <p>{@code limit} and {@code offset} are part of the cache identity only. They do not
 * window the returned list.
 */
public record CorridorListQuery(
    long limit,
    long offset,
    SortBy sortBy,
    CorridorFilter filter
) {
    public static final long DEFAULT_LIMIT  = 50;
    public static final long DEFAULT_OFFSET = 0;

    public CorridorListQuery {
        if (sortBy == null) sortBy = SortBy.SUCCESS_RATE;
        if (filter == null) filter = CorridorFilter.none();
    }
}
