package com.hermes.engine.service;

import com.hermes.core.pagination.PageRequest;
import java.util.List;
import java.util.function.Function;

/**
 * One window of a filtered listing plus the total number of matches.
 */
public record PagedResult<T>(
    List<T> items,
    long total,
    int offset,
    int limit
) {
    public static <T> PagedResult<T> of(List<T> items, long total, PageRequest page) {
        return new PagedResult<>(List.copyOf(items), total, page.offset(), page.limit());
    }

    public static <T> PagedResult<T> empty(PageRequest page) {
        return new PagedResult<>(List.of(), 0L, page.offset(), page.limit());
    }

    public <R> PagedResult<R> map(Function<T, R> mapper) {
        return new PagedResult<>(items.stream().map(mapper).toList(), total, offset, limit);
    }
}
