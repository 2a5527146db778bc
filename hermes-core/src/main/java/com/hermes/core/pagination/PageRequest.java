package com.hermes.core.pagination;

import java.util.Set;

/**
 * Validated pagination window and expand-set for one request.
 * The same window applies to every relation rendered in the response.
 */
public record PageRequest(
    int offset,
    int limit,
    Set<String> expand
) {
    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0: " + limit);
        }
        expand = Set.copyOf(expand);
    }

    public static PageRequest of(int offset, int limit, String... expand) {
        return new PageRequest(offset, limit, Set.of(expand));
    }

    /**
     * Check if the relation should be rendered in full.
     */
    public boolean expands(String relation) {
        return expand.contains(relation);
    }
}
