package com.hermes.core.pagination;

import com.hermes.core.exception.ValidationException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns raw offset, limit and expand query parameters into a {@link PageRequest}.
 * 
 * <ul>
 *   <li>offset defaults to 0 and must be a non-negative integer</li>
 *   <li>limit defaults to the default page size, must be a positive integer,
 *       and is capped at the maximum page size</li>
 *   <li>expand values may repeat and may each hold a comma-separated list;
 *       names are case-sensitive and unknown names are kept as-is</li>
 * </ul>
 */
public class PaginationPolicy {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private final int defaultLimit;
    private final int maxLimit;

    public PaginationPolicy() {
        this(DEFAULT_LIMIT, MAX_LIMIT);
    }

    public PaginationPolicy(int defaultLimit, int maxLimit) {
        if (defaultLimit <= 0 || maxLimit < defaultLimit) {
            throw new IllegalArgumentException(String.format(
                "Invalid page sizes: default=%d, max=%d", defaultLimit, maxLimit));
        }
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Resolve the raw parameters.
     * 
     * @param rawOffset offset parameter, or null
     * @param rawLimit limit parameter, or null
     * @param rawExpand expand parameter values, or null
     * @throws ValidationException if offset or limit is malformed
     */
    public PageRequest resolve(String rawOffset, String rawLimit, Collection<String> rawExpand) {
        int offset = rawOffset == null || rawOffset.isBlank() ? 0 : parse("offset", rawOffset);
        if (offset < 0) {
            throw ValidationException.invalidArgument("offset", rawOffset);
        }

        int limit = rawLimit == null || rawLimit.isBlank() ? defaultLimit : parse("limit", rawLimit);
        if (limit <= 0) {
            throw ValidationException.invalidArgument("limit", rawLimit);
        }

        return new PageRequest(offset, Math.min(limit, maxLimit), parseExpand(rawExpand));
    }

    public int defaultLimit() {
        return defaultLimit;
    }

    public int maxLimit() {
        return maxLimit;
    }

    private static int parse(String name, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidArgument(name, raw);
        }
    }

    private static Set<String> parseExpand(Collection<String> rawExpand) {
        Set<String> expand = new LinkedHashSet<>();
        if (rawExpand == null) {
            return expand;
        }
        for (String value : rawExpand) {
            if (value == null) {
                continue;
            }
            for (String relation : value.split(",")) {
                String trimmed = relation.trim();
                if (!trimmed.isEmpty()) {
                    expand.add(trimmed);
                }
            }
        }
        return expand;
    }
}
