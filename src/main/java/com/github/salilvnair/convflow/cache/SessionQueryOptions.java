package com.github.salilvnair.convflow.cache;

import lombok.Builder;

import java.util.Set;

@Builder
public record SessionQueryOptions(
        String userId,
        String tenantId,
        boolean includeExpired,
        SortBy sortBy,
        Integer limit,
        Set<String> tags
) {

    public static SessionQueryOptions defaults() {
        return SessionQueryOptions.builder().build();
    }

    public enum SortBy {
        /** Most recently accessed first. */
        LAST_ACCESSED,
        /** Newest first. */
        CREATED,
        /** Soonest to expire first. */
        TTL_REMAINING,
        /** Largest first. */
        SIZE
    }
}
