package com.github.salilvnair.convflow.cache;

import lombok.Builder;

import java.util.Map;

@Builder
public record SessionCacheMetrics(
        long hits,
        long misses,
        long evictions,
        long compressions,
        long decompressions,
        double hitRatio,
        int entryCount,
        long memoryUsageBytes,
        int userCount,
        int tenantCount,
        int compressedEntries,
        Map<String, Integer> topUsers,
        Map<String, Integer> topTenants
) {
}
