package com.github.salilvnair.convflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "convflow.session-cache")
@Getter
@Setter
public class ConvFlowSessionCacheConfig {

    private int maxSize = 10_000;
    private long maxMemoryMb = 100;
    private Duration defaultTtl = Duration.ofHours(1);
    private Duration maxTtl = Duration.ofHours(24);
    private Duration minTtl = Duration.ofMinutes(1);
    private EvictionStrategy evictionStrategy = EvictionStrategy.LRU;
    private int compressionThreshold = 1024;
    private boolean compressionEnabled = true;
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private int userSessionLimit = 5;
    private int tenantSessionLimit = 1000;
    private int topTrackedKeys = 10;

    public long maxMemoryBytes() {
        return maxMemoryMb * 1024L * 1024L;
    }

    public enum EvictionStrategy {
        /** Least recently accessed first. */
        LRU,
        /** Fewest accesses first. */
        LFU,
        /** Nearest expiry first. */
        TTL,
        /** Largest entry first. */
        SIZE
    }
}
