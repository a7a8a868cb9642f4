package com.github.salilvnair.convflow.config;

import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
public class ConvFlowCacheConfiguration {
    // Imported by @CfEnableCaching so flow node lookups are served from the cache manager.
}
