package com.github.salilvnair.convflow.cache;

import com.github.salilvnair.convflow.engine.session.SessionPriority;
import lombok.Builder;

import java.time.Duration;
import java.util.Set;

/**
 * Per-call overrides for {@link SessionCache#set}. Every field is optional.
 */
@Builder
public record SetOptions(Duration ttl, SessionPriority priority, Set<String> tags, Boolean compress, String source) {

    public static SetOptions defaults() {
        return SetOptions.builder().build();
    }
}
