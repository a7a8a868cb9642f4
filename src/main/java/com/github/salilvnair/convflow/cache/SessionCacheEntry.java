package com.github.salilvnair.convflow.cache;

import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.SessionPriority;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Owned exclusively by {@link SessionCache}; every field is guarded by the cache lock.
 */
@Getter
class SessionCacheEntry {

    private final String sessionId;
    private final String userId;
    private final String tenantId;
    private final SessionPriority priority;
    private final Set<String> tags;
    private final String source;
    private final Instant createdAt;
    private final long originalSize;

    private final ConversationSession session;
    private final byte[] compressed;

    private Duration ttl;
    private Instant lastAccessedAt;
    private long accessCount;
    private long accessSequence;

    SessionCacheEntry(String sessionId,
                      ConversationSession session,
                      byte[] serialized,
                      boolean compress,
                      SessionPriority priority,
                      Set<String> tags,
                      String source,
                      Duration ttl,
                      Instant now,
                      long accessSequence) {
        this.sessionId = sessionId;
        this.userId = session.getUserId();
        this.tenantId = session.getTenantId();
        this.priority = priority;
        this.tags = Set.copyOf(tags);
        this.source = source;
        this.createdAt = now;
        this.originalSize = serialized.length;
        this.compressed = compress ? SessionCompressor.compress(serialized) : null;
        this.session = compress ? null : session;
        this.ttl = ttl;
        this.lastAccessedAt = now;
        this.accessCount = 0;
        this.accessSequence = accessSequence;
    }

    boolean isCompressed() {
        return compressed != null;
    }

    long storedSize() {
        return compressed != null ? compressed.length : originalSize;
    }

    Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }

    Duration remaining(Instant now) {
        Duration remaining = Duration.between(now, expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    void touch(Instant now, long sequence) {
        lastAccessedAt = now;
        accessCount++;
        accessSequence = sequence;
    }

    void updateTtl(Duration ttl) {
        this.ttl = ttl;
    }

    /** Returns a caller-owned copy of the stored session. */
    ConversationSession materialize() {
        ConversationSession copy = compressed != null
                ? JsonUtil.fromJson(SessionCompressor.decompress(compressed), ConversationSession.class)
                : session.copy();
        copy.setExpiresAt(expiresAt());
        return copy;
    }
}
