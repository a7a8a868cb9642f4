package com.github.salilvnair.convflow.cache;

import com.github.salilvnair.convflow.config.ConvFlowSessionCacheConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.node.ConditionOperator;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.SessionPriority;
import com.github.salilvnair.convflow.util.JsonPathUtil;
import com.github.salilvnair.convflow.util.JsonUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory session store with TTL, per-user and per-tenant limits and pressure eviction.
 * <p>
 * The primary map and the user, tenant and tag indices are only touched while holding
 * {@link #lock}, so every index always reflects exactly the live key set.
 */
@Slf4j
@Component
public class SessionCache {

    private static final double MEMORY_TARGET_RATIO = 0.8;

    private final ConvFlowSessionCacheConfig config;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SessionCacheEntry> entries = new HashMap<>();
    private final Map<String, Set<String>> userIndex = new HashMap<>();
    private final Map<String, Set<String>> tenantIndex = new HashMap<>();
    private final Map<String, Set<String>> tagIndex = new HashMap<>();
    private final List<TtlPolicy> ttlPolicies = new CopyOnWriteArrayList<>();

    private long accessSequence;
    private long memoryUsage;
    private long hits;
    private long misses;
    private long evictions;
    private long compressions;
    private long decompressions;

    private volatile ScheduledExecutorService cleanupScheduler;

    public SessionCache(ConvFlowSessionCacheConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        validateConfig(config);
    }

    @PostConstruct
    void startCleanup() {
        long intervalMs = config.getCleanupInterval() == null ? 0 : config.getCleanupInterval().toMillis();
        if (intervalMs <= 0) {
            return;
        }
        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "convflow-session-cache-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        cleanupScheduler.scheduleWithFixedDelay(this::scheduledCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Session cache started maxSize={} maxMemoryMb={} eviction={} cleanupIntervalMs={}",
                config.getMaxSize(), config.getMaxMemoryMb(), config.getEvictionStrategy(), intervalMs);
    }

    @PreDestroy
    public void destroy() {
        ScheduledExecutorService scheduler = cleanupScheduler;
        if (scheduler != null) {
            scheduler.shutdownNow();
            cleanupScheduler = null;
        }
        clear();
        log.info("Session cache destroyed");
    }

    public Optional<ConversationSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            SessionCacheEntry entry = entries.get(sessionId);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                removeInternal(sessionId);
                evictions++;
                misses++;
                log.debug("Session cache entry expired sessionId={}", sessionId);
                return Optional.empty();
            }
            entry.touch(now, ++accessSequence);
            hits++;
            if (entry.isCompressed()) {
                decompressions++;
            }
            return Optional.of(entry.materialize());
        }
        finally {
            lock.unlock();
        }
    }

    public boolean contains(String sessionId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            SessionCacheEntry entry = entries.get(sessionId);
            return entry != null && !entry.isExpired(now);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Whether a live entry under {@code sessionId} belongs to someone other than the given
     * user and tenant. A {@code null} owner field on either side matches anything. Not counted
     * as an access.
     */
    public boolean isHeldByOtherOwner(String sessionId, String userId, String tenantId) {
        if (sessionId == null) {
            return false;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            SessionCacheEntry entry = entries.get(sessionId);
            if (entry == null || entry.isExpired(now)) {
                return false;
            }
            return !sameOwner(entry.getUserId(), userId) || !sameOwner(entry.getTenantId(), tenantId);
        }
        finally {
            lock.unlock();
        }
    }

    public boolean set(String sessionId, ConversationSession session) {
        return set(sessionId, session, SetOptions.defaults());
    }

    /**
     * Stores a copy of {@code session}. Replacing an existing key never triggers
     * limit-based eviction of other sessions on its own account.
     *
     * @return {@code false} when the session alone exceeds the memory ceiling
     */
    public boolean set(String sessionId, ConversationSession session, SetOptions options) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(session, "session");
        SetOptions opts = options == null ? SetOptions.defaults() : options;
        if (opts.ttl() != null && opts.ttl().isNegative()) {
            throw new ConversationFlowException(
                    ConversationFlowErrorCode.INVALID_CACHE_CONFIGURATION,
                    "Negative TTL is not allowed: " + opts.ttl());
        }

        Instant now = clock.instant();
        SessionPriority priority = opts.priority() != null
                ? opts.priority()
                : (session.getPriority() == null ? SessionPriority.NORMAL : session.getPriority());
        Duration ttl = calculateTtl(session, priority, opts.ttl());

        Set<String> tags = new LinkedHashSet<>();
        if (session.getTags() != null) {
            tags.addAll(session.getTags());
        }
        if (opts.tags() != null) {
            tags.addAll(opts.tags());
        }

        ConversationSession stored = session.copy();
        stored.setSessionId(sessionId);
        stored.setPriority(priority);
        stored.setTags(new LinkedHashSet<>(tags));
        stored.setExpiresAt(now.plus(ttl));
        byte[] serialized = JsonUtil.toJsonBytes(stored);
        boolean compressionAllowed = opts.compress() != null ? opts.compress() : config.isCompressionEnabled();
        boolean compress = compressionAllowed && serialized.length > config.getCompressionThreshold();

        lock.lock();
        try {
            SessionCacheEntry entry = new SessionCacheEntry(
                    sessionId, stored, serialized, compress, priority, tags,
                    opts.source(), ttl, now, ++accessSequence);

            // an oversized replacement leaves the current entry in place
            long maxMemory = config.maxMemoryBytes();
            if (entry.storedSize() > maxMemory) {
                log.warn("Session too large for cache sessionId={} sizeBytes={} maxMemoryBytes={}",
                        sessionId, entry.storedSize(), maxMemory);
                return false;
            }

            if (entries.containsKey(sessionId)) {
                removeInternal(sessionId);
            }
            else {
                enforceScopeLimit(userIndex, stored.getUserId(), config.getUserSessionLimit(), "user");
                enforceScopeLimit(tenantIndex, stored.getTenantId(), config.getTenantSessionLimit(), "tenant");
            }
            ensureCapacity(entry.storedSize());

            entries.put(sessionId, entry);
            memoryUsage += entry.storedSize();
            index(userIndex, entry.getUserId(), sessionId);
            index(tenantIndex, entry.getTenantId(), sessionId);
            for (String tag : entry.getTags()) {
                index(tagIndex, tag, sessionId);
            }
            if (compress) {
                compressions++;
            }
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    public boolean remove(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        lock.lock();
        try {
            return removeInternal(sessionId) != null;
        }
        finally {
            lock.unlock();
        }
    }

    public List<ConversationSession> getUserSessions(String userId) {
        return getUserSessions(userId, SessionQueryOptions.defaults());
    }

    public List<ConversationSession> getUserSessions(String userId, SessionQueryOptions options) {
        return query(userIndex, userId, options);
    }

    public List<ConversationSession> getTenantSessions(String tenantId) {
        return getTenantSessions(tenantId, SessionQueryOptions.defaults());
    }

    public List<ConversationSession> getTenantSessions(String tenantId, SessionQueryOptions options) {
        return query(tenantIndex, tenantId, options);
    }

    public List<ConversationSession> getTaggedSessions(String tag, SessionQueryOptions options) {
        return query(tagIndex, tag, options);
    }

    /**
     * Removes every expired entry. Safe to call concurrently and repeatedly.
     *
     * @return number of entries removed by this call
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            List<String> expired = entries.values().stream()
                    .filter(entry -> entry.isExpired(now))
                    .map(SessionCacheEntry::getSessionId)
                    .collect(Collectors.toList());
            for (String sessionId : expired) {
                removeInternal(sessionId);
            }
            evictions += expired.size();
            if (!expired.isEmpty()) {
                log.debug("Session cache cleanup removed={} remaining={}", expired.size(), entries.size());
            }
            return expired.size();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the TTL of a live entry. The new TTL is clamped and measured from the
     * entry's creation time.
     */
    public boolean updateTtl(String sessionId, Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new ConversationFlowException(
                    ConversationFlowErrorCode.INVALID_CACHE_CONFIGURATION,
                    "Invalid TTL: " + ttl);
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            SessionCacheEntry entry = entries.get(sessionId);
            if (entry == null || entry.isExpired(now)) {
                return false;
            }
            entry.updateTtl(clamp(ttl));
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    public void addTtlPolicy(TtlPolicy policy) {
        ttlPolicies.add(Objects.requireNonNull(policy, "policy"));
    }

    public boolean removeTtlPolicy(String name) {
        return ttlPolicies.removeIf(policy -> Objects.equals(policy.name(), name));
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        }
        finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            userIndex.clear();
            tenantIndex.clear();
            tagIndex.clear();
            memoryUsage = 0;
        }
        finally {
            lock.unlock();
        }
    }

    public SessionCacheMetrics metrics() {
        lock.lock();
        try {
            long lookups = hits + misses;
            int compressed = (int) entries.values().stream().filter(SessionCacheEntry::isCompressed).count();
            return SessionCacheMetrics.builder()
                    .hits(hits)
                    .misses(misses)
                    .evictions(evictions)
                    .compressions(compressions)
                    .decompressions(decompressions)
                    .hitRatio(lookups == 0 ? 0.0 : (double) hits / lookups)
                    .entryCount(entries.size())
                    .memoryUsageBytes(memoryUsage)
                    .userCount(userIndex.size())
                    .tenantCount(tenantIndex.size())
                    .compressedEntries(compressed)
                    .topUsers(top(userIndex))
                    .topTenants(top(tenantIndex))
                    .build();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Explicit override, else the first matching policy, else the priority multiplier;
     * always clamped to the configured bounds.
     */
    Duration calculateTtl(ConversationSession session, SessionPriority priority, Duration override) {
        if (override != null) {
            return clamp(override);
        }
        for (TtlPolicy policy : ttlPolicies) {
            if (!policy.appliesTo(session, priority)) {
                continue;
            }
            double millis = (policy.ttl() != null ? policy.ttl() : config.getDefaultTtl()).toMillis();
            for (TtlCondition condition : policy.conditions()) {
                if (conditionMatches(session, condition)) {
                    millis *= condition.ttlModifier();
                }
            }
            return clamp(Duration.ofMillis(Math.round(millis)));
        }
        long millis = Math.round(config.getDefaultTtl().toMillis() * priority.ttlMultiplier());
        return clamp(Duration.ofMillis(millis));
    }

    private Duration clamp(Duration ttl) {
        if (ttl.compareTo(config.getMinTtl()) < 0) {
            return config.getMinTtl();
        }
        if (ttl.compareTo(config.getMaxTtl()) > 0) {
            return config.getMaxTtl();
        }
        return ttl;
    }

    private boolean conditionMatches(ConversationSession session, TtlCondition condition) {
        if (condition.field() == null || condition.operator() == null) {
            return false;
        }
        Object actual = JsonPathUtil.readDotted(session, condition.field());
        ConditionOperator operator = condition.operator();
        return switch (operator) {
            case EQUALS -> actual != null && String.valueOf(actual).equals(String.valueOf(condition.value()));
            case NOT_EQUALS -> actual == null || !String.valueOf(actual).equals(String.valueOf(condition.value()));
            case GREATER_THAN -> compareNumbers(actual, condition.value()) > 0;
            case LESS_THAN -> {
                int cmp = compareNumbers(actual, condition.value());
                yield cmp != Integer.MIN_VALUE && cmp < 0;
            }
            case CONTAINS -> actual != null && String.valueOf(actual).contains(String.valueOf(condition.value()));
            case NOT_CONTAINS -> actual == null || !String.valueOf(actual).contains(String.valueOf(condition.value()));
            case EXISTS -> actual != null;
            case NOT_EXISTS -> actual == null;
        };
    }

    private int compareNumbers(Object actual, Object expected) {
        try {
            double a = Double.parseDouble(String.valueOf(actual));
            double e = Double.parseDouble(String.valueOf(expected));
            return Double.compare(a, e);
        }
        catch (NumberFormatException ex) {
            return Integer.MIN_VALUE;
        }
    }

    private void enforceScopeLimit(Map<String, Set<String>> scopeIndex, String scopeKey, int limit, String scope) {
        if (scopeKey == null || limit <= 0) {
            return;
        }
        Set<String> ids = scopeIndex.get(scopeKey);
        while (ids != null && ids.size() >= limit) {
            String oldest = ids.stream()
                    .map(entries::get)
                    .filter(Objects::nonNull)
                    .min(Comparator.comparingLong(SessionCacheEntry::getAccessSequence))
                    .map(SessionCacheEntry::getSessionId)
                    .orElse(null);
            if (oldest == null) {
                return;
            }
            removeInternal(oldest);
            evictions++;
            log.debug("Evicted session over {} limit scopeKey={} sessionId={}", scope, scopeKey, oldest);
            ids = scopeIndex.get(scopeKey);
        }
    }

    private void ensureCapacity(long incomingSize) {
        Instant now = clock.instant();
        while (!entries.isEmpty() && entries.size() >= config.getMaxSize()) {
            SessionCacheEntry victim = selectVictim(now);
            removeInternal(victim.getSessionId());
            evictions++;
            log.debug("Evicted session by strategy={} sessionId={}", config.getEvictionStrategy(), victim.getSessionId());
        }
        long maxMemory = config.maxMemoryBytes();
        if (memoryUsage + incomingSize <= maxMemory) {
            return;
        }
        long target = (long) (maxMemory * MEMORY_TARGET_RATIO);
        Comparator<SessionCacheEntry> lowestPriorityFirst = Comparator
                .comparingInt((SessionCacheEntry entry) -> entry.getPriority().rank())
                .thenComparingLong(SessionCacheEntry::getAccessSequence);
        List<SessionCacheEntry> candidates = new ArrayList<>(entries.values());
        candidates.sort(lowestPriorityFirst);
        int evicted = 0;
        for (SessionCacheEntry candidate : candidates) {
            if (memoryUsage + incomingSize <= target) {
                break;
            }
            removeInternal(candidate.getSessionId());
            evictions++;
            evicted++;
        }
        log.warn("Session cache memory pressure evicted={} memoryUsageBytes={} maxMemoryBytes={}",
                evicted, memoryUsage, maxMemory);
    }

    private SessionCacheEntry selectVictim(Instant now) {
        Comparator<SessionCacheEntry> order = switch (config.getEvictionStrategy()) {
            case LRU -> Comparator.comparingLong(SessionCacheEntry::getAccessSequence);
            case LFU -> Comparator.comparingLong(SessionCacheEntry::getAccessCount)
                    .thenComparingLong(SessionCacheEntry::getAccessSequence);
            case TTL -> Comparator.comparing((SessionCacheEntry entry) -> entry.remaining(now))
                    .thenComparingLong(SessionCacheEntry::getAccessSequence);
            case SIZE -> Comparator.comparingLong(SessionCacheEntry::storedSize).reversed()
                    .thenComparingLong(SessionCacheEntry::getAccessSequence);
        };
        return entries.values().stream().min(order).orElseThrow();
    }

    private List<ConversationSession> query(Map<String, Set<String>> scopeIndex, String key, SessionQueryOptions options) {
        SessionQueryOptions opts = options == null ? SessionQueryOptions.defaults() : options;
        Instant now = clock.instant();
        lock.lock();
        try {
            Set<String> ids = scopeIndex.get(key);
            if (ids == null || ids.isEmpty()) {
                return List.of();
            }
            List<SessionCacheEntry> matches = ids.stream()
                    .map(entries::get)
                    .filter(Objects::nonNull)
                    .filter(entry -> opts.includeExpired() || !entry.isExpired(now))
                    .filter(entry -> opts.userId() == null || opts.userId().equals(entry.getUserId()))
                    .filter(entry -> opts.tenantId() == null || opts.tenantId().equals(entry.getTenantId()))
                    .filter(entry -> opts.tags() == null || entry.getTags().containsAll(opts.tags()))
                    .sorted(sortOrder(opts.sortBy(), now))
                    .collect(Collectors.toList());
            if (opts.limit() != null && opts.limit() >= 0 && matches.size() > opts.limit()) {
                matches = matches.subList(0, opts.limit());
            }
            List<ConversationSession> sessions = new ArrayList<>(matches.size());
            for (SessionCacheEntry entry : matches) {
                if (entry.isCompressed()) {
                    decompressions++;
                }
                sessions.add(entry.materialize());
            }
            return sessions;
        }
        finally {
            lock.unlock();
        }
    }

    private Comparator<SessionCacheEntry> sortOrder(SessionQueryOptions.SortBy sortBy, Instant now) {
        if (sortBy == null) {
            sortBy = SessionQueryOptions.SortBy.LAST_ACCESSED;
        }
        return switch (sortBy) {
            case LAST_ACCESSED -> Comparator.comparingLong(SessionCacheEntry::getAccessSequence).reversed();
            case CREATED -> Comparator.comparing(SessionCacheEntry::getCreatedAt).reversed();
            case TTL_REMAINING -> Comparator.comparing((SessionCacheEntry entry) -> entry.remaining(now));
            case SIZE -> Comparator.comparingLong(SessionCacheEntry::storedSize).reversed();
        };
    }

    private SessionCacheEntry removeInternal(String sessionId) {
        SessionCacheEntry removed = entries.remove(sessionId);
        if (removed == null) {
            return null;
        }
        memoryUsage -= removed.storedSize();
        unindex(userIndex, removed.getUserId(), sessionId);
        unindex(tenantIndex, removed.getTenantId(), sessionId);
        for (String tag : removed.getTags()) {
            unindex(tagIndex, tag, sessionId);
        }
        return removed;
    }

    private void index(Map<String, Set<String>> scopeIndex, String key, String sessionId) {
        if (key == null) {
            return;
        }
        scopeIndex.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).add(sessionId);
    }

    private void unindex(Map<String, Set<String>> scopeIndex, String key, String sessionId) {
        if (key == null) {
            return;
        }
        Set<String> ids = scopeIndex.get(key);
        if (ids == null) {
            return;
        }
        ids.remove(sessionId);
        if (ids.isEmpty()) {
            scopeIndex.remove(key);
        }
    }

    private Map<String, Integer> top(Map<String, Set<String>> scopeIndex) {
        Map<String, Integer> result = new LinkedHashMap<>();
        scopeIndex.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, Set<String>> e) -> e.getValue().size()).reversed())
                .limit(Math.max(1, config.getTopTrackedKeys()))
                .forEach(e -> result.put(e.getKey(), e.getValue().size()));
        return result;
    }

    private void scheduledCleanup() {
        try {
            cleanupExpired();
        }
        catch (RuntimeException ex) {
            log.error("Session cache cleanup failed", ex);
        }
    }

    /** Snapshot of the indexed session ids; exposed for consistency checks. */
    Map<String, Collection<String>> indexSnapshot() {
        lock.lock();
        try {
            Map<String, Collection<String>> snapshot = new LinkedHashMap<>();
            snapshot.put("entries", List.copyOf(entries.keySet()));
            snapshot.put("users", userIndex.values().stream().flatMap(Set::stream).collect(Collectors.toList()));
            snapshot.put("tenants", tenantIndex.values().stream().flatMap(Set::stream).collect(Collectors.toList()));
            return snapshot;
        }
        finally {
            lock.unlock();
        }
    }

    private static void validateConfig(ConvFlowSessionCacheConfig config) {
        if (config.getMaxSize() < 1) {
            throw new ConversationFlowException(ConversationFlowErrorCode.INVALID_CACHE_CONFIGURATION,
                    "maxSize must be positive");
        }
        if (config.getMaxMemoryMb() < 1) {
            throw new ConversationFlowException(ConversationFlowErrorCode.INVALID_CACHE_CONFIGURATION,
                    "maxMemoryMb must be positive");
        }
        if (config.getMinTtl() == null || config.getMaxTtl() == null || config.getDefaultTtl() == null
                || config.getMinTtl().isNegative() || config.getMinTtl().compareTo(config.getMaxTtl()) > 0) {
            throw new ConversationFlowException(ConversationFlowErrorCode.INVALID_CACHE_CONFIGURATION,
                    "TTL bounds are invalid: min=" + config.getMinTtl() + " max=" + config.getMaxTtl());
        }
        if (config.getEvictionStrategy() == null) {
            throw new ConversationFlowException(ConversationFlowErrorCode.INVALID_CACHE_CONFIGURATION,
                    "evictionStrategy is required");
        }
    }

    private static boolean sameOwner(String held, String requested) {
        return held == null || requested == null || held.equals(requested);
    }
}
