package com.github.salilvnair.convflow.cache;

import com.github.salilvnair.convflow.config.ConvFlowSessionCacheConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.node.ConditionOperator;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.SessionPriority;
import com.github.salilvnair.convflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.salilvnair.convflow.support.TestConstants.TENANT_ACME;
import static com.github.salilvnair.convflow.support.TestConstants.TENANT_OTHER;
import static com.github.salilvnair.convflow.support.TestConstants.USER_ANA;
import static com.github.salilvnair.convflow.support.TestConstants.USER_JUAN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionCacheTest {

    private MutableClock clock;
    private ConvFlowSessionCacheConfig config;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-15T10:00:00Z");
        config = new ConvFlowSessionCacheConfig();
    }

    @Test
    void getReturnsIndependentCopyWithExpiry() {
        SessionCache cache = new SessionCache(config, clock);
        ConversationSession session = session("s1", USER_JUAN, TENANT_ACME);
        cache.set("s1", session);

        ConversationSession cached = cache.get("s1").orElseThrow();
        cached.getCollectedData().put("name", "changed");

        assertEquals(clock.instant().plus(Duration.ofHours(1)), cached.getExpiresAt());
        assertFalse(cache.get("s1").orElseThrow().getCollectedData().containsKey("name"));
        assertEquals(1, cache.metrics().entryCount());
    }

    @Test
    void entryExpiresOnlyAfterTtlHasElapsed() {
        SessionCache cache = new SessionCache(config, clock);
        cache.set("s1", session("s1", USER_JUAN, TENANT_ACME), SetOptions.builder().ttl(Duration.ofMinutes(5)).build());

        clock.advance(Duration.ofMinutes(5));
        assertTrue(cache.get("s1").isPresent());

        clock.advance(Duration.ofMillis(1));
        assertTrue(cache.get("s1").isEmpty());
        assertEquals(0, cache.size());
        assertEquals(1, cache.metrics().evictions());
    }

    @Test
    void ttlScalesWithPriorityAndIsClamped() {
        SessionCache cache = new SessionCache(config, clock);
        ConversationSession session = session("s1", USER_JUAN, TENANT_ACME);

        assertEquals(Duration.ofMinutes(30), cache.calculateTtl(session, SessionPriority.LOW, null));
        assertEquals(Duration.ofHours(1), cache.calculateTtl(session, SessionPriority.NORMAL, null));
        assertEquals(Duration.ofMinutes(90), cache.calculateTtl(session, SessionPriority.HIGH, null));
        assertEquals(Duration.ofHours(2), cache.calculateTtl(session, SessionPriority.CRITICAL, null));
        assertEquals(Duration.ofMinutes(1), cache.calculateTtl(session, SessionPriority.NORMAL, Duration.ofSeconds(5)));
        assertEquals(Duration.ofHours(24), cache.calculateTtl(session, SessionPriority.NORMAL, Duration.ofDays(3)));
    }

    @Test
    void firstMatchingPolicyWinsAndConditionsModifyTtl() {
        SessionCache cache = new SessionCache(config, clock);
        cache.addTtlPolicy(TtlPolicy.builder()
                .name("acme-scored")
                .tenantId(TENANT_ACME)
                .ttl(Duration.ofHours(2))
                .conditions(List.of(new TtlCondition("collectedData.score", ConditionOperator.GREATER_THAN, 80, 1.5)))
                .build());
        cache.addTtlPolicy(TtlPolicy.builder().name("acme-flat").tenantId(TENANT_ACME).ttl(Duration.ofMinutes(10)).build());
        ConversationSession hot = session("s1", USER_JUAN, TENANT_ACME);
        hot.getCollectedData().put("score", 95);
        ConversationSession cold = session("s2", USER_JUAN, TENANT_ACME);
        cold.getCollectedData().put("score", 10);
        ConversationSession foreign = session("s3", USER_JUAN, TENANT_OTHER);

        assertEquals(Duration.ofHours(3), cache.calculateTtl(hot, SessionPriority.NORMAL, null));
        assertEquals(Duration.ofHours(2), cache.calculateTtl(cold, SessionPriority.NORMAL, null));
        assertEquals(Duration.ofHours(1), cache.calculateTtl(foreign, SessionPriority.NORMAL, null));

        assertTrue(cache.removeTtlPolicy("acme-scored"));
        assertEquals(Duration.ofMinutes(10), cache.calculateTtl(hot, SessionPriority.NORMAL, null));
    }

    @Test
    void lruEvictsLeastRecentlyAccessedWhenFull() {
        config.setMaxSize(2);
        SessionCache cache = new SessionCache(config, clock);
        cache.set("a", session("a", USER_JUAN, TENANT_ACME));
        cache.set("b", session("b", USER_ANA, TENANT_ACME));
        cache.get("a");

        cache.set("c", session("c", "user-c", TENANT_ACME));

        assertTrue(cache.contains("a"));
        assertFalse(cache.contains("b"));
        assertTrue(cache.contains("c"));
    }

    @Test
    void lfuEvictsLeastFrequentlyAccessedWhenFull() {
        config.setMaxSize(2);
        config.setEvictionStrategy(ConvFlowSessionCacheConfig.EvictionStrategy.LFU);
        SessionCache cache = new SessionCache(config, clock);
        cache.set("a", session("a", USER_JUAN, TENANT_ACME));
        cache.set("b", session("b", USER_ANA, TENANT_ACME));
        cache.get("a");
        cache.get("a");
        cache.get("b");

        cache.set("c", session("c", "user-c", TENANT_ACME));

        assertTrue(cache.contains("a"));
        assertFalse(cache.contains("b"));
    }

    @Test
    void ttlStrategyEvictsNearestExpiry() {
        config.setMaxSize(2);
        config.setEvictionStrategy(ConvFlowSessionCacheConfig.EvictionStrategy.TTL);
        SessionCache cache = new SessionCache(config, clock);
        cache.set("short", session("short", USER_JUAN, TENANT_ACME), SetOptions.builder().ttl(Duration.ofMinutes(2)).build());
        cache.set("long", session("long", USER_ANA, TENANT_ACME), SetOptions.builder().ttl(Duration.ofHours(2)).build());

        cache.set("c", session("c", "user-c", TENANT_ACME));

        assertFalse(cache.contains("short"));
        assertTrue(cache.contains("long"));
    }

    @Test
    void replacingExistingKeyNeverEvictsOthers() {
        config.setMaxSize(2);
        SessionCache cache = new SessionCache(config, clock);
        cache.set("a", session("a", USER_JUAN, TENANT_ACME));
        cache.set("b", session("b", USER_ANA, TENANT_ACME));

        ConversationSession updated = session("a", USER_JUAN, TENANT_ACME);
        updated.setCurrentNodeId("ask_name");
        cache.set("a", updated);

        assertEquals(2, cache.size());
        assertEquals("ask_name", cache.get("a").orElseThrow().getCurrentNodeId());
        assertEquals(0, cache.metrics().evictions());
    }

    @Test
    void userSessionLimitEvictsThatUsersOldestSession() {
        config.setUserSessionLimit(2);
        SessionCache cache = new SessionCache(config, clock);
        cache.set("j1", session("j1", USER_JUAN, TENANT_ACME));
        cache.set("j2", session("j2", USER_JUAN, TENANT_ACME));
        cache.set("a1", session("a1", USER_ANA, TENANT_ACME));

        cache.set("j3", session("j3", USER_JUAN, TENANT_ACME));

        assertFalse(cache.contains("j1"));
        assertEquals(2, cache.getUserSessions(USER_JUAN).size());
        assertTrue(cache.contains("a1"));
    }

    @Test
    void indicesStayConsistentAcrossRemoveAndQuery() {
        SessionCache cache = new SessionCache(config, clock);
        cache.set("j1", session("j1", USER_JUAN, TENANT_ACME), SetOptions.builder().tags(Set.of("vip")).build());
        cache.set("a1", session("a1", USER_ANA, TENANT_ACME));
        cache.set("o1", session("o1", USER_ANA, TENANT_OTHER), SetOptions.builder().tags(Set.of("vip")).build());

        assertEquals(2, cache.getTenantSessions(TENANT_ACME).size());
        assertEquals(2, cache.getTaggedSessions("vip", SessionQueryOptions.defaults()).size());
        assertEquals(1, cache.getTaggedSessions("vip", SessionQueryOptions.builder().tenantId(TENANT_OTHER).build()).size());

        assertTrue(cache.remove("j1"));
        assertFalse(cache.remove("j1"));

        assertEquals(1, cache.getTenantSessions(TENANT_ACME).size());
        assertTrue(cache.getUserSessions(USER_JUAN).isEmpty());
        assertEquals(1, cache.getTaggedSessions("vip", SessionQueryOptions.defaults()).size());
        assertEquals(1, cache.metrics().userCount());
    }

    @Test
    void userQueryHonoursSortAndLimit() {
        SessionCache cache = new SessionCache(config, clock);
        cache.set("old", session("old", USER_JUAN, TENANT_ACME));
        clock.advance(Duration.ofSeconds(1));
        cache.set("new", session("new", USER_JUAN, TENANT_ACME));

        List<ConversationSession> newest = cache.getUserSessions(USER_JUAN, SessionQueryOptions.builder()
                .sortBy(SessionQueryOptions.SortBy.CREATED)
                .limit(1)
                .build());

        assertEquals(1, newest.size());
        assertEquals("new", newest.get(0).getSessionId());
    }

    @Test
    void cleanupRemovesOnlyExpiredEntries() {
        SessionCache cache = new SessionCache(config, clock);
        cache.set("short", session("short", USER_JUAN, TENANT_ACME), SetOptions.builder().ttl(Duration.ofMinutes(2)).build());
        cache.set("long", session("long", USER_ANA, TENANT_ACME));
        clock.advance(Duration.ofMinutes(3));

        assertEquals(1, cache.cleanupExpired());
        assertEquals(0, cache.cleanupExpired());
        assertTrue(cache.contains("long"));
        assertTrue(cache.getUserSessions(USER_JUAN).isEmpty());
    }

    @Test
    void updateTtlExtendsLiveEntry() {
        SessionCache cache = new SessionCache(config, clock);
        cache.set("s1", session("s1", USER_JUAN, TENANT_ACME), SetOptions.builder().ttl(Duration.ofMinutes(2)).build());

        assertTrue(cache.updateTtl("s1", Duration.ofMinutes(30)));
        clock.advance(Duration.ofMinutes(10));

        assertTrue(cache.get("s1").isPresent());
        assertFalse(cache.updateTtl("missing", Duration.ofMinutes(30)));
    }

    @Test
    void largeSessionsAreCompressedTransparently() {
        config.setCompressionThreshold(64);
        SessionCache cache = new SessionCache(config, clock);
        ConversationSession session = session("s1", USER_JUAN, TENANT_ACME);
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < 50; i++) {
            data.put("field" + i, "value " + i);
        }
        session.setCollectedData(data);

        cache.set("s1", session);

        assertEquals(1, cache.metrics().compressedEntries());
        assertEquals("value 42", cache.get("s1").orElseThrow().getCollectedData().get("field42"));
        assertEquals(1, cache.metrics().decompressions());
    }

    @Test
    void oversizedReplacementKeepsPreviousEntry() {
        config.setMaxMemoryMb(1);
        config.setCompressionEnabled(false);
        SessionCache cache = new SessionCache(config, clock);
        ConversationSession session = session("s1", USER_JUAN, TENANT_ACME);
        session.getCollectedData().put("name", "Juan");
        cache.set("s1", session);

        ConversationSession huge = session.copy();
        huge.getCollectedData().put("blob", "x".repeat(1_200_000));

        assertFalse(cache.set("s1", huge));
        assertEquals("Juan", cache.get("s1").orElseThrow().getCollectedData().get("name"));
        assertEquals(List.of("s1"), cache.getUserSessions(USER_JUAN).stream().map(ConversationSession::getSessionId).toList());
    }

    @Test
    void ownershipCheckIgnoresExpiredEntriesAndDoesNotCountAccess() {
        SessionCache cache = new SessionCache(config, clock);
        cache.set("s1", session("s1", USER_JUAN, TENANT_ACME), SetOptions.builder().ttl(Duration.ofMinutes(5)).build());

        assertFalse(cache.isHeldByOtherOwner("s1", USER_JUAN, TENANT_ACME));
        assertTrue(cache.isHeldByOtherOwner("s1", USER_ANA, TENANT_ACME));
        assertTrue(cache.isHeldByOtherOwner("s1", USER_JUAN, TENANT_OTHER));
        assertFalse(cache.isHeldByOtherOwner("missing", USER_ANA, TENANT_OTHER));
        assertEquals(0, cache.metrics().hits() + cache.metrics().misses());

        clock.advance(Duration.ofMinutes(6));
        assertFalse(cache.isHeldByOtherOwner("s1", USER_ANA, TENANT_OTHER));
    }

    @Test
    void hitRatioTracksLookups() {
        SessionCache cache = new SessionCache(config, clock);
        cache.set("s1", session("s1", USER_JUAN, TENANT_ACME));

        cache.get("s1");
        cache.get("missing");

        SessionCacheMetrics metrics = cache.metrics();
        assertEquals(1, metrics.hits());
        assertEquals(1, metrics.misses());
        assertEquals(0.5, metrics.hitRatio());
    }

    @Test
    void negativeTtlIsRejected() {
        SessionCache cache = new SessionCache(config, clock);

        ConversationFlowException error = assertThrows(ConversationFlowException.class, () -> cache.set("s1",
                session("s1", USER_JUAN, TENANT_ACME), SetOptions.builder().ttl(Duration.ofSeconds(-1)).build()));

        assertEquals(ConversationFlowErrorCode.INVALID_CACHE_CONFIGURATION, error.getCode());
    }

    @Test
    void invalidConfigurationFailsFast() {
        config.setMinTtl(Duration.ofHours(48));

        assertThrows(ConversationFlowException.class, () -> new SessionCache(config, clock));
    }

    private ConversationSession session(String sessionId, String userId, String tenantId) {
        return ConversationSession.builder()
                .sessionId(sessionId)
                .userId(userId)
                .tenantId(tenantId)
                .createdAt(clock.instant())
                .lastActivityAt(clock.instant())
                .build();
    }
}
