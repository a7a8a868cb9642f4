package com.github.salilvnair.convflow.service;

import com.github.salilvnair.convflow.cache.SessionCache;
import com.github.salilvnair.convflow.cache.SetOptions;
import com.github.salilvnair.convflow.config.ConvFlowSessionConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.NavigationState;
import com.github.salilvnair.convflow.engine.session.SessionPriority;
import com.github.salilvnair.convflow.engine.session.SessionStateRepairer;
import com.github.salilvnair.convflow.engine.store.SessionPersistence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Session lifecycle on top of the session cache and the persistence collaborator:
 * cache first, then persistence, then a fresh session. Any failure along the way
 * degrades to a short-lived fallback session instead of surfacing to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationSessionService {

    public static final String FALLBACK_FLAG = "isFallback";

    private final SessionCache sessionCache;
    private final SessionPersistence sessionPersistence;
    private final SessionStateRepairer stateRepairer;
    private final ConvFlowSessionConfig sessionConfig;
    private final Clock clock;

    public ConversationSession getOrCreateSession(String userId, String tenantId, String sessionId, String templateId) {
        String effectiveId = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        try {
            Optional<ConversationSession> loaded = loadSession(userId, tenantId, effectiveId);
            if (loaded.isPresent()) {
                return loaded.get();
            }
            return createSession(userId, tenantId, effectiveId, templateId, Map.of());
        }
        catch (RuntimeException e) {
            log.error("Session lookup failed, serving fallback session sessionId={} userId={} tenantId={}: {}",
                    effectiveId, userId, tenantId, e.getMessage(), e);
            return fallbackSession(userId, tenantId, effectiveId, templateId);
        }
    }

    /**
     * Cache, then persistence. Whatever is found is repaired before it is returned; a
     * persistence hit is written back into the cache unless another owner holds the key.
     *
     * @throws ConversationFlowException with {@code TENANT_MISMATCH} when the cached session
     *                                   belongs to someone else and the caller has no
     *                                   persisted session of its own under this id
     */
    public Optional<ConversationSession> loadSession(String userId, String tenantId, String sessionId) {
        Optional<ConversationSession> cached = sessionCache.get(sessionId);
        if (cached.isPresent()) {
            ConversationSession session = cached.get();
            if (!matchesOwner(session, userId, tenantId)) {
                Optional<ConversationSession> own = loadPersisted(userId, tenantId, sessionId);
                if (own.isPresent()) {
                    log.warn("Session key held by another owner, serving persisted copy sessionId={} userId={} tenantId={}",
                            sessionId, userId, tenantId);
                    return own;
                }
                throw new ConversationFlowException(
                        ConversationFlowErrorCode.TENANT_MISMATCH,
                        "Session " + sessionId + " belongs to a different user or tenant");
            }
            if (stateRepairer.repair(session)) {
                sessionCache.set(sessionId, session, optionsFor(session));
            }
            return Optional.of(session);
        }
        Optional<ConversationSession> persisted = loadPersisted(userId, tenantId, sessionId);
        persisted.ifPresent(session -> {
            sessionCache.set(sessionId, session, optionsFor(session));
            log.debug("Session restored from persistence sessionId={} currentNodeId={}", sessionId, session.getCurrentNodeId());
        });
        return persisted;
    }

    public ConversationSession createSession(String userId,
                                             String tenantId,
                                             String sessionId,
                                             String templateId,
                                             Map<String, Object> initialData) {
        Instant now = clock.instant();
        ConversationSession session = ConversationSession.builder()
                .sessionId(sessionId == null ? UUID.randomUUID().toString() : sessionId)
                .userId(userId)
                .tenantId(tenantId)
                .templateId(templateId == null ? sessionConfig.getDefaultTemplateId() : templateId)
                .collectedData(new LinkedHashMap<>(initialData == null ? Map.of() : initialData))
                .state(NavigationState.IDLE)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        saveSession(session);
        log.info("Created session sessionId={} userId={} tenantId={} templateId={}",
                session.getSessionId(), userId, tenantId, session.getTemplateId());
        return session;
    }

    /**
     * Writes the session to the cache and, best effort, to persistence.
     *
     * @return {@code true} when the durable write succeeded
     */
    public boolean saveSession(ConversationSession session) {
        session.setLastActivityAt(clock.instant());
        if (sessionCache.isHeldByOtherOwner(session.getSessionId(), session.getUserId(), session.getTenantId())) {
            log.warn("Session key held by another owner, cache write skipped sessionId={} userId={} tenantId={} fallback={}",
                    session.getSessionId(), session.getUserId(), session.getTenantId(), session.isFallback());
        }
        else {
            sessionCache.set(session.getSessionId(), session, optionsFor(session));
        }
        if (!sessionConfig.isPersistenceEnabled() || session.isFallback()) {
            return false;
        }
        try {
            boolean saved = sessionPersistence.saveSession(
                    session.getTenantId(), session.getUserId(), session.getSessionId(), session);
            if (!saved) {
                log.warn("Session persistence rejected write sessionId={}, cache copy retained", session.getSessionId());
            }
            return saved;
        }
        catch (RuntimeException e) {
            log.error("Session persistence failed sessionId={}, cache copy retained: {}",
                    session.getSessionId(), e.getMessage(), e);
            return false;
        }
    }

    public boolean updateSessionActivity(String sessionId) {
        Optional<ConversationSession> cached = sessionCache.get(sessionId);
        if (cached.isEmpty()) {
            return false;
        }
        ConversationSession session = cached.get();
        session.setLastActivityAt(clock.instant());
        sessionCache.set(sessionId, session, optionsFor(session));
        return true;
    }

    /**
     * Explicit termination; the only way a session leaves the active set other than
     * TTL or pressure eviction.
     */
    public boolean endSession(String sessionId) {
        Optional<ConversationSession> cached = sessionCache.get(sessionId);
        cached.ifPresent(session -> {
            session.setActive(false);
            session.setState(NavigationState.TERMINAL);
            session.clearWaiting();
            if (sessionConfig.isPersistenceEnabled() && !session.isFallback()) {
                try {
                    sessionPersistence.saveSession(session.getTenantId(), session.getUserId(), sessionId, session);
                    sessionPersistence.deactivateSession(session.getTenantId(), session.getUserId(), sessionId);
                }
                catch (RuntimeException e) {
                    log.error("Failed to persist session end sessionId={}: {}", sessionId, e.getMessage(), e);
                }
            }
        });
        boolean removed = sessionCache.remove(sessionId);
        log.info("Ended session sessionId={} removedFromCache={}", sessionId, removed);
        return cached.isPresent() || removed;
    }

    private Optional<ConversationSession> loadPersisted(String userId, String tenantId, String sessionId) {
        if (!sessionConfig.isPersistenceEnabled()) {
            return Optional.empty();
        }
        Optional<ConversationSession> persisted = sessionPersistence.loadSession(tenantId, userId, sessionId)
                .filter(session -> matchesOwner(session, userId, tenantId));
        persisted.ifPresent(stateRepairer::repair);
        return persisted;
    }

    private ConversationSession fallbackSession(String userId, String tenantId, String sessionId, String templateId) {
        Instant now = clock.instant();
        Map<String, Object> globals = new LinkedHashMap<>();
        globals.put(FALLBACK_FLAG, true);
        ConversationSession session = ConversationSession.builder()
                .sessionId(sessionId)
                .userId(userId)
                .tenantId(tenantId)
                .templateId(templateId == null ? sessionConfig.getDefaultTemplateId() : templateId)
                .globalVars(globals)
                .priority(SessionPriority.LOW)
                .fallback(true)
                .state(NavigationState.IDLE)
                .createdAt(now)
                .lastActivityAt(now)
                .expiresAt(now.plus(sessionConfig.getFallbackTtl()))
                .build();
        return session;
    }

    private SetOptions optionsFor(ConversationSession session) {
        if (session.isFallback()) {
            return SetOptions.builder()
                    .ttl(sessionConfig.getFallbackTtl())
                    .priority(SessionPriority.LOW)
                    .source("fallback")
                    .build();
        }
        return SetOptions.builder().priority(session.getPriority()).source("session").build();
    }

    private boolean matchesOwner(ConversationSession session, String userId, String tenantId) {
        boolean userMatches = userId == null || session.getUserId() == null || userId.equals(session.getUserId());
        boolean tenantMatches = tenantId == null || session.getTenantId() == null || tenantId.equals(session.getTenantId());
        return userMatches && tenantMatches;
    }
}
