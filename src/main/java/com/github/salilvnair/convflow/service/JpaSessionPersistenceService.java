package com.github.salilvnair.convflow.service;

import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.store.SessionPersistence;
import com.github.salilvnair.convflow.entity.CfSessionSnapshot;
import com.github.salilvnair.convflow.repo.SessionSnapshotRepository;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores full session snapshots as JSON rows. Failures are logged and reported through the
 * return value so callers can keep serving from the cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaSessionPersistenceService implements SessionPersistence {

    private final SessionSnapshotRepository snapshotRepository;

    @Override
    public boolean saveSession(String tenantId, String userId, String sessionId, ConversationSession session) {
        try {
            Optional<CfSessionSnapshot> existing = snapshotRepository.findById(sessionId);
            if (existing.isPresent() && !ownedBy(existing.get(), tenantId, userId)) {
                log.warn("Refusing to overwrite session row of another owner sessionId={} tenantId={} userId={}",
                        sessionId, tenantId, userId);
                return false;
            }
            CfSessionSnapshot snapshot = existing
                    .orElseGet(() -> CfSessionSnapshot.builder()
                            .sessionId(sessionId)
                            .createdAt(toOffset(session.getCreatedAt()))
                            .build());
            snapshot.setTenantId(tenantId);
            snapshot.setUserId(userId);
            snapshot.setTemplateId(session.getTemplateId());
            snapshot.setCurrentNodeId(session.getCurrentNodeId());
            snapshot.setActive(session.isActive());
            snapshot.setSnapshotJson(JsonUtil.toJson(session));
            snapshot.setUpdatedAt(OffsetDateTime.now(ZoneOffset.UTC));
            snapshot.setExpiresAt(toOffset(session.getExpiresAt()));
            snapshotRepository.save(snapshot);
            return true;
        }
        catch (Exception e) {
            log.error("Failed to persist session sessionId={} tenantId={} userId={}: {}",
                    sessionId, tenantId, userId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public Optional<ConversationSession> loadSession(String tenantId, String userId, String sessionId) {
        try {
            return snapshotRepository.findBySessionIdAndTenantIdAndUserIdAndActiveTrue(sessionId, tenantId, userId)
                    .map(CfSessionSnapshot::getSnapshotJson)
                    .filter(json -> json != null && !json.isBlank())
                    .map(json -> JsonUtil.fromJson(json, ConversationSession.class));
        }
        catch (Exception e) {
            log.error("Failed to load session sessionId={} tenantId={} userId={}: {}",
                    sessionId, tenantId, userId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public boolean deactivateSession(String tenantId, String userId, String sessionId) {
        try {
            return snapshotRepository.findById(sessionId)
                    .filter(snapshot -> ownedBy(snapshot, tenantId, userId))
                    .map(snapshot -> {
                        snapshot.setActive(false);
                        snapshot.setUpdatedAt(OffsetDateTime.now(ZoneOffset.UTC));
                        snapshotRepository.save(snapshot);
                        return true;
                    })
                    .orElse(false);
        }
        catch (Exception e) {
            log.error("Failed to deactivate session sessionId={}: {}", sessionId, e.getMessage(), e);
            return false;
        }
    }

    private OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static boolean ownedBy(CfSessionSnapshot snapshot, String tenantId, String userId) {
        return Objects.equals(snapshot.getTenantId(), tenantId) && Objects.equals(snapshot.getUserId(), userId);
    }
}
