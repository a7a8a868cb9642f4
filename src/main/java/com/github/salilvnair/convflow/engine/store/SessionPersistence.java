package com.github.salilvnair.convflow.engine.store;

import com.github.salilvnair.convflow.engine.session.ConversationSession;

import java.util.Optional;

/**
 * Durable session storage. Implementations report failure through the return value;
 * callers treat persistence as best effort.
 */
public interface SessionPersistence {

    boolean saveSession(String tenantId, String userId, String sessionId, ConversationSession session);

    Optional<ConversationSession> loadSession(String tenantId, String userId, String sessionId);

    default boolean deactivateSession(String tenantId, String userId, String sessionId) {
        return false;
    }
}
