package com.github.salilvnair.convflow.cache;

import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.SessionPriority;
import lombok.Builder;

import java.time.Duration;
import java.util.List;

/**
 * TTL rule selected by user, tenant and priority. A {@code null} selector matches anything.
 */
@Builder
public record TtlPolicy(
        String name,
        String userId,
        String tenantId,
        SessionPriority priority,
        Duration ttl,
        List<TtlCondition> conditions
) {

    public TtlPolicy {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean appliesTo(ConversationSession session, SessionPriority effectivePriority) {
        if (userId != null && !userId.equals(session.getUserId())) {
            return false;
        }
        if (tenantId != null && !tenantId.equals(session.getTenantId())) {
            return false;
        }
        return priority == null || priority == effectivePriority;
    }
}
