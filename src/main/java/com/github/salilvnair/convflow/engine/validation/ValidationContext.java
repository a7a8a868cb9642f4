package com.github.salilvnair.convflow.engine.validation;

import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.NavigationType;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class ValidationContext {

    private final ConversationSession session;
    private final String fromNodeId;
    private final String targetNodeId;
    /** Resolved target, {@code null} when the caller has not resolved it. */
    private final FlowNode targetNode;
    @Builder.Default
    private final NavigationType navigationType = NavigationType.FORWARD;
    private final String requestId;
    private final Instant evaluatedAt;

    public String tenantId() {
        return session == null ? null : session.getTenantId();
    }

    public String templateId() {
        return session == null ? null : session.getTemplateId();
    }
}
