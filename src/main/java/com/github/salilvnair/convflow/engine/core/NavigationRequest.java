package com.github.salilvnair.convflow.engine.core;

import com.github.salilvnair.convflow.engine.queue.QueuePriority;
import com.github.salilvnair.convflow.engine.session.NavigationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound request from the transport layer. {@code toNodeId} may be {@code continue} (or
 * {@code null}) to let the session's waiting node decide the target from {@code userText}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigationRequest {

    private String sessionId;
    private String userId;
    private String tenantId;
    private String templateId;
    private String fromNodeId;
    private String toNodeId;
    private String userText;
    @Builder.Default
    private NavigationType navigationType = NavigationType.FORWARD;
    private QueuePriority priority;
}
