package com.github.salilvnair.convflow.engine.queue;

import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.navigation.NavigationResult;
import com.github.salilvnair.convflow.engine.session.NavigationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One unit of work for the {@link NodeProcessingQueue}. Instances returned by the queue are
 * snapshots; the live record is owned by the queue.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueuedNavigationRequest {

    private String requestId;
    private String sessionId;
    private String userId;
    private String tenantId;
    private String templateId;
    private String fromNodeId;
    /** Target node id or {@code continue}. */
    private String targetNodeId;
    private String userText;
    @Builder.Default
    private NavigationType navigationType = NavigationType.FORWARD;

    @Builder.Default
    private QueuePriority priority = QueuePriority.NORMAL;
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    private int maxRetries;
    private int attempts;
    private boolean rollbackOnFailure;
    private String batchId;
    private long sequence;

    private Instant createdAt;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;

    @Builder.Default
    private QueueRequestStatus status = QueueRequestStatus.PENDING;
    private NavigationResult result;
    private ConversationFlowErrorCode errorCode;
    private String lastError;

    public QueuedNavigationRequest snapshot() {
        return toBuilder().dependencies(new ArrayList<>(dependencies)).build();
    }

    public Duration waitTime(Instant now) {
        Instant end = startedAt != null ? startedAt : now;
        return createdAt == null ? Duration.ZERO : Duration.between(createdAt, end);
    }

    public Duration processingTime() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
