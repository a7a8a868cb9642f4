package com.github.salilvnair.convflow.engine.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.salilvnair.convflow.engine.node.ButtonOption;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-user, per-tenant conversation state. Instances handed out by the session cache
 * are copies; mutate freely and save back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSession {

    private String sessionId;
    private String userId;
    private String tenantId;
    private String templateId;

    private String currentNodeId;
    private String previousNodeId;

    @Builder.Default
    private Map<String, Object> collectedData = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> globalVars = new LinkedHashMap<>();
    @Builder.Default
    private List<NavigationStep> history = new ArrayList<>();

    private boolean waitingForInput;
    private String waitingNodeId;
    @Builder.Default
    private List<ButtonOption> activeOptions = new ArrayList<>();

    @Builder.Default
    private NavigationState state = NavigationState.IDLE;
    @Builder.Default
    private SessionPriority priority = SessionPriority.NORMAL;
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    private boolean active = true;
    private boolean fallback;

    private String lastUserMessage;
    private String lastBotResponse;

    private Instant createdAt;
    private Instant lastActivityAt;
    private Instant expiresAt;

    /** Deep copy; nested maps and history entries are not shared. */
    public ConversationSession copy() {
        return JsonUtil.deepCopy(this, ConversationSession.class);
    }

    public void appendStep(NavigationStep step, int maxHistory) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(step);
        int overflow = history.size() - Math.max(1, maxHistory);
        if (overflow > 0) {
            history.subList(0, overflow).clear();
        }
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public void clearWaiting() {
        waitingForInput = false;
        waitingNodeId = null;
        activeOptions = new ArrayList<>();
    }
}
