package com.github.salilvnair.convflow.engine.session;

import com.github.salilvnair.convflow.engine.node.ButtonOption;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy of the mutable parts of a session taken before a transition; used for rollback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextSnapshot {

    private String currentNodeId;
    private String previousNodeId;
    @Builder.Default
    private Map<String, Object> collectedData = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> globalVars = new LinkedHashMap<>();
    private boolean waitingForInput;
    private String waitingNodeId;
    @Builder.Default
    private List<ButtonOption> activeOptions = new ArrayList<>();
    private NavigationState state;

    public static ContextSnapshot of(ConversationSession session) {
        return ContextSnapshot.builder()
                .currentNodeId(session.getCurrentNodeId())
                .previousNodeId(session.getPreviousNodeId())
                .collectedData(JsonUtil.deepCopyMap(session.getCollectedData()))
                .globalVars(JsonUtil.deepCopyMap(session.getGlobalVars()))
                .waitingForInput(session.isWaitingForInput())
                .waitingNodeId(session.getWaitingNodeId())
                .activeOptions(new ArrayList<>(session.getActiveOptions()))
                .state(session.getState())
                .build();
    }

    public void restoreInto(ConversationSession session) {
        session.setCurrentNodeId(currentNodeId);
        session.setPreviousNodeId(previousNodeId);
        session.setCollectedData(JsonUtil.deepCopyMap(collectedData));
        session.setGlobalVars(JsonUtil.deepCopyMap(globalVars));
        session.setWaitingForInput(waitingForInput);
        session.setWaitingNodeId(waitingNodeId);
        session.setActiveOptions(activeOptions == null ? new ArrayList<>() : new ArrayList<>(activeOptions));
        session.setState(state == null ? NavigationState.IDLE : state);
    }
}
