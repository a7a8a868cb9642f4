package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.node.InputValidationRule;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.NavigationState;
import com.github.salilvnair.convflow.engine.session.NavigationStep;
import com.github.salilvnair.convflow.engine.validation.ValidationReport;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class NavigationResult {

    private final boolean success;
    private final FlowNode nextNode;
    private final String nextNodeId;
    private final String botResponse;
    private final boolean requiresUserInput;
    @Builder.Default
    private final ContextUpdates contextUpdates = ContextUpdates.empty();
    private final ConversationFlowErrorCode errorCode;
    private final String error;
    @Builder.Default
    private final List<String> warnings = List.of();
    @Builder.Default
    private final List<String> violations = List.of();
    @Builder.Default
    private final List<InputValidationRule> validationHints = List.of();
    private final NavigationState state;
    private final NavigationStep step;
    /** Committed copy of the session after this transition (or after the failure was recorded). */
    private final ConversationSession session;
    private final ValidationReport validationReport;

    public static NavigationResult failure(ConversationFlowErrorCode code, String message, ConversationSession session) {
        return NavigationResult.builder()
                .success(false)
                .errorCode(code)
                .error(message == null ? code.defaultMessage() : message)
                .session(session)
                .state(session == null ? null : session.getState())
                .build();
    }
}
