package com.github.salilvnair.convflow.engine.core;

import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@Builder
public class NavigationResponse {

    private final boolean success;
    private final String sessionId;
    private final String requestId;
    private final String botResponse;
    private final boolean requiresUserInput;
    private final String nextNodeId;
    @Builder.Default
    private final Map<String, Object> contextUpdates = Map.of();
    @Builder.Default
    private final List<String> warnings = List.of();
    @Builder.Default
    private final List<String> validationHints = List.of();
    private final ConversationFlowErrorCode errorCode;
    private final String error;
}
