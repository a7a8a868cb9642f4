package com.github.salilvnair.convflow.engine.queue;

import com.github.salilvnair.convflow.engine.navigation.NavigationOptions;
import com.github.salilvnair.convflow.engine.navigation.NavigationResult;
import com.github.salilvnair.convflow.engine.navigation.NavigationStateMachine;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.service.ConversationSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the request's session and runs one state machine transition against it. Rollback is
 * left to the queue, which calls {@link #rollback} once retries are exhausted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultNavigationRequestProcessor implements NavigationRequestProcessor {

    private final ConversationSessionService sessionService;
    private final NavigationStateMachine stateMachine;

    @Override
    public NavigationResult process(QueuedNavigationRequest request) {
        ConversationSession session = sessionService.getOrCreateSession(
                request.getUserId(), request.getTenantId(), request.getSessionId(), request.getTemplateId());
        NavigationOptions options = NavigationOptions.builder()
                .navigationType(request.getNavigationType())
                .requestId(request.getRequestId())
                .userText(request.getUserText())
                .rollbackOnError(false)
                .build();
        NavigationResult result = stateMachine.advance(session, request.getTargetNodeId(), options);
        log.debug("Processed queued request requestId={} sessionId={} success={} nextNodeId={}",
                request.getRequestId(), session.getSessionId(), result.isSuccess(), result.getNextNodeId());
        return result;
    }

    @Override
    public void rollback(QueuedNavigationRequest request) {
        sessionService.loadSession(request.getUserId(), request.getTenantId(), request.getSessionId())
                .ifPresent(session -> {
                    NavigationResult result = stateMachine.rollback(session);
                    log.info("Rolled back session after failed request requestId={} sessionId={} success={}",
                            request.getRequestId(), session.getSessionId(), result.isSuccess());
                });
    }
}
