package com.github.salilvnair.convflow.engine.core;

import com.github.salilvnair.convflow.config.ConvFlowNavigationConfig;
import com.github.salilvnair.convflow.config.ConvFlowQueueConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.navigation.NavigationResult;
import com.github.salilvnair.convflow.engine.navigation.NavigationStateMachine;
import com.github.salilvnair.convflow.engine.queue.EnqueueOptions;
import com.github.salilvnair.convflow.engine.queue.NodeProcessingQueue;
import com.github.salilvnair.convflow.engine.queue.QueueRequestStatus;
import com.github.salilvnair.convflow.engine.queue.QueuedNavigationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultConversationOrchestrator implements ConversationOrchestrator {

    private final NodeProcessingQueue queue;
    private final ConvFlowNavigationConfig navigationConfig;
    private final ConvFlowQueueConfig queueConfig;

    @Override
    public CompletableFuture<NavigationResponse> submit(NavigationRequest request) {
        String requestId;
        try {
            requestId = queue.enqueue(toQueued(request), EnqueueOptions.builder().priority(request.getPriority()).build());
        }
        catch (ConversationFlowException e) {
            log.warn("Navigation request rejected sessionId={} errorCode={}: {}",
                    request.getSessionId(), e.getErrorCode(), e.getMessage());
            return CompletableFuture.completedFuture(fallback(request, null, e.getCode(), e.getMessage()));
        }
        catch (RuntimeException e) {
            log.error("Navigation request could not be queued sessionId={}: {}", request.getSessionId(), e.getMessage(), e);
            return CompletableFuture.completedFuture(
                    fallback(request, null, ConversationFlowErrorCode.INTERNAL_ERROR, e.getMessage()));
        }
        return queue.completion(requestId)
                .thenApply(done -> toResponse(request, done))
                .exceptionally(error -> {
                    log.error("Navigation request completion failed requestId={}: {}", requestId, error.getMessage(), error);
                    return fallback(request, requestId, ConversationFlowErrorCode.INTERNAL_ERROR, error.getMessage());
                });
    }

    @Override
    public NavigationResponse process(NavigationRequest request) {
        CompletableFuture<NavigationResponse> future = submit(request);
        long timeoutMs = queueConfig.getResponseTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            log.warn("Navigation response timed out sessionId={} afterMs={}", request.getSessionId(), timeoutMs);
            return fallback(request, null, ConversationFlowErrorCode.REQUEST_TIMEOUT, null);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(request, null, ConversationFlowErrorCode.INTERNAL_ERROR, "Interrupted while waiting for response");
        }
        catch (ExecutionException e) {
            log.error("Navigation response failed sessionId={}: {}", request.getSessionId(), e.getMessage(), e);
            return fallback(request, null, ConversationFlowErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }

    private QueuedNavigationRequest toQueued(NavigationRequest request) {
        return QueuedNavigationRequest.builder()
                .sessionId(request.getSessionId())
                .userId(request.getUserId())
                .tenantId(request.getTenantId())
                .templateId(request.getTemplateId())
                .fromNodeId(request.getFromNodeId())
                .targetNodeId(request.getToNodeId())
                .userText(request.getUserText())
                .navigationType(request.getNavigationType())
                .build();
    }

    private NavigationResponse toResponse(NavigationRequest request, QueuedNavigationRequest done) {
        NavigationResult result = done.getResult();
        if (done.getStatus() == QueueRequestStatus.COMPLETED && result != null) {
            return NavigationResponse.builder()
                    .success(true)
                    .sessionId(result.getSession() == null ? request.getSessionId() : result.getSession().getSessionId())
                    .requestId(done.getRequestId())
                    .botResponse(result.getBotResponse())
                    .requiresUserInput(result.isRequiresUserInput())
                    .nextNodeId(result.getNextNodeId())
                    .contextUpdates(result.getContextUpdates().toMap())
                    .warnings(result.getWarnings())
                    .validationHints(result.getValidationHints().stream()
                            .map(NavigationStateMachine::validationHint)
                            .filter(hint -> !hint.isEmpty())
                            .toList())
                    .build();
        }
        return fallback(request, done.getRequestId(), done.getErrorCode(), done.getLastError());
    }

    private NavigationResponse fallback(NavigationRequest request,
                                        String requestId,
                                        ConversationFlowErrorCode code,
                                        String error) {
        ConversationFlowErrorCode effective = code == null ? ConversationFlowErrorCode.INTERNAL_ERROR : code;
        return NavigationResponse.builder()
                .success(false)
                .sessionId(request.getSessionId())
                .requestId(requestId)
                .botResponse(navigationConfig.getFallbackMessage())
                .requiresUserInput(true)
                .errorCode(effective)
                .error(error == null ? effective.defaultMessage() : error)
                .build();
    }
}
