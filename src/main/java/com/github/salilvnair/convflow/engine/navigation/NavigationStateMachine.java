package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.config.ConvFlowNavigationConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.navigation.action.ActionHandler;
import com.github.salilvnair.convflow.engine.navigation.action.ActionHandlerFactory;
import com.github.salilvnair.convflow.engine.node.ActionDescriptor;
import com.github.salilvnair.convflow.engine.node.ActionNode;
import com.github.salilvnair.convflow.engine.node.ButtonOption;
import com.github.salilvnair.convflow.engine.node.ConditionNode;
import com.github.salilvnair.convflow.engine.node.EndNode;
import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.node.InputNode;
import com.github.salilvnair.convflow.engine.node.InputValidationRule;
import com.github.salilvnair.convflow.engine.node.MessageNode;
import com.github.salilvnair.convflow.engine.node.OptionNode;
import com.github.salilvnair.convflow.engine.session.ContextSnapshot;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.NavigationState;
import com.github.salilvnair.convflow.engine.session.NavigationStep;
import com.github.salilvnair.convflow.engine.store.FlowNodeStore;
import com.github.salilvnair.convflow.engine.validation.RuleVerdict;
import com.github.salilvnair.convflow.engine.validation.ValidationContext;
import com.github.salilvnair.convflow.engine.validation.ValidationGate;
import com.github.salilvnair.convflow.engine.validation.ValidationReport;
import com.github.salilvnair.convflow.service.ConversationSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Computes one transition of a session through its flow graph.
 * <p>
 * Work happens on a copy of the caller's session; only a successful transition (or a
 * recorded failure) is written back through {@link ConversationSessionService}. At most one
 * transition per session runs at a time, a concurrent call fails fast.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NavigationStateMachine {

    private final FlowNodeStore flowNodeStore;
    private final ValidationGate validationGate;
    private final VariableInterpolator interpolator;
    private final ConditionEvaluator conditionEvaluator;
    private final ContinueTargetResolver continueResolver;
    private final ActionHandlerFactory actionHandlerFactory;
    private final ConversationSessionService sessionService;
    private final ConvFlowNavigationConfig config;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ConversationSession createContext(String userId, String tenantId, String sessionId, Map<String, Object> initialData) {
        return createContext(userId, tenantId, sessionId, null, initialData);
    }

    public ConversationSession createContext(String userId,
                                             String tenantId,
                                             String sessionId,
                                             String templateId,
                                             Map<String, Object> initialData) {
        return sessionService.createSession(userId, tenantId, sessionId, templateId, initialData);
    }

    /**
     * Advances {@code session} to {@code targetNodeId}. The {@code continue} sentinel resolves
     * the target from the node the session is waiting on.
     */
    public NavigationResult advance(ConversationSession session, String targetNodeId, NavigationOptions options) {
        NavigationOptions opts = options == null ? NavigationOptions.defaults() : options;
        String sessionId = session.getSessionId();
        if (!inFlight.add(sessionId)) {
            log.warn("Navigation rejected, another transition in flight sessionId={} target={}", sessionId, targetNodeId);
            return NavigationResult.failure(ConversationFlowErrorCode.NAVIGATION_IN_PROGRESS, null, session);
        }
        try {
            if (ContinueTargetResolver.isContinue(targetNodeId)) {
                return continueLocked(session, opts);
            }
            return advanceLocked(session, targetNodeId, ContextUpdates.empty(), opts);
        }
        finally {
            inFlight.remove(sessionId);
        }
    }

    public boolean isInFlight(String sessionId) {
        return inFlight.contains(sessionId);
    }

    /**
     * Restores the context captured before the most recent successful step and drops that
     * step and everything after it from history.
     */
    public NavigationResult rollback(ConversationSession session) {
        String sessionId = session.getSessionId();
        if (!inFlight.add(sessionId)) {
            return NavigationResult.failure(ConversationFlowErrorCode.NAVIGATION_IN_PROGRESS, null, session);
        }
        try {
            return rollbackLocked(session);
        }
        finally {
            inFlight.remove(sessionId);
        }
    }

    private NavigationResult continueLocked(ConversationSession session, NavigationOptions opts) {
        ConversationSession working = session.copy();
        ContinueResolution resolution = continueResolver.resolve(working, opts.getUserText());
        if (resolution.reprompt()) {
            return reprompt(working, resolution, opts);
        }
        if (resolution.targetNodeId() == null) {
            String message = "No successor for node " + working.getCurrentNodeId();
            return recordFailure(session, null, ConversationFlowErrorCode.NODE_NOT_FOUND, message, opts, List.of());
        }
        return advanceLocked(session, resolution.targetNodeId(), resolution.updates(), opts);
    }

    private NavigationResult advanceLocked(ConversationSession session,
                                           String targetNodeId,
                                           ContextUpdates seed,
                                           NavigationOptions opts) {
        Instant now = clock.instant();
        ContextSnapshot before = ContextSnapshot.of(session);
        ConversationSession working = session.copy();
        ContextUpdates updates = ContextUpdates.empty().merge(seed);
        updates.applyTo(working);
        if (opts.getUserText() != null) {
            working.setLastUserMessage(opts.getUserText());
        }

        FlowNode target = flowNodeStore.getNode(targetNodeId).orElse(null);
        if (target == null) {
            return recordFailure(session, targetNodeId, ConversationFlowErrorCode.NODE_NOT_FOUND,
                    "Node " + targetNodeId + " not found", opts, List.of());
        }

        List<String> warnings = new ArrayList<>();
        ValidationReport report = null;
        boolean validate = opts.getValidate() != null ? opts.getValidate() : config.isValidate();
        if (validate) {
            boolean strict = opts.getStrictValidation() != null ? opts.getStrictValidation() : config.isStrictValidation();
            working.setState(NavigationState.AWAITING_VALIDATION);
            report = validationGate.validate(ValidationContext.builder()
                    .session(working)
                    .fromNodeId(working.getCurrentNodeId())
                    .targetNodeId(targetNodeId)
                    .targetNode(target)
                    .navigationType(opts.getNavigationType())
                    .requestId(opts.getRequestId())
                    .evaluatedAt(now)
                    .build(), opts.getRuleIds(), strict);
            if (!report.canProceed() || (strict && !report.valid())) {
                log.warn("Navigation vetoed sessionId={} target={} violations={}",
                        session.getSessionId(), targetNodeId, report.violationMessages());
                return recordFailure(session, targetNodeId, ConversationFlowErrorCode.VALIDATION_FAILED,
                        "Navigation to " + targetNodeId + " rejected by validation", opts, report.violationMessages());
            }
            report.warnings().stream().map(RuleVerdict::message).forEach(warnings::add);
        }

        working.setState(NavigationState.ADVANCING);
        NodeOutcome outcome;
        try {
            outcome = execute(target, working, updates, 0, warnings);
        }
        catch (ConversationFlowException e) {
            return recordFailure(session, targetNodeId, e.getCode(), e.getMessage(), opts, List.of());
        }
        catch (RuntimeException e) {
            log.error("Unexpected navigation failure sessionId={} target={}", session.getSessionId(), targetNodeId, e);
            return recordFailure(session, targetNodeId, ConversationFlowErrorCode.INTERNAL_ERROR, e.getMessage(), opts, List.of());
        }

        FlowNode landed = outcome.node();
        working.setPreviousNodeId(session.getCurrentNodeId());
        working.setCurrentNodeId(landed.nodeId());
        if (outcome.waitsForInput()) {
            working.setWaitingForInput(true);
            working.setWaitingNodeId(landed.nodeId());
            working.setActiveOptions(landed instanceof OptionNode optionNode
                    ? new ArrayList<>(optionNode.options())
                    : new ArrayList<>());
        }
        else {
            working.clearWaiting();
        }
        working.setState(outcome.state());
        working.setLastBotResponse(outcome.botResponse());

        boolean preserve = opts.getPreserveContext() != null ? opts.getPreserveContext() : config.isPreserveContext();
        NavigationStep step = NavigationStep.builder()
                .stepId(UUID.randomUUID().toString())
                .fromNodeId(session.getCurrentNodeId())
                .toNodeId(landed.nodeId())
                .navigationType(opts.getNavigationType())
                .timestamp(now)
                .success(true)
                .contextSnapshot(preserve ? before : null)
                .build();
        working.appendStep(step, config.getMaxHistory());
        sessionService.saveSession(working);

        log.debug("Navigation committed sessionId={} from={} to={} state={}",
                working.getSessionId(), step.getFromNodeId(), step.getToNodeId(), working.getState());
        return NavigationResult.builder()
                .success(true)
                .nextNode(landed)
                .nextNodeId(landed.nodeId())
                .botResponse(outcome.botResponse())
                .requiresUserInput(outcome.waitsForInput())
                .contextUpdates(updates)
                .warnings(List.copyOf(warnings))
                .validationHints(landed instanceof InputNode input ? input.validation() : List.<InputValidationRule>of())
                .state(working.getState())
                .step(step)
                .session(working)
                .validationReport(report)
                .build();
    }

    private NodeOutcome execute(FlowNode node,
                                ConversationSession working,
                                ContextUpdates updates,
                                int depth,
                                List<String> warnings) {
        if (depth > config.getMaxConditionDepth()) {
            throw new ConversationFlowException(ConversationFlowErrorCode.CONDITION_DEPTH_EXCEEDED,
                    "Automatic transitions exceeded depth " + config.getMaxConditionDepth() + " at node " + node.nodeId());
        }
        switch (node.nodeType()) {
            case MESSAGE: {
                MessageNode message = (MessageNode) node;
                return new NodeOutcome(node, interpolator.interpolate(message.text(), working), false, NavigationState.IDLE);
            }
            case INPUT: {
                InputNode input = (InputNode) node;
                return new NodeOutcome(node, renderInput(input, working), true, NavigationState.AWAITING_INPUT);
            }
            case BUTTON:
            case LIST: {
                OptionNode options = (OptionNode) node;
                return new NodeOutcome(node, renderOptions(options, working), true, NavigationState.AWAITING_INPUT);
            }
            case CONDITION: {
                ConditionNode condition = (ConditionNode) node;
                String targetId = conditionEvaluator.resolveTarget(condition, working)
                        .orElseThrow(() -> new ConversationFlowException(ConversationFlowErrorCode.NODE_NOT_FOUND,
                                "Condition node " + node.nodeId() + " has no matching branch and no default"));
                return execute(requireNode(targetId), working, updates, depth + 1, warnings);
            }
            case ACTION: {
                ActionNode action = (ActionNode) node;
                runActions(action, working, updates, warnings);
                if (action.nextNodeId() != null) {
                    return execute(requireNode(action.nextNodeId()), working, updates, depth + 1, warnings);
                }
                return new NodeOutcome(node, "", false, NavigationState.IDLE);
            }
            case END: {
                EndNode end = (EndNode) node;
                return new NodeOutcome(node, interpolator.interpolate(end.text(), working), false, NavigationState.TERMINAL);
            }
            default:
                throw new ConversationFlowException(ConversationFlowErrorCode.INTERNAL_ERROR,
                        "Unsupported node type " + node.nodeType());
        }
    }

    private void runActions(ActionNode node, ConversationSession working, ContextUpdates updates, List<String> warnings) {
        for (ActionDescriptor descriptor : node.actions()) {
            ActionHandler handler = actionHandlerFactory.get(descriptor.type()).orElse(null);
            if (handler == null) {
                log.warn("Skipping unknown action type={} nodeId={}", descriptor.type(), node.nodeId());
                warnings.add("Unknown action type: " + descriptor.type());
                continue;
            }
            ContextUpdates produced = handler.execute(descriptor, working);
            if (produced != null) {
                produced.applyTo(working);
                updates.merge(produced);
            }
        }
    }

    private FlowNode requireNode(String nodeId) {
        return flowNodeStore.getNode(nodeId)
                .orElseThrow(() -> new ConversationFlowException(ConversationFlowErrorCode.NODE_NOT_FOUND,
                        "Node " + nodeId + " not found"));
    }

    /**
     * Prompt, then the placeholder line, then a parenthesised summary of the validation rules.
     */
    private String renderInput(InputNode node, ConversationSession working) {
        StringBuilder text = new StringBuilder(node.prompt() == null ? "" : node.prompt());
        if (node.placeholder() != null && !node.placeholder().isBlank()) {
            text.append('\n').append(node.placeholder());
        }
        String hints = node.validation().stream()
                .map(NavigationStateMachine::validationHint)
                .filter(hint -> !hint.isEmpty())
                .collect(Collectors.joining(", "));
        if (!hints.isEmpty()) {
            text.append("\n(").append(hints).append(')');
        }
        return interpolator.interpolate(text.toString(), working);
    }

    public static String validationHint(InputValidationRule rule) {
        if (rule == null || rule.type() == null) {
            return "";
        }
        switch (rule.type().toLowerCase()) {
            case "required":
                return "required";
            case "email":
                return "email format";
            case "phone":
                return "phone number";
            case "min_length":
                return "min " + rule.value() + " characters";
            case "max_length":
                return "max " + rule.value() + " characters";
            case "pattern":
                return "format " + rule.value();
            default:
                return "";
        }
    }

    private String renderOptions(OptionNode node, ConversationSession working) {
        StringBuilder text = new StringBuilder(interpolator.interpolate(node.prompt(), working));
        List<ButtonOption> options = node.options();
        for (int i = 0; i < options.size(); i++) {
            text.append(text.length() == 0 ? "" : "\n")
                    .append(i + 1)
                    .append(". ")
                    .append(interpolator.interpolate(options.get(i).label(), working));
        }
        return text.toString();
    }

    private NavigationResult reprompt(ConversationSession working, ContinueResolution resolution, NavigationOptions opts) {
        FlowNode node = resolution.waitingNode();
        String prompt = node instanceof OptionNode optionNode
                ? renderOptions(optionNode, working)
                : node instanceof InputNode input ? renderInput(input, working) : "";
        String reason = resolution.repromptReason();
        String response = (reason != null && node instanceof InputNode ? reason : config.getRepromptMessage())
                + (prompt.isEmpty() ? "" : "\n" + prompt);
        if (opts.getUserText() != null) {
            working.setLastUserMessage(opts.getUserText());
        }
        working.setLastBotResponse(response);
        sessionService.saveSession(working);
        log.debug("Re-prompting sessionId={} nodeId={} reason={}", working.getSessionId(), node.nodeId(), reason);
        return NavigationResult.builder()
                .success(true)
                .nextNode(node)
                .nextNodeId(node.nodeId())
                .botResponse(response)
                .requiresUserInput(true)
                .warnings(reason == null ? List.of() : List.of(reason))
                .validationHints(node instanceof InputNode input ? input.validation() : List.<InputValidationRule>of())
                .state(working.getState())
                .session(working)
                .build();
    }

    private NavigationResult recordFailure(ConversationSession session,
                                           String targetNodeId,
                                           ConversationFlowErrorCode code,
                                           String message,
                                           NavigationOptions opts,
                                           List<String> violations) {
        ConversationSession failed = session.copy();
        NavigationStep step = NavigationStep.builder()
                .stepId(UUID.randomUUID().toString())
                .fromNodeId(session.getCurrentNodeId())
                .toNodeId(targetNodeId)
                .navigationType(opts.getNavigationType())
                .timestamp(clock.instant())
                .success(false)
                .errorCode(code.name())
                .error(message)
                .build();
        if (opts.isRollbackOnError()) {
            restoreLastSuccessful(failed);
        }
        failed.appendStep(step, config.getMaxHistory());
        sessionService.saveSession(failed);
        log.warn("Navigation failed sessionId={} target={} code={} message={}",
                session.getSessionId(), targetNodeId, code, message);
        return NavigationResult.builder()
                .success(false)
                .errorCode(code)
                .error(message)
                .violations(List.copyOf(violations))
                .state(failed.getState())
                .step(step)
                .session(failed)
                .build();
    }

    private NavigationResult rollbackLocked(ConversationSession session) {
        ConversationSession working = session.copy();
        if (!restoreLastSuccessful(working)) {
            return NavigationResult.failure(ConversationFlowErrorCode.INTERNAL_ERROR,
                    "No successful step with a context snapshot to roll back to", session);
        }
        sessionService.saveSession(working);
        log.info("Rolled back sessionId={} to nodeId={}", working.getSessionId(), working.getCurrentNodeId());
        return NavigationResult.builder()
                .success(true)
                .nextNodeId(working.getCurrentNodeId())
                .nextNode(working.getCurrentNodeId() == null ? null : flowNodeStore.getNode(working.getCurrentNodeId()).orElse(null))
                .requiresUserInput(working.isWaitingForInput())
                .botResponse(working.getLastBotResponse())
                .state(working.getState())
                .session(working)
                .build();
    }

    private boolean restoreLastSuccessful(ConversationSession working) {
        List<NavigationStep> history = working.getHistory();
        for (int i = history.size() - 1; i >= 0; i--) {
            NavigationStep step = history.get(i);
            if (step.isSuccess() && step.getContextSnapshot() != null) {
                step.getContextSnapshot().restoreInto(working);
                working.setHistory(history.subList(0, i).stream().collect(Collectors.toCollection(ArrayList::new)));
                return true;
            }
        }
        return false;
    }

    private record NodeOutcome(FlowNode node, String botResponse, boolean waitsForInput, NavigationState state) {
    }
}
