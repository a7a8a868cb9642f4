package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.engine.node.ButtonOption;
import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.node.InputNode;
import com.github.salilvnair.convflow.engine.node.InputValidationRule;
import com.github.salilvnair.convflow.engine.node.OptionNode;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.store.FlowNodeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Resolves the {@code continue} sentinel: stores input replies, matches option replies and
 * otherwise follows the current node's default successor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContinueTargetResolver {

    public static final String CONTINUE = "continue";
    public static final String SELECTED_OPTION = "selectedOption";

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9][0-9\\s().-]{6,19}$");

    private final FlowNodeStore flowNodeStore;

    public static boolean isContinue(String targetNodeId) {
        return targetNodeId == null || CONTINUE.equalsIgnoreCase(targetNodeId.trim());
    }

    public ContinueResolution resolve(ConversationSession session, String userText) {
        String anchorId = session.isWaitingForInput() && session.getWaitingNodeId() != null
                ? session.getWaitingNodeId()
                : session.getCurrentNodeId();
        Optional<FlowNode> anchor = flowNodeStore.getNode(anchorId);
        if (anchor.isEmpty()) {
            log.debug("No anchor node for continue sessionId={} anchorId={}", session.getSessionId(), anchorId);
            return ContinueResolution.advance(null, null, ContextUpdates.empty());
        }
        FlowNode node = anchor.get();
        String reply = userText == null ? "" : userText.trim();

        if (node instanceof InputNode input && session.isWaitingForInput()) {
            Optional<String> invalid = firstViolation(input, reply);
            if (invalid.isPresent()) {
                return ContinueResolution.reprompt(node, invalid.get());
            }
            String variable = input.variableName() == null || input.variableName().isBlank()
                    ? input.nodeId()
                    : input.variableName();
            return ContinueResolution.advance(input.nextNodeId(), node, ContextUpdates.empty().collect(variable, reply));
        }

        if (node instanceof OptionNode optionNode && session.isWaitingForInput()) {
            List<ButtonOption> options = session.getActiveOptions() == null || session.getActiveOptions().isEmpty()
                    ? optionNode.options()
                    : session.getActiveOptions();
            Optional<ButtonOption> match = matchOption(options, reply);
            if (match.isEmpty()) {
                return ContinueResolution.reprompt(node, "No option matches '" + reply + "'");
            }
            ButtonOption option = match.get();
            Object selected = option.value() != null ? option.value() : (option.id() != null ? option.id() : option.label());
            ContextUpdates updates = ContextUpdates.empty()
                    .collect(optionNode.nodeId(), selected)
                    .collect(SELECTED_OPTION, selected);
            String target = option.targetNodeId() != null ? option.targetNodeId() : optionNode.nextNodeId();
            return ContinueResolution.advance(target, node, updates);
        }

        return ContinueResolution.advance(node.nextNodeId(), node, ContextUpdates.empty());
    }

    Optional<ButtonOption> matchOption(List<ButtonOption> options, String reply) {
        if (options == null || options.isEmpty() || reply.isEmpty()) {
            return Optional.empty();
        }
        String normalized = reply.toLowerCase(Locale.ROOT);
        for (ButtonOption option : options) {
            if (equalsIgnoreCase(option.id(), normalized)
                    || equalsIgnoreCase(option.label(), normalized)
                    || equalsIgnoreCase(option.value(), normalized)) {
                return Optional.of(option);
            }
        }
        try {
            int index = Integer.parseInt(reply);
            if (index >= 1 && index <= options.size()) {
                return Optional.of(options.get(index - 1));
            }
        }
        catch (NumberFormatException e) {
            log.trace("Reply is not an option index: {}", reply);
        }
        return Optional.empty();
    }

    Optional<String> firstViolation(InputNode node, String reply) {
        for (InputValidationRule rule : node.validation()) {
            if (rule == null || rule.type() == null) {
                continue;
            }
            boolean ok = switch (rule.type().toLowerCase(Locale.ROOT)) {
                case "required" -> !reply.isEmpty();
                case "email" -> reply.isEmpty() || EMAIL.matcher(reply).matches();
                case "phone" -> reply.isEmpty() || PHONE.matcher(reply).matches();
                case "min_length" -> reply.length() >= intValue(rule.value(), 0);
                case "max_length" -> reply.length() <= intValue(rule.value(), Integer.MAX_VALUE);
                case "pattern" -> matchesPattern(rule.value(), reply);
                default -> true;
            };
            if (!ok) {
                return Optional.of(rule.message() != null ? rule.message() : "Invalid " + rule.type() + " value");
            }
        }
        return Optional.empty();
    }

    private boolean matchesPattern(Object regex, String reply) {
        if (regex == null) {
            return true;
        }
        try {
            return Pattern.compile(String.valueOf(regex)).matcher(reply).matches();
        }
        catch (PatternSyntaxException e) {
            log.warn("Ignoring malformed input pattern {}: {}", regex, e.getDescription());
            return true;
        }
    }

    private boolean equalsIgnoreCase(String candidate, String normalizedReply) {
        return candidate != null && candidate.trim().toLowerCase(Locale.ROOT).equals(normalizedReply);
    }

    private int intValue(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return value == null ? fallback : Integer.parseInt(String.valueOf(value).trim());
        }
        catch (NumberFormatException e) {
            return fallback;
        }
    }
}
