package com.github.salilvnair.convflow.engine.validation.rule;

import com.github.salilvnair.convflow.config.ConvFlowValidationConfig;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.session.NavigationStep;
import com.github.salilvnair.convflow.engine.validation.RuleVerdict;
import com.github.salilvnair.convflow.engine.validation.ValidationCategory;
import com.github.salilvnair.convflow.engine.validation.ValidationContext;
import com.github.salilvnair.convflow.engine.validation.ValidationPriority;
import com.github.salilvnair.convflow.engine.validation.ValidationRule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Warns when the target node already appears {@code threshold} times among the last
 * {@code window} history entries.
 */
@Component
@RequiredArgsConstructor
public class AntiLoopRule implements ValidationRule {

    public static final String ID = "circular_navigation";

    private final ConvFlowValidationConfig config;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Circular navigation detection";
    }

    @Override
    public ValidationPriority priority() {
        return ValidationPriority.MEDIUM;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.BUSINESS_LOGIC;
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public RuleVerdict validate(ValidationContext context) {
        ConversationSession session = context.getSession();
        if (session == null || session.getHistory() == null || session.getHistory().isEmpty()) {
            return RuleVerdict.pass(ID, "No history");
        }
        List<NavigationStep> history = session.getHistory();
        int window = Math.max(1, config.getAntiLoop().getWindow());
        List<String> recent = history.subList(Math.max(0, history.size() - window), history.size()).stream()
                .map(NavigationStep::getToNodeId)
                .collect(Collectors.toList());
        long occurrences = recent.stream().filter(id -> Objects.equals(id, context.getTargetNodeId())).count();
        if (occurrences >= config.getAntiLoop().getThreshold()) {
            return RuleVerdict.warning(ID,
                    "Possible circular navigation towards node " + context.getTargetNodeId(),
                    "Review the flow for an exit path out of this loop",
                    Map.of("recentNodes", recent, "occurrences", occurrences));
        }
        return RuleVerdict.pass(ID, "No circular navigation detected");
    }
}
