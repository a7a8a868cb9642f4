package com.github.salilvnair.convflow.engine.validation.rule;

import com.github.salilvnair.convflow.config.ConvFlowValidationConfig;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.validation.RuleVerdict;
import com.github.salilvnair.convflow.engine.validation.ValidationCategory;
import com.github.salilvnair.convflow.engine.validation.ValidationContext;
import com.github.salilvnair.convflow.engine.validation.ValidationPriority;
import com.github.salilvnair.convflow.engine.validation.ValidationRule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class NavigationRateLimitRule implements ValidationRule {

    public static final String ID = "navigation_rate_limit";

    private final ConvFlowValidationConfig config;
    private final Clock clock;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Navigation rate limit";
    }

    @Override
    public ValidationPriority priority() {
        return ValidationPriority.LOW;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.PERFORMANCE;
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public RuleVerdict validate(ValidationContext context) {
        ConversationSession session = context.getSession();
        if (session == null || session.getHistory() == null) {
            return RuleVerdict.pass(ID, "No history");
        }
        Instant now = context.getEvaluatedAt() != null ? context.getEvaluatedAt() : clock.instant();
        Instant windowStart = now.minus(config.getRateLimit().getWindow());
        long recent = session.getHistory().stream()
                .filter(step -> step.getTimestamp() != null && step.getTimestamp().isAfter(windowStart))
                .count();
        if (recent > config.getRateLimit().getMaxNavigations()) {
            return RuleVerdict.warning(ID,
                    "High navigation rate: " + recent + " navigations in the current window",
                    "Check for automated or runaway navigation",
                    Map.of("navigationCount", recent));
        }
        return RuleVerdict.pass(ID, "Navigation rate within limits");
    }
}
