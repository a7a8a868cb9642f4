package com.github.salilvnair.convflow.engine.validation.rule;

import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.validation.RuleVerdict;
import com.github.salilvnair.convflow.engine.validation.ValidationCategory;
import com.github.salilvnair.convflow.engine.validation.ValidationContext;
import com.github.salilvnair.convflow.engine.validation.ValidationPriority;
import com.github.salilvnair.convflow.engine.validation.ValidationRule;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class SessionValidityRule implements ValidationRule {

    public static final String ID = "session_validity";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Session is valid";
    }

    @Override
    public ValidationPriority priority() {
        return ValidationPriority.HIGH;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.CONTEXT;
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public RuleVerdict validate(ValidationContext context) {
        ConversationSession session = context.getSession();
        if (session == null || session.getSessionId() == null) {
            return RuleVerdict.warning(ID, "Navigating without a persistent session",
                    "Establish a session before navigating", Map.of());
        }
        if (session.isFallback()) {
            return RuleVerdict.warning(ID, "Navigating on a fallback session",
                    "Check session persistence health", Map.of("sessionId", session.getSessionId()));
        }
        if (!session.isActive()) {
            return RuleVerdict.warning(ID, "Session " + session.getSessionId() + " has ended",
                    "Start a new session", Map.of("sessionId", session.getSessionId()));
        }
        return RuleVerdict.pass(ID, "Session valid");
    }
}
