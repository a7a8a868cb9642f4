package com.github.salilvnair.convflow.engine.navigation.action;

import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.navigation.ContextUpdates;
import com.github.salilvnair.convflow.engine.navigation.VariableInterpolator;
import com.github.salilvnair.convflow.engine.node.ActionDescriptor;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@code {"type":"set_variable","config":{"key":"plan","value":"{{choice}}","scope":"collected"}}}.
 * Scope defaults to the global variables.
 */
@Component
@RequiredArgsConstructor
public class SetVariableActionHandler implements ActionHandler {

    private final VariableInterpolator interpolator;

    @Override
    public String type() {
        return "set_variable";
    }

    @Override
    public ContextUpdates execute(ActionDescriptor action, ConversationSession session) {
        Object key = action.configValue("key");
        if (key == null || String.valueOf(key).isBlank()) {
            throw new ConversationFlowException(ConversationFlowErrorCode.ACTION_FAILED,
                    "set_variable requires a 'key'");
        }
        Object value = action.configValue("value");
        if (value instanceof String text) {
            value = interpolator.interpolate(text, session);
        }
        boolean collected = "collected".equalsIgnoreCase(String.valueOf(action.configValue("scope")));
        ContextUpdates updates = ContextUpdates.empty();
        return collected
                ? updates.collect(String.valueOf(key), value)
                : updates.global(String.valueOf(key), value);
    }
}
