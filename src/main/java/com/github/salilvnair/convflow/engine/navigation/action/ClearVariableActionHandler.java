package com.github.salilvnair.convflow.engine.navigation.action;

import com.github.salilvnair.convflow.engine.navigation.ContextUpdates;
import com.github.salilvnair.convflow.engine.node.ActionDescriptor;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class ClearVariableActionHandler implements ActionHandler {

    @Override
    public String type() {
        return "clear_variable";
    }

    @Override
    public ContextUpdates execute(ActionDescriptor action, ConversationSession session) {
        ContextUpdates updates = ContextUpdates.empty();
        Object keys = action.configValue("keys");
        if (keys instanceof Collection<?> names) {
            names.forEach(name -> updates.remove(String.valueOf(name)));
        }
        Object key = action.configValue("key");
        if (key != null) {
            updates.remove(String.valueOf(key));
        }
        return updates;
    }
}
