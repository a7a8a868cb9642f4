package com.github.salilvnair.convflow.engine.navigation.action;

import com.github.salilvnair.convflow.engine.navigation.ContextUpdates;
import com.github.salilvnair.convflow.engine.node.ActionDescriptor;
import com.github.salilvnair.convflow.engine.session.ConversationSession;

import java.util.Set;

/**
 * Side effect run by an action node. Handlers return their variable changes instead of
 * writing them; the state machine applies the merged delta.
 */
public interface ActionHandler {

    String type();

    /** Additional type names this handler answers to. */
    default Set<String> aliases() {
        return Set.of();
    }

    ContextUpdates execute(ActionDescriptor action, ConversationSession session);
}
