package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.engine.node.FlowNode;

/**
 * Outcome of interpreting a user reply against the node the session waits on.
 *
 * @param targetNodeId node to advance to; {@code null} when re-prompting
 * @param waitingNode  node the reply was matched against, if any
 */
public record ContinueResolution(
        String targetNodeId,
        FlowNode waitingNode,
        ContextUpdates updates,
        boolean reprompt,
        String repromptReason
) {

    public static ContinueResolution advance(String targetNodeId, FlowNode waitingNode, ContextUpdates updates) {
        return new ContinueResolution(targetNodeId, waitingNode, updates, false, null);
    }

    public static ContinueResolution reprompt(FlowNode waitingNode, String reason) {
        return new ContinueResolution(null, waitingNode, ContextUpdates.empty(), true, reason);
    }
}
