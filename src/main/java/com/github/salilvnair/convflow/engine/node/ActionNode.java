package com.github.salilvnair.convflow.engine.node;

import lombok.Builder;

import java.util.List;

@Builder
public record ActionNode(
        String nodeId,
        String tenantId,
        String templateId,
        List<ActionDescriptor> actions,
        String nextNodeId,
        List<String> requiredVariables,
        String stageId
) implements FlowNode {

    public ActionNode {
        actions = actions == null ? List.of() : List.copyOf(actions);
        requiredVariables = FlowNode.normalize(requiredVariables);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.ACTION;
    }
}
