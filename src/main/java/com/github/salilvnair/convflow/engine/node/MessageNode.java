package com.github.salilvnair.convflow.engine.node;

import lombok.Builder;

import java.util.List;

@Builder
public record MessageNode(
        String nodeId,
        String tenantId,
        String templateId,
        String text,
        String nextNodeId,
        List<String> requiredVariables,
        String stageId
) implements FlowNode {

    public MessageNode {
        requiredVariables = FlowNode.normalize(requiredVariables);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.MESSAGE;
    }
}
