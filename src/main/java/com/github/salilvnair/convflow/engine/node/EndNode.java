package com.github.salilvnair.convflow.engine.node;

import lombok.Builder;

import java.util.List;

@Builder
public record EndNode(
        String nodeId,
        String tenantId,
        String templateId,
        String text,
        List<String> requiredVariables,
        String stageId
) implements FlowNode {

    public EndNode {
        requiredVariables = FlowNode.normalize(requiredVariables);
    }

    @Override
    public String nextNodeId() {
        return null;
    }

    @Override
    public NodeType nodeType() {
        return NodeType.END;
    }
}
