package com.github.salilvnair.convflow.engine.node;

import lombok.Builder;

import java.util.List;

@Builder
public record ButtonNode(
        String nodeId,
        String tenantId,
        String templateId,
        String prompt,
        List<ButtonOption> options,
        String nextNodeId,
        List<String> requiredVariables,
        String stageId
) implements OptionNode {

    public ButtonNode {
        options = options == null ? List.of() : List.copyOf(options);
        requiredVariables = FlowNode.normalize(requiredVariables);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.BUTTON;
    }
}
