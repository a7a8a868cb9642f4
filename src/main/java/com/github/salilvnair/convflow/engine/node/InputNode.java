package com.github.salilvnair.convflow.engine.node;

import lombok.Builder;

import java.util.List;

@Builder
public record InputNode(
        String nodeId,
        String tenantId,
        String templateId,
        String prompt,
        String placeholder,
        String variableName,
        String inputType,
        List<InputValidationRule> validation,
        String nextNodeId,
        List<String> requiredVariables,
        String stageId
) implements FlowNode {

    public InputNode {
        validation = validation == null ? List.of() : List.copyOf(validation);
        requiredVariables = FlowNode.normalize(requiredVariables);
        if (inputType == null || inputType.isBlank()) {
            inputType = "text";
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.INPUT;
    }
}
