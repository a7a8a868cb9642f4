package com.github.salilvnair.convflow.engine.node;

import lombok.Builder;

import java.util.List;

/**
 * Routes to the target of the first matching clause, otherwise to {@link #nextNodeId()}.
 */
@Builder
public record ConditionNode(
        String nodeId,
        String tenantId,
        String templateId,
        List<ConditionClause> clauses,
        String nextNodeId,
        List<String> requiredVariables,
        String stageId
) implements FlowNode {

    public ConditionNode {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
        requiredVariables = FlowNode.normalize(requiredVariables);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.CONDITION;
    }
}
