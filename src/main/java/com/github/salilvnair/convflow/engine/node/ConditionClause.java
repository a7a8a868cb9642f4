package com.github.salilvnair.convflow.engine.node;

public record ConditionClause(String field, ConditionOperator operator, Object value, String targetNodeId) {
}
