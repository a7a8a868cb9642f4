package com.github.salilvnair.convflow.cache;

import com.github.salilvnair.convflow.engine.node.ConditionOperator;

/**
 * Multiplies a policy's base TTL by {@code ttlModifier} when the session field at
 * {@code field} (dotted path, e.g. {@code collectedData.plan}) satisfies the operator.
 */
public record TtlCondition(String field, ConditionOperator operator, Object value, double ttlModifier) {
}
