package com.github.salilvnair.convflow.engine.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionOperator {
    EQUALS("eq"),
    NOT_EQUALS("neq"),
    GREATER_THAN("gt"),
    LESS_THAN("lt"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Unknown codes map to {@code null} so the clause evaluates to false. */
    @JsonCreator
    public static ConditionOperator fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ConditionOperator operator : values()) {
            if (operator.code.equalsIgnoreCase(code.trim()) || operator.name().equalsIgnoreCase(code.trim())) {
                return operator;
            }
        }
        return null;
    }
}
