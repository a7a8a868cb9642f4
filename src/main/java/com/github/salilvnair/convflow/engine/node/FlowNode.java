package com.github.salilvnair.convflow.engine.node;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A single step of a tenant flow template. Nodes are immutable for a given
 * template version and are stored as JSON with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageNode.class, name = "message"),
        @JsonSubTypes.Type(value = InputNode.class, name = "input"),
        @JsonSubTypes.Type(value = ButtonNode.class, name = "button"),
        @JsonSubTypes.Type(value = ListNode.class, name = "list"),
        @JsonSubTypes.Type(value = ConditionNode.class, name = "condition"),
        @JsonSubTypes.Type(value = ActionNode.class, name = "action"),
        @JsonSubTypes.Type(value = EndNode.class, name = "end")
})
public sealed interface FlowNode
        permits MessageNode, InputNode, OptionNode, ConditionNode, ActionNode, EndNode {

    String nodeId();

    String tenantId();

    String templateId();

    /** Default successor, {@code null} when the node has none. */
    String nextNodeId();

    List<String> requiredVariables();

    /** Lead/funnel stage this node maps to, if any. */
    String stageId();

    NodeType nodeType();

    static List<String> normalize(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
