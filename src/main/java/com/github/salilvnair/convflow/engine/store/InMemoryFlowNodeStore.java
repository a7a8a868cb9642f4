package com.github.salilvnair.convflow.engine.store;

import com.github.salilvnair.convflow.engine.node.FlowNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry-backed store for embedded use and tests. Not registered as a bean;
 * the JPA store is the default.
 */
public class InMemoryFlowNodeStore implements FlowNodeStore {

    private final Map<String, FlowNode> nodes = new ConcurrentHashMap<>();

    public InMemoryFlowNodeStore registerNode(FlowNode node) {
        nodes.put(node.nodeId(), node);
        return this;
    }

    public InMemoryFlowNodeStore registerFlow(Collection<? extends FlowNode> flow) {
        flow.forEach(this::registerNode);
        return this;
    }

    @Override
    public Optional<FlowNode> getNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    public List<FlowNode> getFlow(String templateId) {
        Map<String, FlowNode> ordered = new LinkedHashMap<>();
        nodes.values().stream()
                .filter(node -> templateId != null && templateId.equals(node.templateId()))
                .forEach(node -> ordered.put(node.nodeId(), node));
        return new ArrayList<>(ordered.values());
    }
}
