package com.github.salilvnair.convflow.engine.store;

import com.github.salilvnair.convflow.engine.node.FlowNode;

import java.util.List;
import java.util.Optional;

/**
 * Read access to tenant flow templates.
 */
public interface FlowNodeStore {

    Optional<FlowNode> getNode(String nodeId);

    List<FlowNode> getFlow(String templateId);
}
