package com.github.salilvnair.convflow.service;

import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.store.FlowNodeStore;
import com.github.salilvnair.convflow.entity.CfFlowNode;
import com.github.salilvnair.convflow.repo.FlowNodeRepository;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaFlowNodeStore implements FlowNodeStore {

    private final FlowNodeRepository flowNodeRepository;

    @Override
    @Cacheable(value = "cf_flow_node", key = "#p0", unless = "#result == null")
    public Optional<FlowNode> getNode(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            return Optional.empty();
        }
        return flowNodeRepository.findByNodeIdAndEnabledTrue(nodeId).flatMap(this::toNode);
    }

    @Override
    @Cacheable(value = "cf_flow", key = "#p0")
    public List<FlowNode> getFlow(String templateId) {
        List<FlowNode> flow = new ArrayList<>();
        for (CfFlowNode row : flowNodeRepository.findByTemplateIdAndEnabledTrueOrderByPriorityAsc(templateId)) {
            toNode(row).ifPresent(flow::add);
        }
        return flow;
    }

    private Optional<FlowNode> toNode(CfFlowNode row) {
        try {
            return Optional.of(JsonUtil.fromJson(row.getNodeJson(), FlowNode.class));
        }
        catch (IllegalStateException e) {
            log.warn("Skipping unreadable flow node nodeId={} templateId={} type={}: {}",
                    row.getNodeId(), row.getTemplateId(), row.getNodeType(), e.getMessage());
            return Optional.empty();
        }
    }
}
