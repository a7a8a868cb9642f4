package com.github.salilvnair.convflow.repo;

import com.github.salilvnair.convflow.entity.CfFlowNode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface FlowNodeRepository
        extends JpaRepository<CfFlowNode, String> {
    Optional<CfFlowNode> findByNodeIdAndEnabledTrue(String nodeId);

    List<CfFlowNode> findByTemplateIdAndEnabledTrueOrderByPriorityAsc(String templateId);
}
