package com.github.salilvnair.convflow.engine.validation.rule;

import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.store.FlowNodeStore;
import com.github.salilvnair.convflow.engine.validation.RuleVerdict;
import com.github.salilvnair.convflow.engine.validation.ValidationCategory;
import com.github.salilvnair.convflow.engine.validation.ValidationContext;
import com.github.salilvnair.convflow.engine.validation.ValidationPriority;
import com.github.salilvnair.convflow.engine.validation.ValidationRule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TenantIsolationRule implements ValidationRule {

    public static final String ID = "tenant_isolation";

    private final FlowNodeStore flowNodeStore;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Tenant isolation";
    }

    @Override
    public ValidationPriority priority() {
        return ValidationPriority.CRITICAL;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.SECURITY;
    }

    @Override
    public boolean blocking() {
        return true;
    }

    @Override
    public RuleVerdict validate(ValidationContext context) {
        FlowNode node = context.getTargetNode() != null
                ? context.getTargetNode()
                : flowNodeStore.getNode(context.getTargetNodeId()).orElse(null);
        if (node == null || node.tenantId() == null || context.tenantId() == null) {
            return RuleVerdict.pass(ID, "No tenant boundary to check");
        }
        if (!node.tenantId().equals(context.tenantId())) {
            return RuleVerdict.error(ID,
                    "Node " + node.nodeId() + " belongs to a different tenant",
                    "Verify the flow template is assigned to this tenant");
        }
        return RuleVerdict.pass(ID, "Tenant isolation preserved");
    }
}
