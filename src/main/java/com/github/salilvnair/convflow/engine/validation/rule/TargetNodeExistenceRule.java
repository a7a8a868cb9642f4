package com.github.salilvnair.convflow.engine.validation.rule;

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
public class TargetNodeExistenceRule implements ValidationRule {

    public static final String ID = "node_exists";

    private final FlowNodeStore flowNodeStore;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Target node exists";
    }

    @Override
    public ValidationPriority priority() {
        return ValidationPriority.CRITICAL;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.STRUCTURE;
    }

    @Override
    public boolean blocking() {
        return true;
    }

    @Override
    public RuleVerdict validate(ValidationContext context) {
        boolean exists = context.getTargetNode() != null
                || flowNodeStore.getNode(context.getTargetNodeId()).isPresent();
        if (!exists) {
            return RuleVerdict.error(ID,
                    "Target node " + context.getTargetNodeId() + " does not exist",
                    "Check the flow template for a missing or disabled node");
        }
        return RuleVerdict.pass(ID, "Target node exists");
    }
}
