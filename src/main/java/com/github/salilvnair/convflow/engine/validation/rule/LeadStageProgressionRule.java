package com.github.salilvnair.convflow.engine.validation.rule;

import com.github.salilvnair.convflow.engine.navigation.action.UpdateStageActionHandler;
import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.validation.RuleVerdict;
import com.github.salilvnair.convflow.engine.validation.ValidationCategory;
import com.github.salilvnair.convflow.engine.validation.ValidationContext;
import com.github.salilvnair.convflow.engine.validation.ValidationPriority;
import com.github.salilvnair.convflow.engine.validation.ValidationRule;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flags transitions into a node whose funnel stage the lead already sits in.
 * Advisory only; never blocks.
 */
@Component
public class LeadStageProgressionRule implements ValidationRule {

    public static final String ID = "lead_progression_integrity";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Lead stage progression";
    }

    @Override
    public ValidationPriority priority() {
        return ValidationPriority.CRITICAL;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.LEADS;
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public RuleVerdict validate(ValidationContext context) {
        FlowNode node = context.getTargetNode();
        ConversationSession session = context.getSession();
        if (node == null || node.stageId() == null || session == null || session.getGlobalVars() == null) {
            return RuleVerdict.pass(ID, "Lead integrity preserved");
        }
        Object currentStage = session.getGlobalVars().get(UpdateStageActionHandler.STAGE_VARIABLE);
        if (node.stageId().equals(currentStage)) {
            return RuleVerdict.warning(ID,
                    "Lead is already in stage " + node.stageId(),
                    "Verify the lead progression logic",
                    Map.of("currentStage", currentStage, "targetStage", node.stageId()));
        }
        return RuleVerdict.pass(ID, "Lead integrity preserved");
    }
}
