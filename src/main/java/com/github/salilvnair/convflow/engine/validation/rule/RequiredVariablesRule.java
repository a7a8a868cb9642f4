package com.github.salilvnair.convflow.engine.validation.rule;

import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.validation.RuleVerdict;
import com.github.salilvnair.convflow.engine.validation.ValidationCategory;
import com.github.salilvnair.convflow.engine.validation.ValidationContext;
import com.github.salilvnair.convflow.engine.validation.ValidationPriority;
import com.github.salilvnair.convflow.engine.validation.ValidationRule;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class RequiredVariablesRule implements ValidationRule {

    public static final String ID = "required_variables";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Required variables present";
    }

    @Override
    public ValidationPriority priority() {
        return ValidationPriority.HIGH;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.DATA;
    }

    @Override
    public boolean blocking() {
        return false;
    }

    @Override
    public RuleVerdict validate(ValidationContext context) {
        FlowNode node = context.getTargetNode();
        ConversationSession session = context.getSession();
        if (node == null || session == null || node.requiredVariables().isEmpty()) {
            return RuleVerdict.pass(ID, "No required variables");
        }
        List<String> missing = node.requiredVariables().stream()
                .filter(name -> isMissing(session.getCollectedData(), name) && isMissing(session.getGlobalVars(), name))
                .collect(Collectors.toList());
        if (missing.isEmpty()) {
            return RuleVerdict.pass(ID, "All required variables present");
        }
        return RuleVerdict.warning(ID,
                "Missing required variables: " + String.join(", ", missing),
                "Collect the missing data before reaching this node",
                Map.of("missingVariables", missing));
    }

    private boolean isMissing(Map<String, Object> values, String name) {
        if (values == null) {
            return true;
        }
        Object value = values.get(name);
        return value == null || (value instanceof String text && text.isBlank());
    }
}
