package com.github.salilvnair.convflow.engine.validation;

import java.util.Map;

public record RuleVerdict(
        String ruleId,
        boolean valid,
        ValidationSeverity severity,
        boolean canProceed,
        String message,
        String suggestedAction,
        Map<String, Object> details
) {

    public RuleVerdict {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static RuleVerdict pass(String ruleId, String message) {
        return new RuleVerdict(ruleId, true, ValidationSeverity.INFO, true, message, null, Map.of());
    }

    public static RuleVerdict error(String ruleId, String message, String suggestedAction) {
        return new RuleVerdict(ruleId, false, ValidationSeverity.ERROR, false, message, suggestedAction, Map.of());
    }

    public static RuleVerdict warning(String ruleId, String message, String suggestedAction, Map<String, Object> details) {
        return new RuleVerdict(ruleId, false, ValidationSeverity.WARNING, true, message, suggestedAction, details);
    }

    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }

    public boolean isWarning() {
        return severity == ValidationSeverity.WARNING;
    }
}
