package com.github.salilvnair.convflow.engine.validation;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Builder(toBuilder = true)
public record ValidationReport(
        boolean valid,
        boolean canProceed,
        ValidationSeverity overallSeverity,
        List<RuleVerdict> verdicts,
        int rulesExecuted,
        List<String> recommendations,
        Instant evaluatedAt,
        boolean fromCache
) {

    public ValidationReport {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public List<RuleVerdict> errors() {
        return verdicts.stream().filter(RuleVerdict::isError).collect(Collectors.toList());
    }

    public List<RuleVerdict> warnings() {
        return verdicts.stream().filter(RuleVerdict::isWarning).collect(Collectors.toList());
    }

    /** Messages of every verdict that did not pass, errors first. */
    public List<String> violationMessages() {
        return verdicts.stream()
                .filter(verdict -> !verdict.valid() || !verdict.canProceed())
                .sorted((a, b) -> Boolean.compare(b.isError(), a.isError()))
                .map(RuleVerdict::message)
                .collect(Collectors.toList());
    }
}
