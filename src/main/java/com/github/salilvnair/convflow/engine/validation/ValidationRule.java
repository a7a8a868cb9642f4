package com.github.salilvnair.convflow.engine.validation;

/**
 * A single check run by the {@link ValidationGate} before a transition is committed.
 * Implementations registered as Spring beans are picked up automatically.
 */
public interface ValidationRule {

    String id();

    String name();

    ValidationPriority priority();

    ValidationCategory category();

    /** A failing blocking rule stops further evaluation in strict mode. */
    boolean blocking();

    RuleVerdict validate(ValidationContext context);
}
