package com.github.salilvnair.convflow.engine.node;

/**
 * Validation hint attached to an input node, e.g. {@code required}, {@code email},
 * {@code phone}, {@code min_length}, {@code max_length}.
 */
public record InputValidationRule(String type, Object value, String message) {
}
