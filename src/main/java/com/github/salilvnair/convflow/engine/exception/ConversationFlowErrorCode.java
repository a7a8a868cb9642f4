package com.github.salilvnair.convflow.engine.exception;

public enum ConversationFlowErrorCode {

    // =========================
    // Navigation errors
    // =========================
    NODE_NOT_FOUND(
            "Target node does not exist in the flow",
            false
    ),

    TENANT_MISMATCH(
            "Target node belongs to a different tenant",
            false
    ),

    VALIDATION_FAILED(
            "Navigation rejected by validation rules",
            false
    ),

    NAVIGATION_IN_PROGRESS(
            "Another navigation is already running for this session",
            true
    ),

    CONDITION_DEPTH_EXCEEDED(
            "Condition chain exceeded the maximum depth",
            false
    ),

    ACTION_FAILED(
            "Action node execution failed",
            true
    ),

    // =========================
    // Queue errors
    // =========================
    QUEUE_FULL(
            "Navigation queue is full",
            true
    ),

    REQUEST_TIMEOUT(
            "Navigation request timed out",
            true
    ),

    DEPENDENCY_UNRESOLVED(
            "Navigation request dependency failed or was cancelled",
            false
    ),

    REQUEST_CANCELLED(
            "Navigation request was cancelled",
            false
    ),

    // =========================
    // Session / persistence errors
    // =========================
    PERSISTENCE_UNAVAILABLE(
            "Session persistence is unavailable",
            true
    ),

    INVALID_CACHE_CONFIGURATION(
            "Session cache configuration is invalid",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal orchestrator error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ConversationFlowErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
