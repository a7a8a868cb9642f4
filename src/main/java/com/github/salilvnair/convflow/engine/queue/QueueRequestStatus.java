package com.github.salilvnair.convflow.engine.queue;

public enum QueueRequestStatus {
    /** Eligible once its scheduled time has passed. */
    PENDING,
    /** Pending, but blocked on unfinished dependencies. */
    WAITING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
