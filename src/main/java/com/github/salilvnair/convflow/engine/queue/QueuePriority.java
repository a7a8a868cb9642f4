package com.github.salilvnair.convflow.engine.queue;

public enum QueuePriority {
    IMMEDIATE(5),
    CRITICAL(4),
    HIGH(3),
    NORMAL(2),
    LOW(1);

    private final int weight;

    QueuePriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
