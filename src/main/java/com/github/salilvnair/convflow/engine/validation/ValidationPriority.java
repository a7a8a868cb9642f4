package com.github.salilvnair.convflow.engine.validation;

public enum ValidationPriority {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    ValidationPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
