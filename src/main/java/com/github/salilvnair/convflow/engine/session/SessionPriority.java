package com.github.salilvnair.convflow.engine.session;

public enum SessionPriority {
    LOW(0.5, 1),
    NORMAL(1.0, 2),
    HIGH(1.5, 3),
    CRITICAL(2.0, 4);

    private final double ttlMultiplier;
    private final int rank;

    SessionPriority(double ttlMultiplier, int rank) {
        this.ttlMultiplier = ttlMultiplier;
        this.rank = rank;
    }

    public double ttlMultiplier() {
        return ttlMultiplier;
    }

    public int rank() {
        return rank;
    }
}
