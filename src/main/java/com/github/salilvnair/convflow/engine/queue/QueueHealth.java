package com.github.salilvnair.convflow.engine.queue;

public enum QueueHealth {
    HEALTHY,
    WARNING,
    CRITICAL
}
