package com.github.salilvnair.convflow.engine.queue;

import lombok.Builder;

@Builder
public record QueueMetrics(
        int pending,
        int waiting,
        int processing,
        int completed,
        int failed,
        long totalEnqueued,
        long totalCompleted,
        long totalFailed,
        long totalRetries,
        double averageProcessingMs,
        double averageWaitMs,
        long longestWaitMs,
        double throughputPerMinute,
        double errorRate,
        boolean paused,
        QueueHealth health
) {
}
