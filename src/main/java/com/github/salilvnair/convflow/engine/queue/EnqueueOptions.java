package com.github.salilvnair.convflow.engine.queue;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder(toBuilder = true)
public record EnqueueOptions(
        QueuePriority priority,
        List<String> dependencies,
        Instant scheduledAt,
        String batchId,
        Integer maxRetries,
        boolean rollbackOnFailure
) {

    public static EnqueueOptions defaults() {
        return EnqueueOptions.builder().build();
    }
}
