package com.github.salilvnair.convflow.engine.queue;

import lombok.Builder;

/**
 * @param preserveOrder chain each request on the previous one so they run in list order
 */
@Builder
public record BatchOptions(boolean preserveOrder, QueuePriority priority, String batchId, boolean rollbackOnFailure) {

    public static BatchOptions defaults() {
        return BatchOptions.builder().build();
    }
}
