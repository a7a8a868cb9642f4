package com.github.salilvnair.convflow.engine.core;

import java.util.concurrent.CompletableFuture;

public interface ConversationOrchestrator {

    /**
     * Queues the request and completes with its response. The future never completes
     * exceptionally; failures are reported as an unsuccessful response.
     */
    CompletableFuture<NavigationResponse> submit(NavigationRequest request);

    NavigationResponse process(NavigationRequest request);
}
