package com.github.salilvnair.convflow.engine.queue;

import com.github.salilvnair.convflow.engine.navigation.NavigationResult;

/**
 * Executes a dequeued request. A result with {@code success == false} or a thrown exception
 * counts as a failed attempt.
 */
public interface NavigationRequestProcessor {

    NavigationResult process(QueuedNavigationRequest request);

    /** Invoked once after the final failed attempt when the request asked for rollback. */
    default void rollback(QueuedNavigationRequest request) {
    }
}
