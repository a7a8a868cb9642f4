package com.github.salilvnair.convflow.engine.queue;

public interface QueueCompletionListener {

    void onCompleted(QueuedNavigationRequest request);

    void onFailed(QueuedNavigationRequest request);
}
