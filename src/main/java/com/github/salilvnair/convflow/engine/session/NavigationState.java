package com.github.salilvnair.convflow.engine.session;

public enum NavigationState {
    IDLE,
    AWAITING_VALIDATION,
    AWAITING_INPUT,
    ADVANCING,
    TERMINAL
}
