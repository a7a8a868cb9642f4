package com.github.salilvnair.convflow.engine.session;

public enum NavigationType {
    FORWARD,
    BACKWARD,
    JUMP,
    CONDITIONAL,
    RESET
}
