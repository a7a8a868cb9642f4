package com.github.salilvnair.convflow.engine.node;

public enum NodeType {
    MESSAGE,
    INPUT,
    BUTTON,
    LIST,
    CONDITION,
    ACTION,
    END;

    /** Nodes of these types park the session until the user replies. */
    public boolean waitsForInput() {
        return this == INPUT || this == BUTTON || this == LIST;
    }
}
