package com.github.salilvnair.convflow.engine.node;

/**
 * One selectable choice of a button or list node. {@code targetNodeId} overrides the
 * owning node's default successor when present.
 */
public record ButtonOption(String id, String label, String value, String targetNodeId) {
}
