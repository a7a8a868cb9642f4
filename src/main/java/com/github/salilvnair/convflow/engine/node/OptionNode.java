package com.github.salilvnair.convflow.engine.node;

import java.util.List;

/**
 * Node that presents a fixed set of choices and waits for the user to pick one.
 */
public sealed interface OptionNode extends FlowNode permits ButtonNode, ListNode {

    String prompt();

    List<ButtonOption> options();
}
