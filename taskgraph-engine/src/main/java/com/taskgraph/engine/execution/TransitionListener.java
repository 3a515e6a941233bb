package com.taskgraph.engine.execution;

import com.taskgraph.core.model.NodeLifecycle;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.model.NodeStatus;

/**
 * Notified after a node transition has been stored.
 */
@FunctionalInterface
public interface TransitionListener {

    void onTransition(NodeRef node, NodeStatus from, NodeLifecycle lifecycle);

    /**
     * Whether the transition took the node out of active execution
     * (RUNNING to anything but PAUSED, or PAUSED to a terminal state).
     */
    static boolean leftExecution(NodeStatus from, NodeLifecycle lifecycle) {
        NodeStatus to = lifecycle.status();
        return (from == NodeStatus.RUNNING && to != NodeStatus.PAUSED)
            || (from == NodeStatus.PAUSED && to != NodeStatus.RUNNING);
    }
}
