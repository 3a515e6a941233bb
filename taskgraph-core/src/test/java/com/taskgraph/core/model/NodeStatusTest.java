package com.taskgraph.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class NodeStatusTest {

    @Test
    void pending_shouldOnlyMoveToQueuedOrCancelled() {
        assertTrue(NodeStatus.PENDING.canTransitionTo(NodeStatus.QUEUED));
        assertTrue(NodeStatus.PENDING.canTransitionTo(NodeStatus.CANCELLED));
        assertFalse(NodeStatus.PENDING.canTransitionTo(NodeStatus.RUNNING));
        assertFalse(NodeStatus.PENDING.canTransitionTo(NodeStatus.COMPLETED));
    }

    @Test
    void running_canCompleteFailCancelOrPause() {
        assertTrue(NodeStatus.RUNNING.canTransitionTo(NodeStatus.COMPLETED));
        assertTrue(NodeStatus.RUNNING.canTransitionTo(NodeStatus.FAILED));
        assertTrue(NodeStatus.RUNNING.canTransitionTo(NodeStatus.CANCELLED));
        assertTrue(NodeStatus.RUNNING.canTransitionTo(NodeStatus.PAUSED));
        assertFalse(NodeStatus.RUNNING.canTransitionTo(NodeStatus.QUEUED));
    }

    @Test
    void failed_canOnlyMoveToRetrying() {
        for (NodeStatus target : NodeStatus.values()) {
            assertEquals(target == NodeStatus.RETRYING, NodeStatus.FAILED.canTransitionTo(target),
                "FAILED -> " + target);
        }
    }

    @Test
    void retrying_shouldRequeueOrCancel() {
        assertTrue(NodeStatus.RETRYING.canTransitionTo(NodeStatus.QUEUED));
        assertTrue(NodeStatus.RETRYING.canTransitionTo(NodeStatus.CANCELLED));
        assertFalse(NodeStatus.RETRYING.canTransitionTo(NodeStatus.RUNNING));
    }

    @Test
    void completedAndCancelled_shouldBeDeadEnds() {
        for (NodeStatus target : NodeStatus.values()) {
            assertFalse(NodeStatus.COMPLETED.canTransitionTo(target));
            assertFalse(NodeStatus.CANCELLED.canTransitionTo(target));
        }
    }

    @Test
    void cancelled_shouldBeReachableFromEveryNonTerminalState() {
        for (NodeStatus status : NodeStatus.values()) {
            if (!status.isTerminal()) {
                assertTrue(status.canTransitionTo(NodeStatus.CANCELLED), status + " -> CANCELLED");
            }
        }
    }

    @Test
    void terminalStates() {
        assertTrue(NodeStatus.COMPLETED.isTerminal());
        assertTrue(NodeStatus.FAILED.isTerminal());
        assertTrue(NodeStatus.CANCELLED.isTerminal());
        assertFalse(NodeStatus.RETRYING.isTerminal());
        assertFalse(NodeStatus.PAUSED.isTerminal());
    }
}
