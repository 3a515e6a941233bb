package com.taskgraph.core.exception;

import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.WorkflowStatus;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(NodeStatus currentState, NodeStatus targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition node from %s to %s",
            currentState, targetState
        ));
    }

    public InvalidStateTransitionException(WorkflowStatus currentState, WorkflowStatus targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition workflow from %s to %s",
            currentState, targetState
        ));
    }

    public InvalidStateTransitionException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
