package com.taskgraph.engine.step;

import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;

/**
 * Type-specific behaviour of a workflow step.
 *
 * {@link #dispatch} runs once, right after the step entered RUNNING.
 * {@link #poll} runs on every scheduler tick while the step is RUNNING and
 * decides whether the step is done.
 */
public interface StepDriver {

    void dispatch(WorkflowStep step, WorkflowGraph graph);

    default void poll(WorkflowStep step, WorkflowGraph graph) {
        // completed from outside (runner, webhook, timer)
    }
}
