package com.taskgraph.engine.step;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.model.ErrorInfo;
import com.taskgraph.core.model.ErrorKind;
import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Opens all children at once and completes when every child has ended.
 * A child that failed for good fails the parallel step; cancelled children do not.
 */
public class ParallelStepDriver implements StepDriver {

    private final StepOutcomes outcomes;

    public ParallelStepDriver(StepOutcomes outcomes) {
        this.outcomes = outcomes;
    }

    @Override
    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        // children become ready once this step is RUNNING
    }

    @Override
    public void poll(WorkflowStep step, WorkflowGraph graph) {
        List<WorkflowStep> children = graph.childrenOf(step.stepId());
        if (!children.stream().allMatch(c -> c.lifecycle().isFinal())) {
            return;
        }

        List<String> failed = children.stream()
            .filter(c -> c.lifecycle().isFinalFailure())
            .map(WorkflowStep::stepId)
            .collect(Collectors.toList());
        if (!failed.isEmpty()) {
            ObjectNode details = outcomes.json().createObjectNode();
            details.putPOJO("failedSteps", failed);
            outcomes.fail(step, ErrorInfo.of(ErrorKind.UPSTREAM_FAILED,
                "parallel branches failed: " + failed, outcomes.clock().instant()).withDetails(details));
            return;
        }

        ObjectNode output = outcomes.json().createObjectNode();
        for (WorkflowStep child : children) {
            if (child.status() == NodeStatus.COMPLETED) {
                output.set(child.stepId(), child.lifecycle().output());
            }
        }
        outcomes.complete(step, output);
    }
}
