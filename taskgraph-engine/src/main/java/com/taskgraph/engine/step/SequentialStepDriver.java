package com.taskgraph.engine.step;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.model.ErrorInfo;
import com.taskgraph.core.model.ErrorKind;
import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.StepConfig;
import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;
import com.taskgraph.engine.graph.DependencyResolver;

import java.util.List;
import java.util.Map;

/**
 * Runs children one after another. The first child that ends without
 * completing cancels the rest and fails the sequence.
 */
public class SequentialStepDriver implements StepDriver {

    private final StepOutcomes outcomes;

    public SequentialStepDriver(StepOutcomes outcomes) {
        this.outcomes = outcomes;
    }

    @Override
    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        // first child becomes ready once this step is RUNNING
    }

    @Override
    public void poll(WorkflowStep step, WorkflowGraph graph) {
        StepConfig.SequentialConfig config = (StepConfig.SequentialConfig) step.config();
        Map<String, WorkflowStep> byId = graph.stepsById();
        List<String> ordered = DependencyResolver.orderedChildren(config.childStepIds(), byId);

        ObjectNode output = outcomes.json().createObjectNode();
        for (int i = 0; i < ordered.size(); i++) {
            WorkflowStep child = byId.get(ordered.get(i));
            if (child.status() == NodeStatus.COMPLETED) {
                output.set(child.stepId(), child.lifecycle().output());
                continue;
            }
            if (!child.lifecycle().isFinal()) {
                return;
            }
            outcomes.cancelSubtrees(graph, ordered.subList(i + 1, ordered.size()),
                "sequence stopped at " + child.stepId());
            ObjectNode details = outcomes.json().createObjectNode();
            details.put("failedStep", child.stepId());
            details.put("position", i);
            outcomes.fail(step, ErrorInfo.of(ErrorKind.UPSTREAM_FAILED,
                "sequence child " + child.stepId() + " ended " + child.status().wireName(),
                outcomes.clock().instant()).withDetails(details));
            return;
        }

        outcomes.complete(step, output);
    }
}
