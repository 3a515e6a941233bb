package com.taskgraph.engine.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.model.*;
import com.taskgraph.engine.execution.RunnerDispatcher;

/**
 * Task and custom steps: one runner invocation per attempt.
 *
 * The runner input is {@code {context, steps}} where {@code steps} maps each
 * completed upstream step to its output.
 */
public class RunnerStepDriver implements StepDriver {

    private final RunnerDispatcher dispatcher;
    private final StepOutcomes outcomes;

    public RunnerStepDriver(RunnerDispatcher dispatcher, StepOutcomes outcomes) {
        this.dispatcher = dispatcher;
        this.outcomes = outcomes;
    }

    @Override
    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        TaskType taskType;
        JsonNode config;
        if (step.config() instanceof StepConfig.TaskConfig task) {
            taskType = task.taskType();
            config = task.taskConfig();
        } else if (step.config() instanceof StepConfig.CustomConfig custom) {
            taskType = TaskType.custom(custom.handler());
            config = custom.config();
        } else {
            throw new IllegalArgumentException("Step " + step.stepId() + " does not use a runner");
        }
        dispatcher.submit(step.ref(), taskType, config, buildInput(step, graph), step.lifecycle());
    }

    private JsonNode buildInput(WorkflowStep step, WorkflowGraph graph) {
        ObjectNode input = outcomes.json().createObjectNode();
        JsonNode context = graph.workflow().context();
        input.set("context", context != null ? context : outcomes.json().createObjectNode());

        ObjectNode upstream = input.putObject("steps");
        for (DependencyEdge edge : graph.edges()) {
            if (!edge.dependent().equals(step.ref())) {
                continue;
            }
            graph.step(edge.dependsOn().nodeId())
                .filter(s -> s.status() == NodeStatus.COMPLETED)
                .ifPresent(s -> upstream.set(s.stepId(), s.lifecycle().output()));
        }
        return input;
    }
}
