package com.taskgraph.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Snapshot of a workflow with its steps and step edges, as loaded from the store.
 */
public record WorkflowGraph(
    Workflow workflow,
    List<WorkflowStep> steps,
    List<DependencyEdge> edges
) {
    public WorkflowGraph {
        steps = List.copyOf(steps);
        edges = List.copyOf(edges);
    }

    public Map<String, WorkflowStep> stepsById() {
        return steps.stream().collect(Collectors.toMap(WorkflowStep::stepId, Function.identity()));
    }

    public Optional<WorkflowStep> step(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    /**
     * Children of a structural owner, ordered by step order.
     */
    public List<WorkflowStep> childrenOf(String parentStepId) {
        return steps.stream()
            .filter(s -> parentStepId.equals(s.parentStepId()))
            .sorted((a, b) -> Integer.compare(a.stepOrder(), b.stepOrder()))
            .collect(Collectors.toList());
    }

    public boolean allStepsFinal() {
        return steps.stream().allMatch(s -> s.lifecycle().isFinal());
    }
}
