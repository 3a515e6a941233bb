package com.taskgraph.engine.coordinator;

import com.taskgraph.core.exception.CycleException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.*;
import com.taskgraph.engine.graph.DependencyResolver;
import com.taskgraph.engine.graph.ReachabilityIndex;
import com.taskgraph.engine.resource.ResourceAllocator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a workflow's step graph before it may run.
 *
 * Structural references (container children, branches, loop bodies) must form
 * a forest: every step is owned by at most one other step. Loop bodies are
 * leaf steps. Together with the explicit edges the graph must be acyclic.
 */
public class WorkflowValidator {

    private final ResourceAllocator allocator;

    public WorkflowValidator(ResourceAllocator allocator) {
        this.allocator = allocator;
    }

    /**
     * @throws ValidationException describing the first problem found
     * @throws CycleException if steps and edges form a cycle
     */
    public void validate(Workflow workflow, List<WorkflowStep> steps, List<DependencyEdge> edges) {
        if (workflow.name() == null || workflow.name().isBlank()) {
            throw new ValidationException("name", "workflow name is required");
        }
        if (steps.isEmpty()) {
            throw new ValidationException("steps", "workflow must have at least one step");
        }

        Map<String, WorkflowStep> byId = new HashMap<>();
        for (WorkflowStep step : steps) {
            validateStep(step);
            if (byId.putIfAbsent(step.stepId(), step) != null) {
                throw new ValidationException("steps", "duplicate step id '" + step.stepId() + "'");
            }
        }

        validateReferences(steps, byId);
        validateEdges(edges, byId);
        validateAcyclic(workflow, assignOwners(steps), edges);
    }

    private void validateStep(WorkflowStep step) {
        String id = step.stepId();
        if (id.isBlank()) {
            throw new ValidationException("stepId", "step id cannot be blank");
        }
        if (id.indexOf('#') >= 0) {
            throw new ValidationException("stepId", "'#' is reserved for loop iterations: " + id);
        }
        if (step.priority() < Task.HIGHEST_PRIORITY || step.priority() > Task.LOWEST_PRIORITY) {
            throw new ValidationException("priority", "step " + id + " priority must be in [1, 5]");
        }
        if (step.lifecycle().timeout() != null
                && (step.lifecycle().timeout().isNegative() || step.lifecycle().timeout().isZero())) {
            throw new ValidationException("timeout", "step " + id + " timeout must be positive");
        }
        List<String> exceeded = allocator.exceedsCapacity(step.resourceRequirement());
        if (!exceeded.isEmpty()) {
            throw new ValidationException("resources",
                "step " + id + " can never be admitted, exceeds capacity on " + exceeded);
        }

        StepConfig config = step.config();
        if (config instanceof StepConfig.ConditionConfig condition) {
            requireText(condition.predicate(), "predicate", id);
        } else if (config instanceof StepConfig.LoopConfig loop) {
            requireText(loop.predicate(), "predicate", id);
            requireChildren(loop.bodyStepIds(), id);
            if (loop.maxIterations() < 1) {
                throw new ValidationException("maxIterations", "loop " + id + " needs maxIterations >= 1");
            }
        } else if (config instanceof StepConfig.WaitConfig wait) {
            boolean hasCondition = wait.waitCondition() != null && !wait.waitCondition().isBlank();
            if (wait.waitDuration() == null && !hasCondition) {
                throw new ValidationException("wait", "wait step " + id + " needs a duration or a condition");
            }
            if (wait.waitDuration() != null && wait.waitDuration().isNegative()) {
                throw new ValidationException("wait", "wait step " + id + " has a negative duration");
            }
            if (step.lifecycle().timeout() != null) {
                throw new ValidationException("timeout",
                    "wait step " + id + " ends by its duration or condition and cannot have a timeout");
            }
        } else if (config instanceof StepConfig.WebhookConfig webhook) {
            requireText(webhook.callbackKey(), "callbackKey", id);
        } else if (config instanceof StepConfig.CustomConfig custom) {
            requireText(custom.handler(), "handler", id);
        } else if (config.type() == StepType.PARALLEL || config.type() == StepType.SEQUENTIAL) {
            requireChildren(config.referencedStepIds(), id);
        }
    }

    private void validateReferences(List<WorkflowStep> steps, Map<String, WorkflowStep> byId) {
        Map<String, String> owners = new HashMap<>();
        Set<String> callbackKeys = new HashSet<>();

        for (WorkflowStep step : steps) {
            for (String ref : step.config().referencedStepIds()) {
                if (ref.equals(step.stepId())) {
                    throw new ValidationException("steps", "step " + ref + " references itself");
                }
                WorkflowStep child = byId.get(ref);
                if (child == null) {
                    throw new ValidationException("steps",
                        "step " + step.stepId() + " references unknown step '" + ref + "'");
                }
                String previous = owners.putIfAbsent(ref, step.stepId());
                if (previous != null) {
                    throw new ValidationException("steps",
                        "step " + ref + " is referenced by both " + previous + " and " + step.stepId());
                }
                if (step.stepType() == StepType.LOOP && !child.stepType().isLeaf()) {
                    throw new ValidationException("steps",
                        "loop " + step.stepId() + " body step " + ref + " must be a leaf step");
                }
            }
            if (step.config() instanceof StepConfig.WebhookConfig webhook
                    && !callbackKeys.add(webhook.callbackKey())) {
                throw new ValidationException("callbackKey",
                    "callback key '" + webhook.callbackKey() + "' is used twice");
            }
        }
    }

    private void validateEdges(List<DependencyEdge> edges, Map<String, WorkflowStep> byId) {
        Set<String> keys = new HashSet<>();
        for (DependencyEdge edge : edges) {
            String dependent = edge.dependent().nodeId();
            String dependsOn = edge.dependsOn().nodeId();
            if (!byId.containsKey(dependent) || !byId.containsKey(dependsOn)) {
                throw new ValidationException("edges",
                    "edge " + dependent + " -> " + dependsOn + " names an unknown step");
            }
            if (dependent.equals(dependsOn)) {
                throw new ValidationException("edges", "step " + dependent + " cannot depend on itself");
            }
            if (edge.type() == DependencyType.CONDITIONAL
                    && (edge.conditionExpression() == null || edge.conditionExpression().isBlank())) {
                throw new ValidationException("edges",
                    "conditional edge " + dependent + " -> " + dependsOn + " needs a condition");
            }
            if (!keys.add(edge.key())) {
                throw new ValidationException("edges", "duplicate edge " + dependent + " -> " + dependsOn);
            }
        }
    }

    private void validateAcyclic(Workflow workflow, List<WorkflowStep> steps, List<DependencyEdge> edges) {
        ReachabilityIndex index = new ReachabilityIndex();
        List<Map.Entry<NodeRef, NodeRef>> pairs = new ArrayList<>(DependencyResolver.structuralEdges(steps));
        for (DependencyEdge edge : edges) {
            pairs.add(Map.entry(edge.dependent(), edge.dependsOn()));
        }
        for (Map.Entry<NodeRef, NodeRef> pair : pairs) {
            if (index.wouldCreateCycle(pair.getKey(), pair.getValue())) {
                throw new CycleException(pair.getKey().key(), pair.getValue().key());
            }
            index.addEdge(pair.getKey(), pair.getValue());
        }
    }

    /**
     * Record each step's structural owner. Loop bodies start at iteration 1.
     * Unknown references are skipped so drafts can be stored as-is.
     */
    public static List<WorkflowStep> assignOwners(List<WorkflowStep> steps) {
        Map<String, WorkflowStep> owners = new HashMap<>();
        for (WorkflowStep step : steps) {
            for (String ref : step.config().referencedStepIds()) {
                owners.putIfAbsent(ref, step);
            }
        }
        List<WorkflowStep> assigned = new ArrayList<>(steps.size());
        for (WorkflowStep step : steps) {
            WorkflowStep owner = owners.get(step.stepId());
            if (owner == null || owner.stepId().equals(step.stepId())) {
                assigned.add(step);
            } else {
                int iteration = owner.stepType() == StepType.LOOP ? 1 : 0;
                assigned.add(step.withParent(owner.stepId(), iteration));
            }
        }
        return assigned;
    }

    private static void requireText(String value, String field, String stepId) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "step " + stepId + " requires " + field);
        }
    }

    private static void requireChildren(List<String> children, String stepId) {
        if (children.isEmpty()) {
            throw new ValidationException("steps", "step " + stepId + " has no children");
        }
    }
}
