package com.taskgraph.engine.step;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.core.spi.PredicateEvaluationException;
import com.taskgraph.core.spi.PredicateEvaluator;
import com.taskgraph.engine.graph.DependencyResolver;
import com.taskgraph.engine.predicate.PredicateContexts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Repeats its body while the predicate holds.
 *
 * Iteration 1 runs the body steps as declared. Each later iteration runs
 * fresh clones ("id#n") together with copies of the body's edges. The
 * predicate sees the workflow variables plus {@code iteration}, the number
 * of iterations finished so far.
 */
public class LoopStepDriver implements StepDriver {

    private static final Logger log = LoggerFactory.getLogger(LoopStepDriver.class);

    private final GraphStore graphStore;
    private final DependencyResolver resolver;
    private final PredicateEvaluator evaluator;
    private final PredicateContexts contexts;
    private final StepOutcomes outcomes;

    public LoopStepDriver(
            GraphStore graphStore,
            DependencyResolver resolver,
            PredicateEvaluator evaluator,
            PredicateContexts contexts,
            StepOutcomes outcomes) {
        this.graphStore = graphStore;
        this.resolver = resolver;
        this.evaluator = evaluator;
        this.contexts = contexts;
        this.outcomes = outcomes;
    }

    @Override
    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        StepConfig.LoopConfig config = (StepConfig.LoopConfig) step.config();
        Optional<Boolean> proceed = evaluate(step, config, graph, 0);
        if (proceed.isEmpty()) {
            return;
        }
        if (!proceed.get()) {
            outcomes.cancelSubtrees(graph, config.bodyStepIds(), "loop condition false");
            outcomes.complete(step, summary(0, "condition_false", graph, step));
            return;
        }
        auditIteration(step, 1);
    }

    @Override
    public void poll(WorkflowStep step, WorkflowGraph graph) {
        StepConfig.LoopConfig config = (StepConfig.LoopConfig) step.config();
        List<WorkflowStep> bodies = graph.childrenOf(step.stepId());
        int current = currentIteration(bodies);
        List<WorkflowStep> currentBodies = bodies.stream()
            .filter(b -> b.iteration() == current)
            .collect(Collectors.toList());

        if (!currentBodies.stream().allMatch(b -> b.lifecycle().isFinal())) {
            return;
        }
        Optional<WorkflowStep> failed = currentBodies.stream()
            .filter(b -> b.status() != NodeStatus.COMPLETED)
            .findFirst();
        if (failed.isPresent()) {
            ObjectNode details = outcomes.json().createObjectNode();
            details.put("iterations", current);
            details.put("failedStep", failed.get().stepId());
            outcomes.fail(step, ErrorInfo.of(ErrorKind.UPSTREAM_FAILED,
                "loop body " + failed.get().stepId() + " ended " + failed.get().status().wireName(),
                outcomes.clock().instant()).withDetails(details));
            return;
        }

        Optional<Boolean> proceed = evaluate(step, config, graph, current);
        if (proceed.isEmpty()) {
            return;
        }
        if (!proceed.get()) {
            outcomes.complete(step, summary(current, "condition_false", graph, step));
            return;
        }
        if (current >= config.maxIterations()) {
            ObjectNode details = outcomes.json().createObjectNode();
            details.put("iterations", current);
            details.put("exit", "max_iterations_exceeded");
            outcomes.fail(step, ErrorInfo.of(ErrorKind.MAX_ITERATIONS_EXCEEDED,
                "loop still true after " + current + " iterations",
                outcomes.clock().instant()).withDetails(details));
            return;
        }
        startIteration(step, config, graph, current + 1);
    }

    private Optional<Boolean> evaluate(WorkflowStep step, StepConfig.LoopConfig config,
                                       WorkflowGraph graph, int finishedIterations) {
        Map<String, Object> variables = contexts.forWorkflow(graph);
        variables.put("iteration", finishedIterations);
        try {
            return Optional.of(evaluator.evaluate(config.predicate(), variables));
        } catch (PredicateEvaluationException e) {
            log.warn("Loop {} predicate failed: {}", step.stepId(), e.getMessage());
            outcomes.fail(step, ErrorKind.PREDICATE, e.getMessage());
            return Optional.empty();
        }
    }

    private void startIteration(WorkflowStep loop, StepConfig.LoopConfig config, WorkflowGraph graph, int iteration) {
        Instant now = outcomes.clock().instant();
        Set<String> templates = new HashSet<>(config.bodyStepIds());
        List<Map.Entry<NodeRef, NodeRef>> structure = new ArrayList<>();

        for (String templateId : config.bodyStepIds()) {
            WorkflowStep template = graph.step(templateId)
                .orElseThrow(() -> new IllegalStateException("loop body step missing: " + templateId));
            WorkflowStep clone = template.cloneForIteration(
                WorkflowStep.iterationId(templateId, iteration), iteration, now);
            graphStore.addStep(clone);
            structure.add(new AbstractMap.SimpleImmutableEntry<>(loop.ref(), clone.ref()));
        }

        List<DependencyEdge> clonedEdges = new ArrayList<>();
        for (DependencyEdge edge : graph.edges()) {
            String dependent = edge.dependent().nodeId();
            if (!templates.contains(dependent)) {
                continue;
            }
            String dependsOn = edge.dependsOn().nodeId();
            NodeRef upstream = templates.contains(dependsOn)
                ? NodeRef.step(loop.workflowId(), WorkflowStep.iterationId(dependsOn, iteration))
                : edge.dependsOn();
            DependencyEdge copy = new DependencyEdge(
                NodeRef.step(loop.workflowId(), WorkflowStep.iterationId(dependent, iteration)),
                upstream, edge.type(), edge.conditionExpression(), edge.optional(), now);
            graphStore.saveEdge(copy);
            clonedEdges.add(copy);
        }

        resolver.registerStructure(loop.ref().scope(), structure);
        resolver.registerEdges(clonedEdges);
        auditIteration(loop, iteration);
        log.info("Loop {} starting iteration {}", loop.stepId(), iteration);
    }

    private void auditIteration(WorkflowStep loop, int iteration) {
        ObjectNode payload = outcomes.json().createObjectNode();
        payload.put("iteration", iteration);
        graphStore.appendAudit(AuditEntry.event(loop.workflowId(), loop.ref(),
            AuditEventType.LOOP_ITERATION_STARTED, payload, null,
            AuditEntry.ACTOR_ORCHESTRATOR, outcomes.clock().instant()));
    }

    private ObjectNode summary(int iterations, String exit, WorkflowGraph graph, WorkflowStep loop) {
        ObjectNode output = outcomes.json().createObjectNode();
        output.put("iterations", iterations);
        output.put("exit", exit);
        ObjectNode last = output.putObject("lastIteration");
        for (WorkflowStep body : graph.childrenOf(loop.stepId())) {
            if (body.iteration() == iterations && body.status() == NodeStatus.COMPLETED) {
                last.set(WorkflowStep.templateId(body.stepId()), body.lifecycle().output());
            }
        }
        return output;
    }

    static int currentIteration(List<WorkflowStep> bodies) {
        return bodies.stream().mapToInt(WorkflowStep::iteration).max().orElse(1);
    }
}
