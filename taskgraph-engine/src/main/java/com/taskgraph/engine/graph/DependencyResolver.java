package com.taskgraph.engine.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.CycleException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.core.spi.PredicateEvaluationException;
import com.taskgraph.core.spi.PredicateEvaluator;
import com.taskgraph.engine.predicate.PredicateContexts;
import com.taskgraph.engine.resource.ResourceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decides which nodes may run, and keeps the dependency graph acyclic.
 *
 * Edge semantics (upstream must be COMPLETED, plus):
 * - COMPLETION: nothing more
 * - DATA: the upstream produced output
 * - RESOURCE: the upstream no longer holds an admission token
 * - CONDITIONAL: the edge predicate is true
 *
 * An optional edge is satisfied once its upstream is final in any state.
 * A hard edge whose upstream ended without satisfying it blocks the node.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private final GraphStore graphStore;
    private final ReachabilityIndex index;
    private final ResourceAllocator allocator;
    private final PredicateEvaluator predicateEvaluator;
    private final PredicateContexts predicateContexts;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DependencyResolver(
            GraphStore graphStore,
            ReachabilityIndex index,
            ResourceAllocator allocator,
            PredicateEvaluator predicateEvaluator,
            PredicateContexts predicateContexts,
            ObjectMapper objectMapper,
            Clock clock) {
        this.graphStore = graphStore;
        this.index = index;
        this.allocator = allocator;
        this.predicateEvaluator = predicateEvaluator;
        this.predicateContexts = predicateContexts;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ========== Edges ==========

    /**
     * Add a dependency edge after checking it.
     *
     * @return The stored edge
     * @throws ValidationException for a self edge, a cross-scope edge, a duplicate,
     *         a missing endpoint or a conditional edge without expression
     * @throws CycleException if the edge would close a cycle; nothing is stored
     */
    public synchronized DependencyEdge addEdge(DependencyEdge edge) {
        NodeRef dependent = edge.dependent();
        NodeRef dependsOn = edge.dependsOn();

        if (dependent.equals(dependsOn)) {
            throw new ValidationException("dependency", "a node cannot depend on itself: " + dependent);
        }
        if (!dependent.scope().equals(dependsOn.scope())) {
            throw new ValidationException("dependency",
                "edges cannot cross scopes: " + dependent + " -> " + dependsOn);
        }
        if (edge.type() == DependencyType.CONDITIONAL
                && (edge.conditionExpression() == null || edge.conditionExpression().isBlank())) {
            throw new ValidationException("dependency", "conditional edge requires a condition expression");
        }
        requireNode(dependent);
        requireNode(dependsOn);

        boolean duplicate = graphStore.findUpstreamEdges(dependent).stream()
            .anyMatch(e -> e.key().equals(edge.key()));
        if (duplicate) {
            throw new ValidationException("dependency", "duplicate edge " + edge.key());
        }

        ensureIndexed(edge.scope());
        if (index.wouldCreateCycle(dependent, dependsOn)) {
            throw new CycleException(dependent.key(), dependsOn.key());
        }

        graphStore.saveEdge(edge);
        index.addEdge(dependent, dependsOn);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("dependsOn", dependsOn.key());
        payload.put("type", edge.type().name());
        payload.put("optional", edge.optional());
        graphStore.appendAudit(AuditEntry.event(
            dependent.workflowId(), dependent, AuditEventType.EDGE_ADDED,
            payload, null, AuditEntry.ACTOR_USER, clock.instant()));

        log.debug("Added edge {} -> {} ({})", dependent, dependsOn, edge.type());
        return edge;
    }

    /**
     * Register edges that were created together with their nodes (loop iteration
     * clones). The caller has already stored them.
     */
    public synchronized void registerEdges(Collection<DependencyEdge> edges) {
        for (DependencyEdge edge : edges) {
            ensureIndexed(edge.scope());
            index.addEdge(edge.dependent(), edge.dependsOn());
        }
    }

    /**
     * Register structural containment for nodes added after a scope was indexed.
     *
     * @param pairs (dependent, dependsOn) pairs
     */
    public synchronized void registerStructure(String scope, Collection<Map.Entry<NodeRef, NodeRef>> pairs) {
        ensureIndexed(scope);
        for (Map.Entry<NodeRef, NodeRef> pair : pairs) {
            index.addEdge(pair.getKey(), pair.getValue());
        }
    }

    /**
     * Rebuild a scope's closure from the store, e.g. after task deletion.
     */
    public synchronized void rebuildScope(String scope) {
        index.rebuild(scope, scopeEdges(scope));
    }

    /**
     * Forget a scope's closure. It is rebuilt from the store if the scope is used again.
     */
    public synchronized void releaseScope(String scope) {
        index.dropScope(scope);
    }

    /**
     * Nodes that transitively wait on the given node.
     */
    public synchronized Set<NodeRef> downstreamOf(NodeRef node) {
        ensureIndexed(node.scope());
        return index.downstreamOf(node);
    }

    public synchronized Set<NodeRef> upstreamOf(NodeRef node) {
        ensureIndexed(node.scope());
        return index.upstreamOf(node);
    }

    private void ensureIndexed(String scope) {
        if (!index.isLoaded(scope)) {
            index.rebuild(scope, scopeEdges(scope));
        }
    }

    private List<Map.Entry<NodeRef, NodeRef>> scopeEdges(String scope) {
        List<Map.Entry<NodeRef, NodeRef>> pairs = new ArrayList<>();
        for (DependencyEdge edge : graphStore.findEdgesInScope(scope)) {
            pairs.add(new AbstractMap.SimpleImmutableEntry<>(edge.dependent(), edge.dependsOn()));
        }
        if (scope.startsWith("workflow:")) {
            UUID workflowId = UUID.fromString(scope.substring("workflow:".length()));
            pairs.addAll(structuralEdges(graphStore.findSteps(workflowId)));
        }
        return pairs;
    }

    /**
     * Implicit edges contributed by containment:
     * - a container waits on each of its children
     * - a sequential child waits on its predecessor
     * - a branch step waits on its condition
     *
     * @return (dependent, dependsOn) pairs
     */
    public static List<Map.Entry<NodeRef, NodeRef>> structuralEdges(List<WorkflowStep> steps) {
        Map<String, WorkflowStep> byId = steps.stream()
            .collect(Collectors.toMap(WorkflowStep::stepId, Function.identity()));
        List<Map.Entry<NodeRef, NodeRef>> pairs = new ArrayList<>();

        for (WorkflowStep step : steps) {
            if (step.parentStepId() == null) {
                continue;
            }
            WorkflowStep owner = byId.get(step.parentStepId());
            if (owner == null) {
                continue;
            }
            if (owner.stepType() == StepType.CONDITION) {
                pairs.add(pair(step.ref(), owner.ref()));
            } else {
                pairs.add(pair(owner.ref(), step.ref()));
            }
        }

        for (WorkflowStep step : steps) {
            if (step.config() instanceof StepConfig.SequentialConfig sequential) {
                List<String> ordered = orderedChildren(sequential.childStepIds(), byId);
                for (int i = 1; i < ordered.size(); i++) {
                    pairs.add(pair(byId.get(ordered.get(i)).ref(), byId.get(ordered.get(i - 1)).ref()));
                }
            }
        }
        return pairs;
    }

    /**
     * Children of a sequential step in execution order (step order, then listing order).
     */
    public static List<String> orderedChildren(List<String> childIds, Map<String, WorkflowStep> byId) {
        List<String> ordered = new ArrayList<>(childIds);
        ordered.removeIf(id -> !byId.containsKey(id));
        ordered.sort((a, b) -> Integer.compare(byId.get(a).stepOrder(), byId.get(b).stepOrder()));
        return ordered;
    }

    private static Map.Entry<NodeRef, NodeRef> pair(NodeRef dependent, NodeRef dependsOn) {
        return new AbstractMap.SimpleImmutableEntry<>(dependent, dependsOn);
    }

    private void requireNode(NodeRef node) {
        if (graphStore.findLifecycle(node).isEmpty()) {
            throw new NotFoundException(node.isTask() ? "Task" : "WorkflowStep", node.key());
        }
    }

    // ========== Readiness ==========

    /**
     * Evaluate a waiting workflow step against a graph snapshot.
     */
    public Readiness evaluate(WorkflowStep step, WorkflowGraph graph) {
        Map<String, WorkflowStep> byId = graph.stepsById();

        Readiness structural = evaluateStructure(step, graph, byId);
        if (!structural.isReady()) {
            return structural;
        }

        JsonNode context = graph.workflow().context();
        List<DependencyEdge> upstream = graph.edges().stream()
            .filter(e -> e.dependent().equals(step.ref()))
            .collect(Collectors.toList());
        return evaluateEdges(upstream, ref -> Optional.ofNullable(byId.get(ref.nodeId()))
            .map(WorkflowStep::lifecycle), context);
    }

    /**
     * Evaluate a waiting task against the store.
     */
    public Readiness evaluate(Task task) {
        List<DependencyEdge> upstream = graphStore.findUpstreamEdges(task.ref());
        return evaluateEdges(upstream, graphStore::findLifecycle, task.executionContext());
    }

    /**
     * Ready set of a scope: waiting nodes whose every dependency is satisfied.
     */
    public List<NodeRef> readySet(String scope) {
        if (NodeRef.TASK_SCOPE.equals(scope)) {
            return graphStore.findTasksByStatus(Set.of(NodeStatus.PENDING, NodeStatus.QUEUED)).stream()
                .filter(t -> evaluate(t).isReady())
                .map(Task::ref)
                .collect(Collectors.toList());
        }
        UUID workflowId = UUID.fromString(scope.substring("workflow:".length()));
        WorkflowGraph graph = graphStore.loadGraph(workflowId);
        return graph.steps().stream()
            .filter(s -> s.status().isWaiting())
            .filter(s -> evaluate(s, graph).isReady())
            .map(WorkflowStep::ref)
            .collect(Collectors.toList());
    }

    private Readiness evaluateStructure(WorkflowStep step, WorkflowGraph graph, Map<String, WorkflowStep> byId) {
        if (step.parentStepId() == null) {
            return Readiness.ready();
        }
        WorkflowStep owner = byId.get(step.parentStepId());
        if (owner == null) {
            return Readiness.ready();
        }
        NodeLifecycle ownerLife = owner.lifecycle();

        switch (owner.stepType()) {
            case CONDITION -> {
                if (owner.status() == NodeStatus.COMPLETED) {
                    return Readiness.ready();
                }
                return ownerLife.isFinal()
                    ? Readiness.blocked("condition " + owner.stepId() + " did not complete", owner.stepId())
                    : Readiness.waiting("condition " + owner.stepId() + " not evaluated");
            }
            case SEQUENTIAL -> {
                Readiness gate = runningOwner(owner);
                if (!gate.isReady()) {
                    return gate;
                }
                StepConfig.SequentialConfig config = (StepConfig.SequentialConfig) owner.config();
                List<String> ordered = orderedChildren(config.childStepIds(), byId);
                int position = ordered.indexOf(step.stepId());
                if (position <= 0) {
                    return Readiness.ready();
                }
                WorkflowStep predecessor = byId.get(ordered.get(position - 1));
                if (predecessor.status() == NodeStatus.COMPLETED) {
                    return Readiness.ready();
                }
                return predecessor.lifecycle().isFinal()
                    ? Readiness.blocked("predecessor " + predecessor.stepId() + " did not complete",
                        predecessor.stepId())
                    : Readiness.waiting("predecessor " + predecessor.stepId() + " in progress");
            }
            case LOOP -> {
                Readiness gate = runningOwner(owner);
                if (!gate.isReady()) {
                    return gate;
                }
                int current = graph.childrenOf(owner.stepId()).stream()
                    .mapToInt(WorkflowStep::iteration)
                    .max()
                    .orElse(1);
                return step.iteration() == current
                    ? Readiness.ready()
                    : Readiness.blocked("stale loop iteration " + step.iteration(), owner.stepId());
            }
            default -> {
                return runningOwner(owner);
            }
        }
    }

    private Readiness runningOwner(WorkflowStep owner) {
        if (owner.status() == NodeStatus.RUNNING) {
            return Readiness.ready();
        }
        if (owner.lifecycle().isFinal()) {
            return Readiness.blocked("owner " + owner.stepId() + " ended " + owner.status().wireName(),
                owner.stepId());
        }
        return Readiness.waiting("owner " + owner.stepId() + " not running");
    }

    private Readiness evaluateEdges(
            List<DependencyEdge> edges,
            Function<NodeRef, Optional<NodeLifecycle>> lifecycles,
            JsonNode context) {
        Readiness result = Readiness.ready();
        for (DependencyEdge edge : edges) {
            Optional<NodeLifecycle> upstream = lifecycles.apply(edge.dependsOn());
            if (upstream.isEmpty()) {
                // Upstream removed together with its edges; nothing to wait for
                continue;
            }
            Readiness edgeResult = evaluateEdge(edge, upstream.get(), context);
            if (edgeResult.isBlocked()) {
                return edgeResult;
            }
            if (!edgeResult.isReady()) {
                result = edgeResult;
            }
        }
        return result;
    }

    private Readiness evaluateEdge(DependencyEdge edge, NodeLifecycle upstream, JsonNode context) {
        String upstreamId = edge.dependsOn().nodeId();

        if (edge.optional()) {
            return upstream.isFinal()
                ? Readiness.ready()
                : Readiness.waiting("optional upstream " + upstreamId + " in progress");
        }
        if (upstream.status() != NodeStatus.COMPLETED) {
            return upstream.isFinal()
                ? Readiness.blocked("upstream " + upstreamId + " ended " + upstream.status().wireName(), upstreamId)
                : Readiness.waiting("upstream " + upstreamId + " in progress");
        }

        return switch (edge.type()) {
            case COMPLETION -> Readiness.ready();
            case DATA -> hasOutput(upstream.output())
                ? Readiness.ready()
                : Readiness.blocked("upstream " + upstreamId + " completed without output", upstreamId);
            case RESOURCE -> allocator.isHeld(edge.dependsOn())
                ? Readiness.waiting("upstream " + upstreamId + " still holds resources")
                : Readiness.ready();
            case CONDITIONAL -> evaluateCondition(edge, upstream, context);
        };
    }

    private Readiness evaluateCondition(DependencyEdge edge, NodeLifecycle upstream, JsonNode context) {
        String upstreamId = edge.dependsOn().nodeId();
        try {
            boolean satisfied = predicateEvaluator.evaluate(
                edge.conditionExpression(),
                predicateContexts.forEdge(upstream.output(), context));
            return satisfied
                ? Readiness.ready()
                : Readiness.blocked("condition '" + edge.conditionExpression() + "' on " + upstreamId + " is false",
                    upstreamId);
        } catch (PredicateEvaluationException e) {
            log.warn("Conditional edge {} could not be evaluated: {}", edge.key(), e.getMessage());
            return Readiness.blocked("condition on " + upstreamId + " failed: " + e.getMessage(), upstreamId);
        }
    }

    private static boolean hasOutput(JsonNode output) {
        return output != null && !output.isNull() && !output.isMissingNode();
    }
}
