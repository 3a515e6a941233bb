package com.taskgraph.engine.coordinator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.*;
import com.taskgraph.core.repository.AuditRepository;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.graph.DependencyResolver;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.OrchestratorMetrics;
import com.taskgraph.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Owns the workflow state machine.
 *
 * Node dispatch is the scheduler loop's job; this class creates and validates
 * workflows, applies lifecycle commands, and decides when a workflow has
 * completed, failed or timed out.
 */
public class WorkflowOrchestrator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private static final int MAX_UPDATE_ATTEMPTS = 5;
    public static final Duration DEFAULT_WEBHOOK_TIMEOUT = Duration.ofHours(24);
    private static final Set<WorkflowStatus> ACTIVE = EnumSet.of(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED);

    private final GraphStore graphStore;
    private final AuditRepository auditRepository;
    private final WorkflowValidator validator;
    private final DependencyResolver resolver;
    private final NodeTransitioner transitioner;
    private final OrchestratorMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration webhookTimeout;

    public WorkflowOrchestrator(
            GraphStore graphStore,
            AuditRepository auditRepository,
            WorkflowValidator validator,
            DependencyResolver resolver,
            NodeTransitioner transitioner,
            OrchestratorMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this(graphStore, auditRepository, validator, resolver, transitioner, metrics, objectMapper, clock,
            DEFAULT_WEBHOOK_TIMEOUT);
    }

    /**
     * @param webhookTimeout Timeout given to webhook steps that do not declare one
     */
    public WorkflowOrchestrator(
            GraphStore graphStore,
            AuditRepository auditRepository,
            WorkflowValidator validator,
            DependencyResolver resolver,
            NodeTransitioner transitioner,
            OrchestratorMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock,
            Duration webhookTimeout) {
        this.graphStore = graphStore;
        this.auditRepository = auditRepository;
        this.validator = validator;
        this.resolver = resolver;
        this.transitioner = transitioner;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webhookTimeout = webhookTimeout;
    }

    // ========== Creation ==========

    @Override
    public Workflow createWorkflow(CreateWorkflowRequest request) {
        Workflow draft = buildWorkflow(request);
        List<WorkflowStep> steps = buildSteps(draft.id(), request.steps());
        List<DependencyEdge> edges = buildEdges(draft.id(), request.edges());

        validator.validate(draft, steps, edges);
        Workflow stored = store(draft, steps, edges);
        return updateStatus(stored.id(), WorkflowStatus.READY, UnaryOperator.identity(),
            "validated", AuditEntry.ACTOR_ORCHESTRATOR);
    }

    @Override
    public Workflow saveDraft(CreateWorkflowRequest request) {
        Workflow draft = buildWorkflow(request);
        return store(draft, buildSteps(draft.id(), request.steps()), buildEdges(draft.id(), request.edges()));
    }

    @Override
    public Workflow validateWorkflow(UUID workflowId) {
        WorkflowGraph graph = graphStore.loadGraph(workflowId);
        if (graph.workflow().status() != WorkflowStatus.DRAFT) {
            throw new InvalidStateTransitionException(graph.workflow().status(), WorkflowStatus.READY);
        }
        validator.validate(graph.workflow(), graph.steps(), graph.edges());
        return updateStatus(workflowId, WorkflowStatus.READY, UnaryOperator.identity(),
            "validated", AuditEntry.ACTOR_ORCHESTRATOR);
    }

    private Workflow store(Workflow draft, List<WorkflowStep> steps, List<DependencyEdge> edges) {
        graphStore.saveWorkflow(draft, WorkflowValidator.assignOwners(steps));
        edges.forEach(graphStore::saveEdge);
        graphStore.appendAudit(AuditEntry.workflowTransition(draft.id(), null, WorkflowStatus.DRAFT,
            "created", AuditEntry.ACTOR_USER, clock.instant()));
        log.info("Stored workflow {} '{}' v{} with {} steps and {} edges",
            draft.id(), draft.name(), draft.version(), steps.size(), edges.size());
        return draft;
    }

    private Workflow buildWorkflow(CreateWorkflowRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name", "workflow name is required");
        }
        int maxParallel = request.maxParallelSteps() != null
            ? request.maxParallelSteps() : Workflow.DEFAULT_MAX_PARALLEL_STEPS;
        if (maxParallel < 1) {
            throw new ValidationException("maxParallelSteps", "must be >= 1");
        }
        if (request.timeout() != null && (request.timeout().isNegative() || request.timeout().isZero())) {
            throw new ValidationException("timeout", "workflow timeout must be positive");
        }
        return Workflow.builder()
            .name(request.name())
            .version(graphStore.nextWorkflowVersion(request.name()))
            .description(request.description())
            .maxParallelSteps(maxParallel)
            .timeout(request.timeout())
            .retryFailedSteps(request.retryFailedSteps() == null || request.retryFailedSteps())
            .context(request.context() != null ? request.context() : objectMapper.createObjectNode())
            .createdBy(request.createdBy())
            .createdAt(clock.instant())
            .build();
    }

    private List<WorkflowStep> buildSteps(UUID workflowId, List<StepDefinition> definitions) {
        Instant now = clock.instant();
        List<WorkflowStep> steps = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            StepDefinition definition = definitions.get(i);
            if (definition.stepId() == null) {
                throw new ValidationException("stepId", "step " + i + " has no id");
            }
            if (definition.config() == null) {
                throw new ValidationException("config", "step " + definition.stepId() + " has no configuration");
            }
            try {
                steps.add(WorkflowStep.builder()
                    .workflowId(workflowId)
                    .stepId(definition.stepId())
                    .name(definition.name())
                    .config(definition.config())
                    .stepOrder(definition.stepOrder() != null ? definition.stepOrder() : i)
                    .priority(definition.priority() != null ? definition.priority() : Task.DEFAULT_PRIORITY)
                    .maxRetries(definition.maxRetries() != null ? definition.maxRetries() : 0)
                    .timeout(stepTimeout(definition))
                    .deadline(definition.deadline())
                    .resourceRequirement(definition.resources())
                    .createdAt(now)
                    .build());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("steps", "step " + definition.stepId() + ": " + e.getMessage());
            }
        }
        return steps;
    }

    // webhook waits are always bounded
    private Duration stepTimeout(StepDefinition definition) {
        if (definition.timeout() == null && definition.config().type() == StepType.WEBHOOK) {
            return webhookTimeout;
        }
        return definition.timeout();
    }

    private List<DependencyEdge> buildEdges(UUID workflowId, List<EdgeDefinition> definitions) {
        Instant now = clock.instant();
        List<DependencyEdge> edges = new ArrayList<>(definitions.size());
        for (EdgeDefinition definition : definitions) {
            if (definition.stepId() == null || definition.dependsOn() == null) {
                throw new ValidationException("edges", "edge endpoints are required");
            }
            edges.add(new DependencyEdge(
                NodeRef.step(workflowId, definition.stepId()),
                NodeRef.step(workflowId, definition.dependsOn()),
                definition.type() != null ? definition.type() : DependencyType.COMPLETION,
                definition.condition(),
                definition.optional(),
                now));
        }
        return edges;
    }

    // ========== Lifecycle commands ==========

    @Override
    public Workflow startWorkflow(UUID workflowId) {
        try (LoggingContext ignored = LoggingContext.forWorkflow(workflowId)) {
            Instant now = clock.instant();
            return updateStatus(workflowId, WorkflowStatus.RUNNING, b -> b.startedAt(now),
                "started", AuditEntry.ACTOR_USER);
        }
    }

    @Override
    public Workflow pauseWorkflow(UUID workflowId, String reason) {
        try (LoggingContext ignored = LoggingContext.forWorkflow(workflowId)) {
            Workflow paused = updateStatus(workflowId, WorkflowStatus.PAUSED, UnaryOperator.identity(),
                reason, AuditEntry.ACTOR_USER);
            for (WorkflowStep step : graphStore.findSteps(workflowId)) {
                if (step.stepType() == StepType.WAIT && step.status() == NodeStatus.RUNNING) {
                    transitioner.transition(step.ref(), NodeStatus.RUNNING, NodeStatus.PAUSED,
                        TransitionPayload.by(AuditEntry.ACTOR_ORCHESTRATOR).withReason("workflow paused"));
                }
            }
            return paused;
        }
    }

    @Override
    public Workflow resumeWorkflow(UUID workflowId) {
        try (LoggingContext ignored = LoggingContext.forWorkflow(workflowId)) {
            Workflow resumed = updateStatus(workflowId, WorkflowStatus.RUNNING, UnaryOperator.identity(),
                "resumed", AuditEntry.ACTOR_USER);
            for (WorkflowStep step : graphStore.findSteps(workflowId)) {
                if (step.status() == NodeStatus.PAUSED) {
                    transitioner.transition(step.ref(), NodeStatus.PAUSED, NodeStatus.RUNNING,
                        TransitionPayload.by(AuditEntry.ACTOR_ORCHESTRATOR).withReason("workflow resumed"));
                }
            }
            return resumed;
        }
    }

    @Override
    public Workflow cancelWorkflow(UUID workflowId, String reason) {
        try (LoggingContext ignored = LoggingContext.forWorkflow(workflowId)) {
            Instant now = clock.instant();
            ErrorInfo error = ErrorInfo.of(ErrorKind.CANCELLED,
                reason != null ? reason : "workflow cancelled", now);
            Workflow cancelled = updateStatus(workflowId, WorkflowStatus.CANCELLED,
                b -> b.completedAt(now).error(error), reason, AuditEntry.ACTOR_USER);
            int nodes = cancelRemaining(workflowId, error);
            log.info("Cancelled workflow {} ({} nodes cancelled)", workflowId, nodes);
            return cancelled;
        }
    }

    private int cancelRemaining(UUID workflowId, ErrorInfo error) {
        int cancelled = 0;
        for (WorkflowStep step : graphStore.findSteps(workflowId)) {
            if (transitioner.cancel(step.ref(), step.lifecycle(), error, AuditEntry.ACTOR_ORCHESTRATOR)) {
                cancelled++;
            }
        }
        for (Task task : graphStore.findTasksByWorkflow(workflowId)) {
            if (transitioner.cancel(task.ref(), task.lifecycle(), error, AuditEntry.ACTOR_ORCHESTRATOR)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    // ========== Queries ==========

    @Override
    public WorkflowStatusView getStatus(UUID workflowId) {
        WorkflowGraph graph = graphStore.loadGraph(workflowId);
        List<WorkflowStep> steps = graph.steps();
        long finished = steps.stream().filter(s -> s.lifecycle().isFinal()).count();
        double progress = steps.isEmpty() ? 0.0 : Math.round(finished * 1000.0 / steps.size()) / 10.0;

        return new WorkflowStatusView(
            graph.workflow(),
            steps,
            graphStore.findTasksByWorkflow(workflowId),
            progress,
            graph.workflow().rootCauseStepId(),
            auditRepository.findByWorkflow(workflowId));
    }

    @Override
    public List<Workflow> getActiveWorkflows() {
        return graphStore.findWorkflowsByStatus(ACTIVE);
    }

    // ========== Completion and timeouts ==========

    /**
     * Close a running workflow whose steps have all ended.
     * A successful workflow also waits for the tasks it owns; a failed one
     * cancels whatever owned tasks are left.
     *
     * @return the workflow in its terminal state, or empty if it is still in progress
     */
    public Optional<Workflow> evaluateCompletion(UUID workflowId) {
        WorkflowGraph graph = graphStore.loadGraph(workflowId);
        if (graph.workflow().status() != WorkflowStatus.RUNNING || !graph.allStepsFinal()) {
            return Optional.empty();
        }

        ObjectNode results = objectMapper.createObjectNode();
        for (WorkflowStep step : graph.steps()) {
            if (step.status() == NodeStatus.COMPLETED) {
                results.set(step.stepId(), step.lifecycle().output());
            }
        }

        Optional<WorkflowStep> rootCause = graph.steps().stream()
            .filter(WorkflowOrchestrator::isFailure)
            .min(Comparator
                .comparing((WorkflowStep s) -> s.lifecycle().error() != null
                    && s.lifecycle().error().kind() == ErrorKind.UPSTREAM_FAILED)
                .thenComparing(s -> s.lifecycle().completedAt())
                .thenComparingInt(WorkflowStep::stepOrder));

        try (LoggingContext ignored = LoggingContext.forWorkflow(workflowId)) {
            if (rootCause.isEmpty()) {
                boolean tasksPending = graphStore.findTasksByWorkflow(workflowId).stream()
                    .anyMatch(t -> !t.lifecycle().isFinal());
                if (tasksPending) {
                    return Optional.empty();
                }
                return Optional.of(updateStatus(workflowId, WorkflowStatus.COMPLETED,
                    b -> b.results(results).completedAt(clock.instant()),
                    "all steps completed", AuditEntry.ACTOR_ORCHESTRATOR));
            }
            WorkflowStep cause = rootCause.get();
            ErrorInfo error = cause.lifecycle().error() != null
                ? cause.lifecycle().error()
                : ErrorInfo.of(ErrorKind.UPSTREAM_FAILED, "step " + cause.stepId() + " failed", clock.instant());
            Workflow failed = updateStatus(workflowId, WorkflowStatus.FAILED,
                b -> b.results(results).error(error).rootCauseStepId(cause.stepId()).completedAt(clock.instant()),
                "step " + cause.stepId() + " failed", AuditEntry.ACTOR_ORCHESTRATOR);
            int cancelled = cancelRemaining(workflowId, ErrorInfo.of(ErrorKind.UPSTREAM_FAILED,
                "workflow failed at step " + cause.stepId(), clock.instant()));
            if (cancelled > 0) {
                log.info("Cancelled {} owned tasks of failed workflow {}", cancelled, workflowId);
            }
            return Optional.of(failed);
        }
    }

    private static boolean isFailure(WorkflowStep step) {
        NodeLifecycle lifecycle = step.lifecycle();
        if (lifecycle.isFinalFailure()) {
            return true;
        }
        return lifecycle.status() == NodeStatus.CANCELLED
            && lifecycle.error() != null
            && lifecycle.error().kind() == ErrorKind.DEADLINE_EXCEEDED;
    }

    /**
     * Fail the workflow and cancel its remaining nodes if its timeout has elapsed.
     *
     * @return true if the workflow was timed out by this call
     */
    public boolean handleWorkflowTimeout(Workflow workflow) {
        Instant now = clock.instant();
        if (!workflow.isTimedOut(now)) {
            return false;
        }
        try (LoggingContext ignored = LoggingContext.forWorkflow(workflow.id())) {
            ErrorInfo error = ErrorInfo.of(ErrorKind.WORKFLOW_TIMEOUT,
                "workflow exceeded timeout of " + workflow.timeout().toMillis() + "ms", now);
            try {
                updateStatus(workflow.id(), WorkflowStatus.FAILED,
                    b -> b.error(error).completedAt(now), error.message(), AuditEntry.ACTOR_ORCHESTRATOR);
            } catch (InvalidStateTransitionException e) {
                log.debug("Workflow {} ended before its timeout was applied", workflow.id());
                return false;
            }
            int cancelled = cancelRemaining(workflow.id(), error);
            log.warn("Workflow {} timed out, {} nodes cancelled", workflow.id(), cancelled);
            return true;
        }
    }

    /**
     * @return number of workflows timed out
     */
    public int enforceWorkflowTimeouts() {
        int timedOut = 0;
        for (Workflow workflow : getActiveWorkflows()) {
            if (handleWorkflowTimeout(workflow)) {
                timedOut++;
            }
        }
        return timedOut;
    }

    // ========== Internal ==========

    private Workflow updateStatus(
            UUID workflowId,
            WorkflowStatus target,
            UnaryOperator<Workflow.Builder> mutation,
            String reason,
            String actor) {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            Workflow current = graphStore.findWorkflow(workflowId)
                .orElseThrow(() -> new NotFoundException("Workflow", workflowId.toString()));
            if (!current.status().canTransitionTo(target)) {
                throw new InvalidStateTransitionException(current.status(), target);
            }

            Workflow stored;
            try {
                stored = graphStore.updateWorkflow(mutation.apply(current.toBuilder().status(target)).build());
            } catch (ConflictException e) {
                log.debug("Workflow {} changed concurrently, retrying update to {}", workflowId, target);
                continue;
            }

            graphStore.appendAudit(AuditEntry.workflowTransition(
                workflowId, current.status(), target, reason, actor, clock.instant()));
            metrics.workflowTransition(target);
            if (target.isTerminal()) {
                resolver.releaseScope(NodeRef.workflowScope(workflowId));
            }
            log.info("Workflow {} {} -> {}{}", workflowId, current.status(), target,
                reason != null ? " (" + reason + ")" : "");
            return stored;
        }
        throw new ConflictException("Workflow " + workflowId, "stable revision", "concurrent updates");
    }
}
