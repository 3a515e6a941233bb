package com.taskgraph.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.*;
import com.taskgraph.core.spi.TaskRunner;
import com.taskgraph.core.test.TimeController;
import com.taskgraph.engine.coordinator.TaskCoordinator;
import com.taskgraph.engine.coordinator.WorkflowOrchestrator;
import com.taskgraph.engine.coordinator.WorkflowValidator;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.execution.RunnerDispatcher;
import com.taskgraph.engine.graph.DependencyResolver;
import com.taskgraph.engine.graph.ReachabilityIndex;
import com.taskgraph.engine.metrics.OrchestratorMetrics;
import com.taskgraph.engine.persistence.InMemoryAuditRepository;
import com.taskgraph.engine.persistence.InMemoryGraphStore;
import com.taskgraph.engine.predicate.PredicateContexts;
import com.taskgraph.engine.predicate.SpelPredicateEvaluator;
import com.taskgraph.engine.resource.ResourceAllocator;
import com.taskgraph.engine.resource.ResourceCapacity;
import com.taskgraph.engine.retry.RetryTimeoutManager;
import com.taskgraph.engine.scheduling.SchedulerLoop;
import com.taskgraph.engine.service.WorkflowService.CreateWorkflowRequest;
import com.taskgraph.engine.service.WorkflowService.EdgeDefinition;
import com.taskgraph.engine.service.WorkflowService.StepDefinition;
import com.taskgraph.engine.step.*;
import com.taskgraph.engine.webhook.StoreWebhookCompletionChannel;
import com.taskgraph.scheduler.InMemoryTimerRepository;
import com.taskgraph.scheduler.TimerScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wires the engine over in-memory stores and a frozen clock so scenarios can
 * be driven one scheduler tick at a time.
 */
public class EngineHarness {

    public static final Instant EPOCH = Instant.parse("2026-01-01T00:00:00Z");

    public final TimeController clock = TimeController.frozenAt(EPOCH);
    public final ObjectMapper json = new ObjectMapper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final OrchestratorMetrics metrics = new OrchestratorMetrics(meterRegistry);
    public final InMemoryAuditRepository audit = new InMemoryAuditRepository();
    public final InMemoryGraphStore store = new InMemoryGraphStore(audit, json, clock);
    public final InMemoryTimerRepository timers = new InMemoryTimerRepository();
    public final TimerScheduler timerScheduler = new TimerScheduler(timers, audit, clock, Duration.ofMillis(100));
    public final ResourceAllocator allocator;
    public final ReachabilityIndex index = new ReachabilityIndex();
    public final SpelPredicateEvaluator evaluator = new SpelPredicateEvaluator();
    public final PredicateContexts contexts = new PredicateContexts(json);
    public final DependencyResolver resolver;
    public final NodeTransitioner transitioner;
    public final RetryTimeoutManager retryManager;
    public final RunnerDispatcher dispatcher;
    public final StepOutcomes outcomes;
    public final StepExecutor stepExecutor;
    public final WorkflowValidator validator;
    public final WorkflowOrchestrator orchestrator;
    public final TaskCoordinator tasks;
    public final SchedulerLoop scheduler;
    public final StoreWebhookCompletionChannel webhooks;

    public EngineHarness(TaskRunner runner) {
        this(runner, Runnable::run, defaultCapacity());
    }

    public EngineHarness(TaskRunner runner, Executor workers, ResourceCapacity capacity) {
        this.allocator = new ResourceAllocator(capacity, clock);
        this.resolver = new DependencyResolver(store, index, allocator, evaluator, contexts, json, clock);
        this.transitioner = new NodeTransitioner(store, metrics);
        this.retryManager = new RetryTimeoutManager(store, transitioner, timerScheduler,
            RetryPolicy.defaultPolicy(), metrics, json, clock);
        this.dispatcher = new RunnerDispatcher(runner, transitioner, retryManager, workers, clock);
        this.outcomes = new StepOutcomes(transitioner, retryManager, json, clock);

        RunnerStepDriver runnerDriver = new RunnerStepDriver(dispatcher, outcomes);
        this.stepExecutor = new StepExecutor()
            .register(StepType.TASK, runnerDriver)
            .register(StepType.CUSTOM, runnerDriver)
            .register(StepType.CONDITION, new ConditionStepDriver(evaluator, contexts, outcomes))
            .register(StepType.PARALLEL, new ParallelStepDriver(outcomes))
            .register(StepType.SEQUENTIAL, new SequentialStepDriver(outcomes))
            .register(StepType.LOOP, new LoopStepDriver(store, resolver, evaluator, contexts, outcomes))
            .register(StepType.WAIT, new WaitStepDriver(store, timerScheduler, evaluator, contexts, outcomes))
            .register(StepType.WEBHOOK, new WebhookStepDriver());

        this.validator = new WorkflowValidator(allocator);
        this.orchestrator = new WorkflowOrchestrator(store, audit, validator, resolver, transitioner, metrics,
            json, clock);
        this.tasks = new TaskCoordinator(store, audit, resolver, allocator, transitioner, clock);
        this.scheduler = new SchedulerLoop(store, resolver, allocator, transitioner, stepExecutor, dispatcher,
            retryManager, orchestrator, timerScheduler, metrics, clock, Duration.ofMillis(100));
        this.webhooks = new StoreWebhookCompletionChannel(store, transitioner, retryManager, json, clock);
    }

    public static ResourceCapacity defaultCapacity() {
        return new ResourceCapacity(16.0, 65536, 2, 1_000_000, Map.of(), Map.of());
    }

    // ========== Driving ==========

    public void tick() {
        scheduler.tick();
    }

    public void tick(int times) {
        for (int i = 0; i < times; i++) {
            scheduler.tick();
        }
    }

    /**
     * Tick until the workflow reaches a final status or the tick limit runs out.
     */
    public Workflow runToCompletion(UUID workflowId, int maxTicks) {
        for (int i = 0; i < maxTicks; i++) {
            Workflow workflow = workflow(workflowId);
            if (workflow.status().isTerminal()) {
                return workflow;
            }
            scheduler.tick();
        }
        return workflow(workflowId);
    }

    // ========== Building workflows ==========

    public UUID startWorkflow(String name, List<StepDefinition> steps, List<EdgeDefinition> edges) {
        return startWorkflow(request(name, steps, edges));
    }

    public UUID startWorkflow(CreateWorkflowRequest request) {
        Workflow created = orchestrator.createWorkflow(request);
        orchestrator.startWorkflow(created.id());
        return created.id();
    }

    public static CreateWorkflowRequest request(String name, List<StepDefinition> steps, List<EdgeDefinition> edges) {
        return new CreateWorkflowRequest(name, null, null, null, null, null, "test", steps, edges);
    }

    public StepDefinition taskStep(String stepId, int maxRetries) {
        return new StepDefinition(stepId, stepId, new StepConfig.TaskConfig(TaskType.of("noop"), json.createObjectNode()),
            null, null, maxRetries, null, null, null);
    }

    public static StepDefinition step(String stepId, StepConfig config) {
        return new StepDefinition(stepId, stepId, config, null, null, null, null, null, null);
    }

    public static EdgeDefinition after(String stepId, String dependsOn) {
        return new EdgeDefinition(stepId, dependsOn, DependencyType.COMPLETION, null, false);
    }

    // ========== Inspection ==========

    public Workflow workflow(UUID workflowId) {
        return store.findWorkflow(workflowId).orElseThrow();
    }

    public WorkflowStep step(UUID workflowId, String stepId) {
        return store.findStep(workflowId, stepId).orElseThrow();
    }

    public NodeStatus status(UUID workflowId, String stepId) {
        return step(workflowId, stepId).status();
    }

    public Map<String, NodeStatus> statuses(UUID workflowId) {
        return store.findSteps(workflowId).stream()
            .collect(Collectors.toMap(WorkflowStep::stepId, WorkflowStep::status));
    }

    /**
     * Node transition audit for one step as "FROM->TO" strings in order.
     */
    public List<String> transitions(UUID workflowId, String stepId) {
        String key = NodeRef.step(workflowId, stepId).key();
        return audit.findByNode(key).stream()
            .filter(e -> e.type() == AuditEventType.NODE_TRANSITION)
            .map(e -> e.fromStatus() + "->" + e.toStatus())
            .collect(Collectors.toList());
    }

    public List<AuditEntry> auditOf(UUID workflowId, AuditEventType... types) {
        Set<AuditEventType> wanted = Set.copyOf(Arrays.asList(types));
        return audit.findByWorkflow(workflowId).stream()
            .filter(e -> wanted.contains(e.type()))
            .collect(Collectors.toList());
    }

    public double counter(String name, String... tags) {
        var counter = meterRegistry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }

    public static <T> Map<String, T> byStepId(List<WorkflowStep> steps, Function<WorkflowStep, T> value) {
        return steps.stream().collect(Collectors.toMap(WorkflowStep::stepId, value));
    }
}
