package com.taskgraph.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.StepType;
import com.taskgraph.core.model.TaskType;
import com.taskgraph.core.repository.AuditRepository;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.core.spi.PredicateEvaluator;
import com.taskgraph.core.spi.TaskRunner;
import com.taskgraph.engine.config.EngineProperties;
import com.taskgraph.engine.coordinator.TaskCoordinator;
import com.taskgraph.engine.coordinator.WorkflowOrchestrator;
import com.taskgraph.engine.coordinator.WorkflowValidator;
import com.taskgraph.engine.execution.NodeTransitioner;
import com.taskgraph.engine.execution.RunnerDispatcher;
import com.taskgraph.engine.graph.DependencyResolver;
import com.taskgraph.engine.graph.ReachabilityIndex;
import com.taskgraph.engine.health.SchedulerHealthIndicator;
import com.taskgraph.engine.metrics.OrchestratorMetrics;
import com.taskgraph.engine.persistence.InMemoryAuditRepository;
import com.taskgraph.engine.persistence.InMemoryGraphStore;
import com.taskgraph.engine.persistence.jdbc.JdbcAuditRepository;
import com.taskgraph.engine.predicate.PredicateContexts;
import com.taskgraph.engine.predicate.SpelPredicateEvaluator;
import com.taskgraph.engine.resource.ResourceAllocator;
import com.taskgraph.engine.retry.RetryTimeoutManager;
import com.taskgraph.engine.scheduling.SchedulerLoop;
import com.taskgraph.engine.step.*;
import com.taskgraph.engine.webhook.StoreWebhookCompletionChannel;
import com.taskgraph.recovery.RecoveryEngine;
import com.taskgraph.scheduler.InMemoryTimerRepository;
import com.taskgraph.scheduler.TimerRepository;
import com.taskgraph.scheduler.TimerScheduler;
import com.taskgraph.worker.TaskRunnerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine. Engine classes carry no Spring annotations, every
 * collaborator is declared here.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class OrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfiguration.class);

    public static final TaskType NOOP = TaskType.of("noop");

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ========== Storage ==========

    @Bean
    public AuditRepository auditRepository(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper) {
        DataSource available = dataSource.getIfAvailable();
        if (available == null) {
            log.info("No DataSource configured, audit trail kept in memory");
            return new InMemoryAuditRepository();
        }
        log.info("Audit trail persisted through JDBC");
        return new JdbcAuditRepository(new JdbcTemplate(available), objectMapper);
    }

    @Bean
    public GraphStore graphStore(AuditRepository auditRepository, ObjectMapper objectMapper, Clock clock) {
        return new InMemoryGraphStore(auditRepository, objectMapper, clock);
    }

    @Bean
    public TimerRepository timerRepository() {
        return new InMemoryTimerRepository();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public TimerScheduler timerScheduler(
            TimerRepository timerRepository,
            AuditRepository auditRepository,
            Clock clock,
            EngineProperties properties) {
        return new TimerScheduler(timerRepository, auditRepository, clock, properties.getTimerPollInterval());
    }

    // ========== Graph and resources ==========

    @Bean
    public OrchestratorMetrics orchestratorMetrics(MeterRegistry meterRegistry) {
        return new OrchestratorMetrics(meterRegistry);
    }

    @Bean
    public ResourceAllocator resourceAllocator(EngineProperties properties, Clock clock) {
        return new ResourceAllocator(properties.toCapacity(), clock);
    }

    @Bean
    public PredicateEvaluator predicateEvaluator() {
        return new SpelPredicateEvaluator();
    }

    @Bean
    public PredicateContexts predicateContexts(ObjectMapper objectMapper) {
        return new PredicateContexts(objectMapper);
    }

    @Bean
    public DependencyResolver dependencyResolver(
            GraphStore graphStore,
            ResourceAllocator allocator,
            PredicateEvaluator evaluator,
            PredicateContexts contexts,
            ObjectMapper objectMapper,
            Clock clock) {
        return new DependencyResolver(graphStore, new ReachabilityIndex(), allocator, evaluator, contexts,
            objectMapper, clock);
    }

    @Bean
    public NodeTransitioner nodeTransitioner(GraphStore graphStore, OrchestratorMetrics metrics) {
        return new NodeTransitioner(graphStore, metrics);
    }

    @Bean
    public RetryTimeoutManager retryTimeoutManager(
            GraphStore graphStore,
            NodeTransitioner transitioner,
            TimerScheduler timerScheduler,
            EngineProperties properties,
            OrchestratorMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        return new RetryTimeoutManager(graphStore, transitioner, timerScheduler, properties.toRetryPolicy(),
            metrics, objectMapper, clock);
    }

    // ========== Execution ==========

    @Bean
    public TaskRunnerRegistry taskRunnerRegistry(ObjectMapper objectMapper) {
        return new TaskRunnerRegistry(objectMapper)
            .register(NOOP, context -> context.getInput());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workerExecutor(EngineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), r -> {
            Thread thread = new Thread(r, "taskgraph-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public RunnerDispatcher runnerDispatcher(
            TaskRunner taskRunner,
            NodeTransitioner transitioner,
            RetryTimeoutManager retryManager,
            ExecutorService workerExecutor,
            Clock clock) {
        return new RunnerDispatcher(taskRunner, transitioner, retryManager, workerExecutor, clock);
    }

    @Bean
    public StepOutcomes stepOutcomes(
            NodeTransitioner transitioner,
            RetryTimeoutManager retryManager,
            ObjectMapper objectMapper,
            Clock clock) {
        return new StepOutcomes(transitioner, retryManager, objectMapper, clock);
    }

    @Bean
    public StepExecutor stepExecutor(
            RunnerDispatcher dispatcher,
            StepOutcomes outcomes,
            GraphStore graphStore,
            DependencyResolver resolver,
            TimerScheduler timerScheduler,
            PredicateEvaluator evaluator,
            PredicateContexts contexts) {
        RunnerStepDriver runnerDriver = new RunnerStepDriver(dispatcher, outcomes);
        return new StepExecutor()
            .register(StepType.TASK, runnerDriver)
            .register(StepType.CUSTOM, runnerDriver)
            .register(StepType.CONDITION, new ConditionStepDriver(evaluator, contexts, outcomes))
            .register(StepType.PARALLEL, new ParallelStepDriver(outcomes))
            .register(StepType.SEQUENTIAL, new SequentialStepDriver(outcomes))
            .register(StepType.LOOP, new LoopStepDriver(graphStore, resolver, evaluator, contexts, outcomes))
            .register(StepType.WAIT, new WaitStepDriver(graphStore, timerScheduler, evaluator, contexts, outcomes))
            .register(StepType.WEBHOOK, new WebhookStepDriver());
    }

    // ========== Services ==========

    @Bean
    public WorkflowOrchestrator workflowOrchestrator(
            GraphStore graphStore,
            AuditRepository auditRepository,
            ResourceAllocator allocator,
            DependencyResolver resolver,
            NodeTransitioner transitioner,
            OrchestratorMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock,
            EngineProperties properties) {
        return new WorkflowOrchestrator(graphStore, auditRepository, new WorkflowValidator(allocator),
            resolver, transitioner, metrics, objectMapper, clock, properties.getWebhookTimeout());
    }

    @Bean
    public TaskCoordinator taskCoordinator(
            GraphStore graphStore,
            AuditRepository auditRepository,
            DependencyResolver resolver,
            ResourceAllocator allocator,
            NodeTransitioner transitioner,
            Clock clock) {
        return new TaskCoordinator(graphStore, auditRepository, resolver, allocator, transitioner, clock);
    }

    @Bean
    public StoreWebhookCompletionChannel webhookCompletionChannel(
            GraphStore graphStore,
            NodeTransitioner transitioner,
            RetryTimeoutManager retryManager,
            ObjectMapper objectMapper,
            Clock clock) {
        return new StoreWebhookCompletionChannel(graphStore, transitioner, retryManager, objectMapper, clock);
    }

    // ========== Background loops ==========

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SchedulerLoop schedulerLoop(
            GraphStore graphStore,
            DependencyResolver resolver,
            ResourceAllocator allocator,
            NodeTransitioner transitioner,
            StepExecutor stepExecutor,
            RunnerDispatcher dispatcher,
            RetryTimeoutManager retryManager,
            WorkflowOrchestrator orchestrator,
            TimerScheduler timerScheduler,
            OrchestratorMetrics metrics,
            Clock clock,
            EngineProperties properties) {
        return new SchedulerLoop(graphStore, resolver, allocator, transitioner, stepExecutor, dispatcher,
            retryManager, orchestrator, timerScheduler, metrics, clock, properties.getTickInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RecoveryEngine recoveryEngine(
            GraphStore graphStore,
            AuditRepository auditRepository,
            RetryTimeoutManager retryManager,
            WorkflowOrchestrator orchestrator,
            OrchestratorMetrics metrics,
            Clock clock,
            EngineProperties properties) {
        return new RecoveryEngine(graphStore, auditRepository, retryManager, orchestrator, metrics, clock,
            properties.getRecovery().getSweepInterval(), properties.getRecovery().getStuckThreshold());
    }

    @Bean
    public SchedulerHealthIndicator schedulerHealthIndicator(
            SchedulerLoop schedulerLoop,
            ResourceAllocator allocator,
            RunnerDispatcher dispatcher,
            GraphStore graphStore,
            Clock clock,
            EngineProperties properties) {
        return new SchedulerHealthIndicator(schedulerLoop, allocator, dispatcher, graphStore, clock,
            properties.getTickInterval());
    }
}
