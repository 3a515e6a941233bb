package com.taskgraph.engine.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.AuditEntry;
import com.taskgraph.core.model.ErrorInfo;
import com.taskgraph.core.model.NodeLifecycle;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.TaskType;
import com.taskgraph.core.model.TransitionPayload;
import com.taskgraph.core.spi.RunContext;
import com.taskgraph.core.spi.TaskRunner;
import com.taskgraph.core.spi.TaskRunnerException;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.retry.RetryTimeoutManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hands running task and custom nodes to the {@link TaskRunner} on a worker pool.
 *
 * Each attempt carries a cancellation flag. The flag is raised as soon as the
 * node leaves RUNNING by any other path (timeout, deadline, cancel), and a
 * result arriving after that is discarded.
 */
public class RunnerDispatcher implements TransitionListener {

    private static final Logger log = LoggerFactory.getLogger(RunnerDispatcher.class);

    private final TaskRunner taskRunner;
    private final NodeTransitioner transitioner;
    private final RetryTimeoutManager retryManager;
    private final Executor workers;
    private final Clock clock;

    private final Map<NodeRef, InFlight> inFlight = new ConcurrentHashMap<>();

    public RunnerDispatcher(
            TaskRunner taskRunner,
            NodeTransitioner transitioner,
            RetryTimeoutManager retryManager,
            Executor workers,
            Clock clock) {
        this.taskRunner = taskRunner;
        this.transitioner = transitioner;
        this.retryManager = retryManager;
        this.workers = workers;
        this.clock = clock;
        transitioner.addListener(this);
    }

    /**
     * Submit one attempt of a node that has just entered RUNNING.
     */
    public void submit(NodeRef node, TaskType taskType, JsonNode config, JsonNode input, NodeLifecycle lifecycle) {
        int attempt = lifecycle.retryCount() + 1;
        InFlight entry = new InFlight(new AtomicBoolean(false), attempt);
        inFlight.put(node, entry);

        RunContext context = new RunContext(node, taskType, attempt, lifecycle.deadline(), entry.cancelled()::get);
        try {
            workers.execute(() -> run(node, taskType, config, input, context, entry));
        } catch (RejectedExecutionException e) {
            inFlight.remove(node, entry);
            log.error("Worker pool rejected {}", node, e);
            retryManager.handleFailure(node, ErrorInfo.runner("REJECTED",
                "worker pool rejected the attempt: " + e.getMessage(), true, clock.instant()));
        }
    }

    private void run(NodeRef node, TaskType taskType, JsonNode config, JsonNode input,
                     RunContext context, InFlight entry) {
        try (LoggingContext ignored = LoggingContext.forNode(node, entry.attempt())) {
            log.debug("Running {} as {} (attempt {})", node, taskType, entry.attempt());
            JsonNode output;
            try {
                output = taskRunner.execute(context, config, input);
            } catch (TaskRunnerException e) {
                onFailure(node, entry, ErrorInfo.runner(e.getErrorCode(), e.getMessage(),
                    e.isRetryable(), clock.instant()));
                return;
            } catch (RuntimeException e) {
                log.error("Runner threw unexpectedly for {}", node, e);
                onFailure(node, entry, ErrorInfo.runner("RUNNER_ERROR",
                    String.valueOf(e.getMessage()), true, clock.instant()));
                return;
            }

            if (entry.cancelled().get()) {
                log.info("Discarding result of {}: attempt was cancelled", node);
                return;
            }
            transitioner.transition(node, NodeStatus.RUNNING, NodeStatus.COMPLETED,
                TransitionPayload.completed(output, AuditEntry.ACTOR_EXECUTOR));
        } finally {
            inFlight.remove(node, entry);
        }
    }

    private void onFailure(NodeRef node, InFlight entry, ErrorInfo error) {
        if (entry.cancelled().get()) {
            log.debug("Ignoring failure of cancelled attempt of {}: {}", node, error.message());
            return;
        }
        retryManager.handleFailure(node, error);
    }

    @Override
    public void onTransition(NodeRef node, NodeStatus from, NodeLifecycle lifecycle) {
        if (!TransitionListener.leftExecution(from, lifecycle)) {
            return;
        }
        InFlight entry = inFlight.remove(node);
        if (entry != null) {
            entry.cancelled().set(true);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isInFlight(NodeRef node) {
        return inFlight.containsKey(node);
    }

    private record InFlight(AtomicBoolean cancelled, int attempt) {
    }
}
