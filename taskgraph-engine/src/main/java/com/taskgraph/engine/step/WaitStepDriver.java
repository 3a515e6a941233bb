package com.taskgraph.engine.step;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.StepConfig;
import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.core.spi.PredicateEvaluationException;
import com.taskgraph.core.spi.PredicateEvaluator;
import com.taskgraph.engine.predicate.PredicateContexts;
import com.taskgraph.scheduler.ScheduledTimer;
import com.taskgraph.scheduler.TimerScheduler;
import com.taskgraph.scheduler.TimerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Completes once its duration has elapsed since it started, or once its
 * condition holds, whichever comes first. A timer marks the moment the
 * duration elapses.
 */
public class WaitStepDriver implements StepDriver {

    private static final Logger log = LoggerFactory.getLogger(WaitStepDriver.class);

    private final GraphStore graphStore;
    private final TimerScheduler timerScheduler;
    private final PredicateEvaluator evaluator;
    private final PredicateContexts contexts;
    private final StepOutcomes outcomes;

    public WaitStepDriver(
            GraphStore graphStore,
            TimerScheduler timerScheduler,
            PredicateEvaluator evaluator,
            PredicateContexts contexts,
            StepOutcomes outcomes) {
        this.graphStore = graphStore;
        this.timerScheduler = timerScheduler;
        this.evaluator = evaluator;
        this.contexts = contexts;
        this.outcomes = outcomes;
        timerScheduler.registerCallback(TimerType.WAIT_ELAPSED, this::onTimer);
    }

    @Override
    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        StepConfig.WaitConfig config = (StepConfig.WaitConfig) step.config();
        if (config.waitDuration() != null) {
            timerScheduler.scheduleTimer(step.ref(), TimerType.WAIT_ELAPSED,
                step.lifecycle().startedAt().plus(config.waitDuration()));
        }
        poll(step, graph);
    }

    @Override
    public void poll(WorkflowStep step, WorkflowGraph graph) {
        StepConfig.WaitConfig config = (StepConfig.WaitConfig) step.config();
        Instant now = outcomes.clock().instant();

        if (config.waitDuration() != null && elapsed(step, now, config.waitDuration())) {
            outcomes.complete(step, output("duration_elapsed", step, now));
            return;
        }
        if (config.waitCondition() != null && !config.waitCondition().isBlank()) {
            try {
                if (evaluator.evaluate(config.waitCondition(), contexts.forWorkflow(graph))) {
                    outcomes.complete(step, output("condition_met", step, now));
                }
            } catch (PredicateEvaluationException e) {
                log.warn("Wait {} condition could not be evaluated, still waiting: {}",
                    step.stepId(), e.getMessage());
            }
        }
    }

    private void onTimer(ScheduledTimer timer) {
        graphStore.findStep(timer.node().workflowId(), timer.node().nodeId())
            .filter(step -> step.status() == NodeStatus.RUNNING)
            .ifPresent(step -> poll(step, graphStore.loadGraph(step.workflowId())));
    }

    private static boolean elapsed(WorkflowStep step, Instant now, Duration waitDuration) {
        Instant startedAt = step.lifecycle().startedAt();
        return startedAt != null && !now.isBefore(startedAt.plus(waitDuration));
    }

    private ObjectNode output(String reason, WorkflowStep step, Instant now) {
        ObjectNode output = outcomes.json().createObjectNode();
        output.put("reason", reason);
        Instant startedAt = step.lifecycle().startedAt();
        output.put("waitedMs", startedAt != null ? Duration.between(startedAt, now).toMillis() : 0L);
        return output;
    }
}
