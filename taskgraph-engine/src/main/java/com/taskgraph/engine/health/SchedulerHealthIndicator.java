package com.taskgraph.engine.health;

import com.taskgraph.core.model.WorkflowStatus;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.engine.execution.RunnerDispatcher;
import com.taskgraph.engine.resource.ResourceAllocator;
import com.taskgraph.engine.resource.ResourceUtilization;
import com.taskgraph.engine.scheduling.SchedulerLoop;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

/**
 * Reports whether the scheduler loop is ticking, plus resource and workload figures.
 * The loop counts as stalled when no tick happened for ten tick intervals.
 */
public class SchedulerHealthIndicator implements HealthIndicator {

    private final SchedulerLoop schedulerLoop;
    private final ResourceAllocator allocator;
    private final RunnerDispatcher dispatcher;
    private final GraphStore graphStore;
    private final Clock clock;
    private final Duration stallThreshold;

    public SchedulerHealthIndicator(
            SchedulerLoop schedulerLoop,
            ResourceAllocator allocator,
            RunnerDispatcher dispatcher,
            GraphStore graphStore,
            Clock clock,
            Duration tickInterval) {
        this.schedulerLoop = schedulerLoop;
        this.allocator = allocator;
        this.dispatcher = dispatcher;
        this.graphStore = graphStore;
        this.clock = clock;
        this.stallThreshold = tickInterval.multipliedBy(10);
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        try {
            Instant lastTick = schedulerLoop.getLastTickAt();
            details.put("schedulerRunning", schedulerLoop.isRunning());
            details.put("ticks", schedulerLoop.getTickCount());
            details.put("lastTickAt", lastTick != null ? lastTick.toString() : "never");
            details.put("inFlightRunners", dispatcher.inFlightCount());
            details.put("activeWorkflows",
                graphStore.findWorkflowsByStatus(EnumSet.of(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED)).size());

            ResourceUtilization utilization = allocator.utilization();
            details.put("resources", utilization);

            if (!schedulerLoop.isRunning()) {
                return Health.down().withDetails(details).build();
            }
            if (lastTick != null && Duration.between(lastTick, clock.instant()).compareTo(stallThreshold) > 0) {
                details.put("stalledFor", Duration.between(lastTick, clock.instant()).toString());
                return Health.down().withDetails(details).build();
            }
            return Health.up().withDetails(details).build();
        } catch (Exception e) {
            return Health.down().withException(e).withDetails(details).build();
        }
    }
}
