package com.taskgraph.engine.step;

import com.taskgraph.core.model.StepType;
import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes running steps to the driver for their type.
 */
public class StepExecutor {

    private final Map<StepType, StepDriver> drivers = new EnumMap<>(StepType.class);

    public StepExecutor register(StepType type, StepDriver driver) {
        drivers.put(type, driver);
        return this;
    }

    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        driverFor(step).dispatch(step, graph);
    }

    public void poll(WorkflowStep step, WorkflowGraph graph) {
        driverFor(step).poll(step, graph);
    }

    public boolean supports(StepType type) {
        return drivers.containsKey(type);
    }

    private StepDriver driverFor(WorkflowStep step) {
        StepDriver driver = drivers.get(step.stepType());
        if (driver == null) {
            throw new IllegalStateException("No driver registered for step type " + step.stepType());
        }
        return driver;
    }
}
