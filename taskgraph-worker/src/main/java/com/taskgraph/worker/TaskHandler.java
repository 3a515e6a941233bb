package com.taskgraph.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Interface for task type implementations.
 * Applications implement this interface to handle specific task types.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute one attempt of a task.
     *
     * @param context Execution context providing input, config and utilities
     * @return The task output
     * @throws TaskHandlerException if the task fails
     */
    JsonNode execute(HandlerContext context) throws TaskHandlerException;
}
