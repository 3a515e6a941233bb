package com.taskgraph.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Performs the actual work of a task or task step.
 *
 * Implementations must poll {@link RunContext#isCancelled()} during long work
 * and stop producing output once it turns true. The engine never kills a
 * runner thread; anything returned after cancellation is discarded.
 */
@FunctionalInterface
public interface TaskRunner {

    /**
     * Execute one attempt.
     *
     * @param context Identity, attempt number and cancellation signal
     * @param config Type-specific configuration (task_config)
     * @param input Input payload
     * @return The output payload, may be null
     * @throws TaskRunnerException if the attempt fails
     */
    JsonNode execute(RunContext context, JsonNode config, JsonNode input) throws TaskRunnerException;
}
