package com.taskgraph.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.NodeRef;

/**
 * Entry point for external systems completing webhook steps.
 *
 * Signals are only accepted for webhook steps that are currently RUNNING.
 */
public interface WebhookCompletionChannel {

    /**
     * Complete a running webhook step.
     *
     * @param step The step reference
     * @param output Output to record
     * @throws com.taskgraph.core.exception.NotFoundException if the step does not exist
     * @throws com.taskgraph.core.exception.ValidationException if the step is not a webhook step
     * @throws com.taskgraph.core.exception.InvalidStateTransitionException if the step is not running
     */
    void complete(NodeRef step, JsonNode output);

    /**
     * Fail a running webhook step. The failure is subject to the step's retry budget.
     *
     * @param step The step reference
     * @param errorCode Error code reported by the external system
     * @param message Error message
     */
    void fail(NodeRef step, String errorCode, String message);

    /**
     * Complete the running webhook step registered under a callback key.
     *
     * @param callbackKey The key from the step's webhook configuration
     * @param output Output to record
     * @return The step that was completed
     */
    NodeRef completeByKey(String callbackKey, JsonNode output);
}
