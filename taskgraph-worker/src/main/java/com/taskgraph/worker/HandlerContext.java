package com.taskgraph.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.spi.RunContext;

import java.time.Instant;

/**
 * Context provided to task handlers during execution.
 */
public class HandlerContext {

    private final RunContext runContext;
    private final JsonNode config;
    private final JsonNode input;
    private final ObjectMapper objectMapper;

    public HandlerContext(RunContext runContext, JsonNode config, JsonNode input, ObjectMapper objectMapper) {
        this.runContext = runContext;
        this.config = config;
        this.input = input;
        this.objectMapper = objectMapper;
    }

    /**
     * The task or step being executed.
     */
    public NodeRef getNode() {
        return runContext.getNode();
    }

    public JsonNode getInput() {
        return input;
    }

    /**
     * Get the task input as a specific type.
     */
    public <T> T getInput(Class<T> type) {
        return objectMapper.convertValue(input, type);
    }

    /**
     * Type-specific configuration (task_config of a step, or the custom step config).
     */
    public JsonNode getConfig() {
        return config;
    }

    public <T> T getConfig(Class<T> type) {
        return objectMapper.convertValue(config, type);
    }

    public int getAttemptNumber() {
        return runContext.getAttempt();
    }

    public Instant getDeadline() {
        return runContext.getDeadline();
    }

    /**
     * Get the idempotency key for this node.
     * Use this when making external calls so a retried attempt is recognised.
     */
    public String getIdempotencyKey() {
        return runContext.getIdempotencyKey();
    }

    /**
     * Check whether the engine has asked this attempt to stop.
     * Long-running handlers should poll this and give up promptly.
     */
    public boolean isCancelled() {
        return runContext.isCancelled();
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
