package com.taskgraph.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.ErrorInfo;
import com.taskgraph.core.model.NodeLifecycle;

import java.time.Instant;

/**
 * Lifecycle fields shared by task and step responses.
 */
public record NodeStateResponse(
    String status,
    int retryCount,
    int maxRetries,
    Instant scheduledAt,
    Instant startedAt,
    Instant completedAt,
    Long actualDurationMs,
    JsonNode output,
    String errorKind,
    String errorCode,
    String errorMessage
) {
    public static NodeStateResponse from(NodeLifecycle lifecycle) {
        ErrorInfo error = lifecycle.error();
        return new NodeStateResponse(
            lifecycle.status().wireName(),
            lifecycle.retryCount(),
            lifecycle.maxRetries(),
            lifecycle.scheduledAt(),
            lifecycle.startedAt(),
            lifecycle.completedAt(),
            lifecycle.actualDuration() != null ? lifecycle.actualDuration().toMillis() : null,
            lifecycle.output(),
            error != null ? error.kind().name() : null,
            error != null ? error.code() : null,
            error != null ? error.message() : null
        );
    }
}
