package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Structured error payload stored on a node or workflow.
 */
public record ErrorInfo(
    ErrorKind kind,
    String code,
    String message,
    boolean retryable,
    JsonNode details,
    Instant occurredAt
) {
    public static ErrorInfo of(ErrorKind kind, String message, Instant occurredAt) {
        return new ErrorInfo(kind, kind.defaultCode(), message, kind.isRetryable(), null, occurredAt);
    }

    public static ErrorInfo runner(String code, String message, boolean retryable, Instant occurredAt) {
        return new ErrorInfo(ErrorKind.RUNNER,
            code != null ? code : ErrorKind.RUNNER.defaultCode(), message, retryable, null, occurredAt);
    }

    public ErrorInfo withDetails(JsonNode details) {
        return new ErrorInfo(kind, code, message, retryable, details, occurredAt);
    }
}
