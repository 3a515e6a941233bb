package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Data carried alongside a node state transition.
 *
 * @param output          output to record on COMPLETED
 * @param error           error to record on FAILED or CANCELLED
 * @param retryScheduled  on FAILED, whether a retry will follow (the failure is not final)
 * @param reason          free-form reason written to the audit trail
 * @param actor           who caused the transition (see {@link AuditEntry} actor constants)
 */
public record TransitionPayload(
    JsonNode output,
    ErrorInfo error,
    boolean retryScheduled,
    String reason,
    String actor
) {
    public static TransitionPayload by(String actor) {
        return new TransitionPayload(null, null, false, null, actor);
    }

    public static TransitionPayload completed(JsonNode output, String actor) {
        return new TransitionPayload(output, null, false, null, actor);
    }

    public static TransitionPayload failed(ErrorInfo error, boolean retryScheduled, String actor) {
        return new TransitionPayload(null, error, retryScheduled, error.message(), actor);
    }

    public static TransitionPayload cancelled(ErrorInfo error, String actor) {
        return new TransitionPayload(null, error, false, error.message(), actor);
    }

    public TransitionPayload withReason(String reason) {
        return new TransitionPayload(output, error, retryScheduled, reason, actor);
    }
}
