package com.taskgraph.core.exception;

/**
 * Thrown when a state write is based on a stale view of the record.
 * The caller discards its transition and re-evaluates on the next tick.
 */
public class ConflictException extends OrchestratorException {

    public static final String ERROR_CODE = "TRANSITION_CONFLICT";

    public ConflictException(String entity, String expected, String actual) {
        super(ERROR_CODE, String.format(
            "Stale write on %s: expected %s but found %s", entity, expected, actual));
    }
}
