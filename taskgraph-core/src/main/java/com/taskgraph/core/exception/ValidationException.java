package com.taskgraph.core.exception;

/**
 * Thrown when a workflow, task or edge is rejected before it can execute.
 */
public class ValidationException extends OrchestratorException {

    public static final String ERROR_CODE = "VALIDATION_FAILED";

    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public ValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid %s: %s", field, reason));
    }

    protected ValidationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
