package com.taskgraph.core.spi;

/**
 * Thrown when a predicate cannot be evaluated.
 */
public class PredicateEvaluationException extends Exception {

    private final String expression;

    public PredicateEvaluationException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public PredicateEvaluationException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
