package com.taskgraph.core.spi;

import java.util.Map;

/**
 * Evaluates condition, loop and wait predicates. The expression language is
 * up to the implementation.
 */
@FunctionalInterface
public interface PredicateEvaluator {

    /**
     * Evaluate a boolean expression.
     *
     * @param expression The expression text
     * @param context Variables visible to the expression
     * @return The result
     * @throws PredicateEvaluationException if the expression is malformed or not boolean
     */
    boolean evaluate(String expression, Map<String, Object> context) throws PredicateEvaluationException;
}
