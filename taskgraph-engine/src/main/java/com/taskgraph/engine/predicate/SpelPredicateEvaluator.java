package com.taskgraph.engine.predicate;

import com.taskgraph.core.spi.PredicateEvaluationException;
import com.taskgraph.core.spi.PredicateEvaluator;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Predicate evaluator backed by Spring Expression Language.
 *
 * The context map is the root object and its keys read as properties, so
 * {@code x > 10} and {@code steps.analysis.score >= 3} work as written. The
 * evaluation context is read-only and exposes no type references.
 */
public class SpelPredicateEvaluator implements PredicateEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> cache = new ConcurrentHashMap<>();
    private final EvaluationContext evaluationContext = SimpleEvaluationContext
        .forPropertyAccessors(new MapAccessor())
        .withInstanceMethods()
        .build();

    @Override
    public boolean evaluate(String expression, Map<String, Object> context) throws PredicateEvaluationException {
        if (expression == null || expression.isBlank()) {
            throw new PredicateEvaluationException(expression, "Predicate is empty");
        }

        Expression parsed;
        try {
            parsed = cache.computeIfAbsent(expression, parser::parseExpression);
        } catch (ParseException e) {
            throw new PredicateEvaluationException(expression,
                "Cannot parse predicate '" + expression + "': " + e.getMessage(), e);
        }

        Object result;
        try {
            result = parsed.getValue(evaluationContext, context);
        } catch (EvaluationException e) {
            throw new PredicateEvaluationException(expression,
                "Cannot evaluate predicate '" + expression + "': " + e.getMessage(), e);
        }

        if (!(result instanceof Boolean)) {
            throw new PredicateEvaluationException(expression,
                "Predicate '" + expression + "' did not yield a boolean: " + result);
        }
        return (Boolean) result;
    }
}
