package com.taskgraph.engine.predicate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.spi.PredicateEvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SpelPredicateEvaluatorTest {

    private final SpelPredicateEvaluator evaluator = new SpelPredicateEvaluator();
    private final PredicateContexts contexts = new PredicateContexts(new ObjectMapper());

    @Test
    @DisplayName("Context keys read as plain properties")
    void testPlainProperties() throws PredicateEvaluationException {
        Map<String, Object> context = Map.of("x", 5, "region", "eu");

        assertThat(evaluator.evaluate("x > 10", context)).isFalse();
        assertThat(evaluator.evaluate("x <= 5 and region == 'eu'", context)).isTrue();
    }

    @Test
    @DisplayName("Nested maps and lists are navigable")
    void testNestedValues() throws PredicateEvaluationException {
        Map<String, Object> context = Map.of(
            "steps", Map.of("analysis", Map.of("score", 7, "tags", List.of("a", "b"))));

        assertThat(evaluator.evaluate("steps.analysis.score >= 7", context)).isTrue();
        assertThat(evaluator.evaluate("steps.analysis.tags[1] == 'b'", context)).isTrue();
    }

    @Test
    @DisplayName("Unknown variables, bad syntax and non-boolean results are errors")
    void testEvaluationErrors() {
        Map<String, Object> context = Map.of("x", 5);

        assertThatThrownBy(() -> evaluator.evaluate("missing > 1", context))
            .isInstanceOf(PredicateEvaluationException.class);
        assertThatThrownBy(() -> evaluator.evaluate("x >", context))
            .isInstanceOf(PredicateEvaluationException.class);
        assertThatThrownBy(() -> evaluator.evaluate("x + 1", context))
            .isInstanceOf(PredicateEvaluationException.class);
        assertThatThrownBy(() -> evaluator.evaluate(" ", context))
            .isInstanceOf(PredicateEvaluationException.class);
    }

    @Test
    @DisplayName("Type references are not available to predicates")
    void testNoTypeAccess() {
        assertThatThrownBy(() -> evaluator.evaluate("T(java.lang.System).exit(0) == null", new HashMap<>()))
            .isInstanceOf(PredicateEvaluationException.class);
    }

    @Test
    @DisplayName("Edge context exposes the upstream output and workflow context")
    void testEdgeContext() throws PredicateEvaluationException {
        ObjectMapper json = new ObjectMapper();
        ObjectNode output = json.createObjectNode().put("rows", 120);
        ObjectNode workflowContext = json.createObjectNode().put("threshold", 100);

        Map<String, Object> variables = contexts.forEdge(output, workflowContext);

        assertThat(evaluator.evaluate("upstream.rows > context.threshold", variables)).isTrue();
    }
}
