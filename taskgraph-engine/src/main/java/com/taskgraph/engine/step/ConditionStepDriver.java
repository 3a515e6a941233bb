package com.taskgraph.engine.step;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.model.ErrorKind;
import com.taskgraph.core.model.StepConfig;
import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;
import com.taskgraph.core.spi.PredicateEvaluationException;
import com.taskgraph.core.spi.PredicateEvaluator;
import com.taskgraph.engine.predicate.PredicateContexts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates its predicate once, completes, and cancels the branch not taken.
 */
public class ConditionStepDriver implements StepDriver {

    private static final Logger log = LoggerFactory.getLogger(ConditionStepDriver.class);

    private final PredicateEvaluator evaluator;
    private final PredicateContexts contexts;
    private final StepOutcomes outcomes;

    public ConditionStepDriver(PredicateEvaluator evaluator, PredicateContexts contexts, StepOutcomes outcomes) {
        this.evaluator = evaluator;
        this.contexts = contexts;
        this.outcomes = outcomes;
    }

    @Override
    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        StepConfig.ConditionConfig config = (StepConfig.ConditionConfig) step.config();
        boolean result;
        try {
            result = evaluator.evaluate(config.predicate(), contexts.forWorkflow(graph));
        } catch (PredicateEvaluationException e) {
            log.warn("Condition {} failed to evaluate: {}", step.stepId(), e.getMessage());
            outcomes.fail(step, ErrorKind.PREDICATE, e.getMessage());
            return;
        }

        outcomes.cancelSubtrees(graph,
            result ? config.falsePathSteps() : config.truePathSteps(), "branch not taken");

        ObjectNode output = outcomes.json().createObjectNode();
        output.put("result", result);
        output.put("branch", result ? "true" : "false");
        outcomes.complete(step, output);
        log.info("Condition {} took the {} branch", step.stepId(), result);
    }
}
