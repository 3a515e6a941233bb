package com.taskgraph.engine.predicate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the variable maps predicates are evaluated against.
 *
 * Step predicates (condition, loop, wait) see the workflow context keys at the
 * top level, the whole context under {@code context}, and completed step
 * outputs under {@code steps}. Loop iterations also publish their latest
 * output under the template step id.
 *
 * Conditional edges see {@code upstream} (the upstream output) and {@code context}.
 */
public class PredicateContexts {

    private final ObjectMapper objectMapper;

    public PredicateContexts(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> forWorkflow(WorkflowGraph graph) {
        Map<String, Object> context = toMap(graph.workflow().context());
        Map<String, Object> steps = new LinkedHashMap<>();
        Map<String, Integer> latestIteration = new HashMap<>();

        for (WorkflowStep step : graph.steps()) {
            if (step.status() != NodeStatus.COMPLETED) {
                continue;
            }
            Object output = toObject(step.lifecycle().output());
            steps.put(step.stepId(), output);

            String template = WorkflowStep.templateId(step.stepId());
            if (!template.equals(step.stepId())
                    && step.iteration() > latestIteration.getOrDefault(template, 0)) {
                latestIteration.put(template, step.iteration());
                steps.put(template, output);
            }
        }

        Map<String, Object> variables = new HashMap<>(context);
        variables.put("context", context);
        variables.put("steps", steps);
        return variables;
    }

    public Map<String, Object> forEdge(JsonNode upstreamOutput, JsonNode context) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("upstream", toObject(upstreamOutput));
        variables.put("context", toMap(context));
        return variables;
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new HashMap<>();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = objectMapper.convertValue(node, Map.class);
        return map;
    }

    private Object toObject(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }
}
