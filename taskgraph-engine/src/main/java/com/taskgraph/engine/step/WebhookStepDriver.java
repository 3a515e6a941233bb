package com.taskgraph.engine.step;

import com.taskgraph.core.model.StepConfig;
import com.taskgraph.core.model.WorkflowGraph;
import com.taskgraph.core.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parks the step until an external signal arrives on the webhook channel.
 */
public class WebhookStepDriver implements StepDriver {

    private static final Logger log = LoggerFactory.getLogger(WebhookStepDriver.class);

    @Override
    public void dispatch(WorkflowStep step, WorkflowGraph graph) {
        StepConfig.WebhookConfig config = (StepConfig.WebhookConfig) step.config();
        log.info("Webhook step {} awaiting callback '{}'", step.stepId(), config.callbackKey());
    }
}
