package com.taskgraph.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowStepTest {

    private final UUID workflowId = UUID.randomUUID();

    @Test
    void builder_shouldDeriveTypeFromConfig() {
        WorkflowStep step = WorkflowStep.builder()
            .workflowId(workflowId)
            .stepId("fan-out")
            .config(new StepConfig.ParallelConfig(List.of("a", "b")))
            .build();

        assertEquals(StepType.PARALLEL, step.stepType());
        assertEquals(List.of("a", "b"), step.config().referencedStepIds());
        assertEquals(NodeStatus.PENDING, step.status());
        assertEquals(NodeRef.step(workflowId, "fan-out"), step.ref());
    }

    @Test
    void mismatchedConfig_shouldBeRejected() {
        WorkflowStep step = WorkflowStep.builder()
            .workflowId(workflowId)
            .stepId("s")
            .config(new StepConfig.WaitConfig(Duration.ofSeconds(1), null))
            .build();

        assertThrows(IllegalArgumentException.class, () -> new WorkflowStep(
            workflowId, "s", "s", StepType.TASK, 0, 3, null, 0, step.config(), null,
            Instant.now(), step.lifecycle()));
    }

    @Test
    void cloneForIteration_shouldStartFresh() {
        WorkflowStep body = WorkflowStep.builder()
            .workflowId(workflowId)
            .stepId("body")
            .maxRetries(2)
            .timeout(Duration.ofSeconds(30))
            .config(new StepConfig.TaskConfig(TaskType.VALIDATION, null))
            .build()
            .withParent("loop", 1);

        WorkflowStep clone = body.cloneForIteration(WorkflowStep.iterationId("body", 3), 3, Instant.now());

        assertEquals("body#3", clone.stepId());
        assertEquals("loop", clone.parentStepId());
        assertEquals(3, clone.iteration());
        assertEquals(2, clone.lifecycle().maxRetries());
        assertEquals(0, clone.lifecycle().retryCount());
        assertEquals("body", WorkflowStep.templateId(clone.stepId()));
    }

    @Test
    void conditionConfig_shouldReferenceBothBranches() {
        StepConfig.ConditionConfig config = new StepConfig.ConditionConfig(
            "x > 10", List.of("big"), List.of("small", "tiny"));

        assertEquals(List.of("big", "small", "tiny"), config.referencedStepIds());
    }
}
