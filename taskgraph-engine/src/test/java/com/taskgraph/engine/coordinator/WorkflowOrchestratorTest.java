package com.taskgraph.engine.coordinator;

import com.taskgraph.core.exception.CycleException;
import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.*;
import com.taskgraph.engine.service.WorkflowService.CreateWorkflowRequest;
import com.taskgraph.engine.service.WorkflowService.EdgeDefinition;
import com.taskgraph.engine.service.WorkflowService.StepDefinition;
import com.taskgraph.engine.service.WorkflowService.WorkflowStatusView;
import com.taskgraph.engine.test.EngineHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static com.taskgraph.engine.test.EngineHarness.after;
import static com.taskgraph.engine.test.EngineHarness.request;
import static com.taskgraph.engine.test.EngineHarness.step;
import static org.assertj.core.api.Assertions.*;

class WorkflowOrchestratorTest {

    private EngineHarness engine;

    @BeforeEach
    void setUp() {
        engine = new EngineHarness((context, config, input) -> null);
    }

    private StepDefinition task(String id) {
        return engine.taskStep(id, 0);
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Valid definition is stored as READY with owners assigned")
        void testCreateStoresReadyWorkflow() {
            Workflow workflow = engine.orchestrator.createWorkflow(request("etl", List.of(
                    step("loop", new StepConfig.LoopConfig("iteration < 2", List.of("body"), 3)),
                    task("body")),
                List.of()));

            assertThat(workflow.status()).isEqualTo(WorkflowStatus.READY);
            assertThat(workflow.version()).isEqualTo(1);
            WorkflowStep body = engine.step(workflow.id(), "body");
            assertThat(body.parentStepId()).isEqualTo("loop");
            assertThat(body.iteration()).isEqualTo(1);

            assertThat(engine.auditOf(workflow.id(), AuditEventType.WORKFLOW_TRANSITION))
                .extracting(AuditEntry::toStatus)
                .containsExactly("DRAFT", "READY");
        }

        @Test
        @DisplayName("Versions increase per workflow name")
        void testVersioning() {
            engine.orchestrator.createWorkflow(request("etl", List.of(task("a")), List.of()));
            Workflow second = engine.orchestrator.createWorkflow(request("etl", List.of(task("a")), List.of()));

            assertThat(second.version()).isEqualTo(2);
        }

        @Test
        @DisplayName("Explicit edges that close a cycle are rejected")
        void testExplicitCycle() {
            List<EdgeDefinition> edges = List.of(after("b", "a"), after("c", "b"), after("a", "c"));

            assertThatThrownBy(() -> engine.orchestrator.createWorkflow(
                    request("cyclic", List.of(task("a"), task("b"), task("c")), edges)))
                .isInstanceOf(CycleException.class);
            assertThat(engine.store.findWorkflowsByStatus(EnumSet.allOf(WorkflowStatus.class))).isEmpty();
        }

        @Test
        @DisplayName("Edge from a child to its own container is a cycle")
        void testStructuralCycle() {
            assertThatThrownBy(() -> engine.orchestrator.createWorkflow(request("nested", List.of(
                    step("p", new StepConfig.ParallelConfig(List.of("a"))),
                    task("a")),
                List.of(after("a", "p")))))
                .isInstanceOf(CycleException.class);
        }

        @Test
        @DisplayName("Malformed definitions are rejected with a validation error")
        void testInvalidDefinitions() {
            assertInvalid(request("empty", List.of(), List.of()));
            assertInvalid(request("dup", List.of(task("a"), task("a")), List.of()));
            assertInvalid(request("hash", List.of(task("a#2")), List.of()));
            assertInvalid(request("dangling", List.of(task("a")), List.of(after("a", "ghost"))));
            assertInvalid(request("self", List.of(task("a")), List.of(after("a", "a"))));
            assertInvalid(request("unknown-child", List.of(
                step("p", new StepConfig.ParallelConfig(List.of("ghost")))), List.of()));
            assertInvalid(request("two-owners", List.of(
                step("p", new StepConfig.ParallelConfig(List.of("a"))),
                step("s", new StepConfig.SequentialConfig(List.of("a"))),
                task("a")), List.of()));
            assertInvalid(request("nested-loop-body", List.of(
                step("loop", new StepConfig.LoopConfig("true", List.of("p"), 2)),
                step("p", new StepConfig.ParallelConfig(List.of("a"))),
                task("a")), List.of()));
            assertInvalid(request("zero-iterations", List.of(
                step("loop", new StepConfig.LoopConfig("true", List.of("a"), 0)),
                task("a")), List.of()));
            assertInvalid(request("idle-wait", List.of(
                step("w", new StepConfig.WaitConfig(null, null))), List.of()));
            assertInvalid(request("timed-wait", List.of(
                new StepDefinition("w", "w", new StepConfig.WaitConfig(Duration.ofSeconds(10), null),
                    null, null, null, Duration.ofSeconds(2), null, null)), List.of()));
            assertInvalid(request("same-key", List.of(
                step("h1", new StepConfig.WebhookConfig("k", null)),
                step("h2", new StepConfig.WebhookConfig("k", null))), List.of()));
            assertInvalid(request("no-predicate", List.of(
                step("c", new StepConfig.ConditionConfig(" ", List.of(), List.of()))), List.of()));
            assertInvalid(new CreateWorkflowRequest("bad-ceiling", null, 0, null, null, null, "test",
                List.of(task("a")), List.of()));
            assertInvalid(new CreateWorkflowRequest("bad-timeout", null, null, Duration.ZERO, null, null, "test",
                List.of(task("a")), List.of()));
        }

        @Test
        @DisplayName("Steps that can never fit the resource budget are rejected")
        void testOversizedStep() {
            StepDefinition huge = new StepDefinition("huge", "huge",
                new StepConfig.TaskConfig(TaskType.of("noop"), null), null, null, null, null, null,
                ResourceRequirement.cpuAndMemory(64.0, 1024));

            assertInvalid(request("oversized", List.of(huge), List.of()));
        }

        private void assertInvalid(CreateWorkflowRequest request) {
            assertThatThrownBy(() -> engine.orchestrator.createWorkflow(request))
                .as(request.name())
                .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Drafts skip validation until validated explicitly")
        void testDraftThenValidate() {
            Workflow draft = engine.orchestrator.saveDraft(request("draft", List.of(task("a")), List.of()));
            assertThat(draft.status()).isEqualTo(WorkflowStatus.DRAFT);

            Workflow validated = engine.orchestrator.validateWorkflow(draft.id());
            assertThat(validated.status()).isEqualTo(WorkflowStatus.READY);

            assertThatThrownBy(() -> engine.orchestrator.validateWorkflow(draft.id()))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Invalid drafts stay drafts")
        void testInvalidDraft() {
            Workflow draft = engine.orchestrator.saveDraft(
                request("draft", List.of(task("a")), List.of(after("a", "ghost"))));

            assertThatThrownBy(() -> engine.orchestrator.validateWorkflow(draft.id()))
                .isInstanceOf(ValidationException.class);
            assertThat(engine.workflow(draft.id()).status()).isEqualTo(WorkflowStatus.DRAFT);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Only READY workflows start")
        void testStartRequiresReady() {
            Workflow draft = engine.orchestrator.saveDraft(request("draft", List.of(task("a")), List.of()));

            assertThatThrownBy(() -> engine.orchestrator.startWorkflow(draft.id()))
                .isInstanceOf(InvalidStateTransitionException.class);
            assertThatThrownBy(() -> engine.orchestrator.startWorkflow(UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Pausing parks running wait steps and resuming restores them")
        void testPauseParksWaitSteps() {
            UUID workflowId = engine.startWorkflow("hold", List.of(
                    step("w", new StepConfig.WaitConfig(Duration.ofMinutes(1), null))),
                List.of());
            engine.tick();
            assertThat(engine.status(workflowId, "w")).isEqualTo(NodeStatus.RUNNING);

            engine.orchestrator.pauseWorkflow(workflowId, "maintenance");
            assertThat(engine.workflow(workflowId).status()).isEqualTo(WorkflowStatus.PAUSED);
            assertThat(engine.status(workflowId, "w")).isEqualTo(NodeStatus.PAUSED);

            engine.orchestrator.resumeWorkflow(workflowId);
            assertThat(engine.status(workflowId, "w")).isEqualTo(NodeStatus.RUNNING);

            engine.clock.advanceMinutes(1);
            assertThat(engine.runToCompletion(workflowId, 5).status()).isEqualTo(WorkflowStatus.COMPLETED);
        }

        @Test
        @DisplayName("Terminal workflows cannot be cancelled again")
        void testCancelTerminal() {
            UUID workflowId = engine.startWorkflow("quick", List.of(task("a")), List.of());
            engine.runToCompletion(workflowId, 5);

            assertThatThrownBy(() -> engine.orchestrator.cancelWorkflow(workflowId, "late"))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Status view reports progress and audit")
        void testStatusView() {
            UUID workflowId = engine.startWorkflow("progress", List.of(
                    task("a"),
                    step("w", new StepConfig.WaitConfig(Duration.ofHours(1), null)),
                    task("c")),
                List.of(after("c", "w")));
            engine.tick(2);

            WorkflowStatusView view = engine.orchestrator.getStatus(workflowId);

            assertThat(view.workflow().status()).isEqualTo(WorkflowStatus.RUNNING);
            assertThat(view.steps()).hasSize(3);
            assertThat(view.progressPercentage()).isEqualTo(33.3);
            assertThat(view.audit()).isNotEmpty();
            assertThat(engine.orchestrator.getActiveWorkflows()).extracting(Workflow::id).containsExactly(workflowId);
        }

        @Test
        @DisplayName("Completion records results and no root cause")
        void testCompletionResults() {
            UUID workflowId = engine.startWorkflow("done", List.of(task("a"), task("b")), List.of(after("b", "a")));

            Workflow finished = engine.runToCompletion(workflowId, 5);

            assertThat(finished.status()).isEqualTo(WorkflowStatus.COMPLETED);
            assertThat(finished.completedAt()).isNotNull();
            assertThat(finished.rootCauseStepId()).isNull();
            assertThat(finished.results().has("a")).isTrue();
            assertThat(engine.orchestrator.evaluateCompletion(workflowId)).isEmpty();
        }
    }
}
