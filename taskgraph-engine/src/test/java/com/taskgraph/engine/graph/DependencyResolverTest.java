package com.taskgraph.engine.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.exception.CycleException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.ValidationException;
import com.taskgraph.core.model.*;
import com.taskgraph.engine.service.TaskService.AddDependencyRequest;
import com.taskgraph.engine.service.TaskService.CreateTaskRequest;
import com.taskgraph.engine.test.EngineHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class DependencyResolverTest {

    private EngineHarness engine;

    @BeforeEach
    void setUp() {
        ObjectMapper json = new ObjectMapper();
        engine = new EngineHarness((context, config, input) -> json.createObjectNode().put("score", 5));
    }

    private UUID task(String name) {
        return engine.tasks.createTask(new CreateTaskRequest(name, null, "noop", null, null, null,
            null, null, null, null, null, null, null)).id();
    }

    private void depend(UUID dependent, UUID dependsOn) {
        engine.tasks.addDependency(dependent, new AddDependencyRequest(dependsOn, null, null, false));
    }

    // ========== Acyclicity ==========

    @Test
    @DisplayName("Edge closing a cycle is rejected and nothing is stored")
    void testCycleRejectedWithoutMutation() {
        UUID a = task("a");
        UUID b = task("b");
        UUID c = task("c");
        depend(b, a);
        depend(c, b);
        int auditBefore = engine.audit.size();

        assertThatThrownBy(() -> depend(a, c)).isInstanceOf(CycleException.class);

        assertThat(engine.store.findEdgesInScope(NodeRef.TASK_SCOPE)).hasSize(2);
        assertThat(engine.store.findUpstreamEdges(NodeRef.task(a))).isEmpty();
        assertThat(engine.resolver.upstreamOf(NodeRef.task(a))).isEmpty();
        assertThat(engine.audit.size()).isEqualTo(auditBefore);
    }

    @Test
    @DisplayName("Accepted edge is indexed and audited")
    void testEdgeIndexedAndAudited() {
        UUID a = task("a");
        UUID b = task("b");
        depend(b, a);

        assertThat(engine.resolver.downstreamOf(NodeRef.task(a))).containsExactly(NodeRef.task(b));
        assertThat(engine.audit.findByNode(NodeRef.task(b).key()))
            .extracting(AuditEntry::type)
            .containsExactly(AuditEventType.EDGE_ADDED);
    }

    @Test
    @DisplayName("Self, duplicate, dangling and bare conditional edges are invalid")
    void testInvalidEdges() {
        UUID a = task("a");
        UUID b = task("b");
        depend(b, a);

        assertThatThrownBy(() -> depend(a, a)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> depend(b, a)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> depend(b, UUID.randomUUID())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> engine.tasks.addDependency(a,
                new AddDependencyRequest(b, DependencyType.CONDITIONAL, " ", false)))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Edges across scopes are invalid")
    void testCrossScopeEdgeRejected() {
        UUID a = task("a");
        NodeRef step = NodeRef.step(UUID.randomUUID(), "s1");

        assertThatThrownBy(() -> engine.resolver.addEdge(DependencyEdge.completion(NodeRef.task(a), step)))
            .isInstanceOf(ValidationException.class);
    }

    // ========== Readiness ==========

    @Test
    @DisplayName("Dependent waits while upstream runs and becomes ready on completion")
    void testCompletionEdgeReadiness() {
        UUID a = task("a");
        UUID b = task("b");
        depend(b, a);

        Readiness before = engine.resolver.evaluate(engine.store.findTask(b).orElseThrow());
        assertThat(before.state()).isEqualTo(Readiness.State.WAITING);

        engine.tick();
        assertThat(engine.store.findTask(a).orElseThrow().status()).isEqualTo(NodeStatus.COMPLETED);
        assertThat(engine.resolver.evaluate(engine.store.findTask(b).orElseThrow()).isReady()).isTrue();
        assertThat(engine.resolver.readySet(NodeRef.TASK_SCOPE)).containsExactly(NodeRef.task(b));
    }

    @Test
    @DisplayName("Conditional edge reads the upstream output")
    void testConditionalEdge() {
        UUID a = task("a");
        UUID pass = task("pass");
        UUID skip = task("skip");
        engine.tasks.addDependency(pass, new AddDependencyRequest(a, DependencyType.CONDITIONAL, "upstream.score > 3", false));
        engine.tasks.addDependency(skip, new AddDependencyRequest(a, DependencyType.CONDITIONAL, "upstream.score > 10", false));

        engine.tick(3);

        assertThat(engine.store.findTask(pass).orElseThrow().status()).isEqualTo(NodeStatus.COMPLETED);
        Task skipped = engine.store.findTask(skip).orElseThrow();
        assertThat(skipped.status()).isEqualTo(NodeStatus.CANCELLED);
        assertThat(skipped.lifecycle().error().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILED);
    }

    @Test
    @DisplayName("Optional edge is satisfied by a cancelled upstream")
    void testOptionalEdge() {
        UUID a = task("a");
        UUID b = task("b");
        engine.tasks.addDependency(b, new AddDependencyRequest(a, null, null, true));
        engine.tasks.cancelTask(a, "not needed");

        engine.tick();

        assertThat(engine.store.findTask(b).orElseThrow().status()).isEqualTo(NodeStatus.COMPLETED);
    }

    @Test
    @DisplayName("Required edge to a cancelled upstream blocks and cancels the dependent")
    void testBlockedDependent() {
        UUID a = task("a");
        UUID b = task("b");
        depend(b, a);
        engine.tasks.cancelTask(a, "not needed");

        Readiness readiness = engine.resolver.evaluate(engine.store.findTask(b).orElseThrow());
        assertThat(readiness.isBlocked()).isTrue();
        assertThat(readiness.cause()).isEqualTo(a.toString());

        engine.tick();
        assertThat(engine.store.findTask(b).orElseThrow().status()).isEqualTo(NodeStatus.CANCELLED);
    }

    @Test
    @DisplayName("Data edge to an upstream with output becomes ready")
    void testDataEdgeWithOutput() {
        UUID a = task("a");
        UUID b = task("b");
        engine.tasks.addDependency(b, new AddDependencyRequest(a, DependencyType.DATA, null, false));

        engine.tick(3);

        assertThat(engine.store.findTask(a).orElseThrow().lifecycle().output().get("score").asInt()).isEqualTo(5);
        assertThat(engine.store.findTask(b).orElseThrow().status()).isEqualTo(NodeStatus.COMPLETED);
    }

    @Test
    @DisplayName("Data edge to an upstream that completed without output cancels the dependent")
    void testDataEdgeWithoutOutput() {
        engine = new EngineHarness((context, config, input) -> null);
        UUID a = task("a");
        UUID b = task("b");
        engine.tasks.addDependency(b, new AddDependencyRequest(a, DependencyType.DATA, null, false));

        engine.tick();
        assertThat(engine.store.findTask(a).orElseThrow().status()).isEqualTo(NodeStatus.COMPLETED);
        Readiness readiness = engine.resolver.evaluate(engine.store.findTask(b).orElseThrow());
        assertThat(readiness.isBlocked()).isTrue();
        assertThat(readiness.cause()).isEqualTo(a.toString());

        engine.tick(2);
        Task cancelled = engine.store.findTask(b).orElseThrow();
        assertThat(cancelled.status()).isEqualTo(NodeStatus.CANCELLED);
        assertThat(cancelled.lifecycle().error().kind()).isEqualTo(ErrorKind.UPSTREAM_FAILED);
    }

    @Test
    @DisplayName("Resource edge waits while the upstream still holds its resources")
    void testResourceEdgeWaitsForRelease() {
        UUID a = task("a");
        engine.tick();
        assertThat(engine.store.findTask(a).orElseThrow().status()).isEqualTo(NodeStatus.COMPLETED);

        NodeRef upstream = NodeRef.task(a);
        assertThat(engine.allocator.tryAdmit(upstream, null)).isPresent();
        UUID b = task("b");
        engine.tasks.addDependency(b, new AddDependencyRequest(a, DependencyType.RESOURCE, null, false));

        engine.tick(2);
        Task waiting = engine.store.findTask(b).orElseThrow();
        assertThat(waiting.status().isWaiting()).isTrue();
        Readiness readiness = engine.resolver.evaluate(waiting);
        assertThat(readiness.isReady()).isFalse();
        assertThat(readiness.isBlocked()).isFalse();

        assertThat(engine.allocator.releaseFor(upstream)).isTrue();
        engine.tick(2);
        assertThat(engine.store.findTask(b).orElseThrow().status()).isEqualTo(NodeStatus.COMPLETED);
    }

    // ========== Structure ==========

    @Test
    @DisplayName("Structural edges order sequential children and hang containers on their children")
    void testStructuralEdges() {
        UUID workflowId = UUID.randomUUID();
        WorkflowStep seq = WorkflowStep.builder().workflowId(workflowId).stepId("seq")
            .config(new StepConfig.SequentialConfig(List.of("one", "two"))).build();
        WorkflowStep one = leaf(workflowId, "one", 0).withParent("seq", 0);
        WorkflowStep two = leaf(workflowId, "two", 1).withParent("seq", 0);

        var edges = DependencyResolver.structuralEdges(List.of(seq, one, two));

        assertThat(edges).extracting(e -> e.getKey().nodeId() + "<-" + e.getValue().nodeId())
            .containsExactlyInAnyOrder("seq<-one", "seq<-two", "two<-one");
    }

    private static WorkflowStep leaf(UUID workflowId, String stepId, int order) {
        return WorkflowStep.builder()
            .workflowId(workflowId)
            .stepId(stepId)
            .stepOrder(order)
            .config(new StepConfig.TaskConfig(TaskType.of("noop"), null))
            .build();
    }
}
