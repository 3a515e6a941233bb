package com.taskgraph.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Directed dependency: {@code dependent} waits on {@code dependsOn}.
 *
 * Invariants:
 * - dependent != dependsOn
 * - both ends share a scope
 * - CONDITIONAL edges carry a condition expression
 */
public record DependencyEdge(
    NodeRef dependent,
    NodeRef dependsOn,
    DependencyType type,
    String conditionExpression,
    boolean optional,
    Instant createdAt
) {
    public DependencyEdge {
        Objects.requireNonNull(dependent, "dependent");
        Objects.requireNonNull(dependsOn, "dependsOn");
        Objects.requireNonNull(type, "type");
    }

    public static DependencyEdge completion(NodeRef dependent, NodeRef dependsOn) {
        return new DependencyEdge(dependent, dependsOn, DependencyType.COMPLETION, null, false, Instant.now());
    }

    public static DependencyEdge of(NodeRef dependent, NodeRef dependsOn, DependencyType type) {
        return new DependencyEdge(dependent, dependsOn, type, null, false, Instant.now());
    }

    public static DependencyEdge conditional(NodeRef dependent, NodeRef dependsOn, String expression) {
        return new DependencyEdge(dependent, dependsOn, DependencyType.CONDITIONAL, expression, false, Instant.now());
    }

    public DependencyEdge asOptional() {
        return new DependencyEdge(dependent, dependsOn, type, conditionExpression, true, createdAt);
    }

    public String scope() {
        return dependent.scope();
    }

    /**
     * Uniqueness key: one edge per (dependent, dependsOn, type).
     */
    public String key() {
        return dependent.key() + "->" + dependsOn.key() + "#" + type;
    }
}
