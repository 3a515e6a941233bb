package com.taskgraph.engine.graph;

import com.taskgraph.core.model.NodeRef;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Incrementally maintained transitive closure of the dependency graph, one per scope.
 *
 * For every node the index holds everything downstream (nodes that wait on it,
 * directly or transitively) and everything upstream. A cycle check is a set
 * lookup; an insertion joins the upstream closure of the new upstream with the
 * downstream closure of the new dependent.
 */
public class ReachabilityIndex {

    private final Map<String, Closure> scopes = new HashMap<>();

    /**
     * Check whether {@code dependent} waiting on {@code dependsOn} would close a cycle.
     */
    public synchronized boolean wouldCreateCycle(NodeRef dependent, NodeRef dependsOn) {
        if (dependent.equals(dependsOn)) {
            return true;
        }
        Closure closure = scopes.get(dependent.scope());
        return closure != null && closure.downstream(dependent).contains(dependsOn);
    }

    /**
     * Record that {@code dependent} waits on {@code dependsOn}.
     *
     * @throws IllegalArgumentException if the edge would close a cycle
     */
    public synchronized void addEdge(NodeRef dependent, NodeRef dependsOn) {
        if (wouldCreateCycle(dependent, dependsOn)) {
            throw new IllegalArgumentException("Edge " + dependent + " -> " + dependsOn + " closes a cycle");
        }
        scopes.computeIfAbsent(dependent.scope(), s -> new Closure()).add(dependsOn, dependent);
    }

    /**
     * Nodes that transitively wait on the given node.
     */
    public synchronized Set<NodeRef> downstreamOf(NodeRef node) {
        Closure closure = scopes.get(node.scope());
        return closure == null ? Set.of() : Set.copyOf(closure.downstream(node));
    }

    /**
     * Nodes the given node transitively waits on.
     */
    public synchronized Set<NodeRef> upstreamOf(NodeRef node) {
        Closure closure = scopes.get(node.scope());
        return closure == null ? Set.of() : Set.copyOf(closure.upstream(node));
    }

    public synchronized boolean isLoaded(String scope) {
        return scopes.containsKey(scope);
    }

    /**
     * Replace a scope's closure with one built from the given edges.
     *
     * @param scope The scope
     * @param edges Pairs of (dependent, dependsOn)
     * @throws IllegalArgumentException if the edges contain a cycle
     */
    public synchronized void rebuild(String scope, Collection<Map.Entry<NodeRef, NodeRef>> edges) {
        Closure previous = scopes.put(scope, new Closure());
        try {
            for (Map.Entry<NodeRef, NodeRef> edge : edges) {
                addEdge(edge.getKey(), edge.getValue());
            }
        } catch (IllegalArgumentException e) {
            if (previous != null) {
                scopes.put(scope, previous);
            } else {
                scopes.remove(scope);
            }
            throw e;
        }
    }

    public synchronized void dropScope(String scope) {
        scopes.remove(scope);
    }

    private static final class Closure {
        private final Map<NodeRef, Set<NodeRef>> downstream = new HashMap<>();
        private final Map<NodeRef, Set<NodeRef>> upstream = new HashMap<>();

        Set<NodeRef> downstream(NodeRef node) {
            return downstream.getOrDefault(node, Set.of());
        }

        Set<NodeRef> upstream(NodeRef node) {
            return upstream.getOrDefault(node, Set.of());
        }

        /**
         * Add the flow {@code from -> to}: {@code to} waits on {@code from}.
         */
        void add(NodeRef from, NodeRef to) {
            Set<NodeRef> sources = new LinkedHashSet<>(upstream(from));
            sources.add(from);
            Set<NodeRef> targets = new LinkedHashSet<>(downstream(to));
            targets.add(to);

            for (NodeRef source : sources) {
                downstream.computeIfAbsent(source, n -> new HashSet<>()).addAll(targets);
            }
            for (NodeRef target : targets) {
                upstream.computeIfAbsent(target, n -> new HashSet<>()).addAll(sources);
            }
        }
    }
}
