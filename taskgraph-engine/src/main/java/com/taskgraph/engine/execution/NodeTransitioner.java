package com.taskgraph.engine.execution;

import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.model.ErrorInfo;
import com.taskgraph.core.model.NodeLifecycle;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.model.NodeStatus;
import com.taskgraph.core.model.TransitionPayload;
import com.taskgraph.core.repository.GraphStore;
import com.taskgraph.engine.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single entry point for node status writes.
 *
 * Each write is a compare-and-swap through {@link GraphStore#saveTransition}.
 * A stale write is discarded, so the first writer wins and the loser
 * re-evaluates on its next pass.
 */
public class NodeTransitioner {

    private static final Logger log = LoggerFactory.getLogger(NodeTransitioner.class);

    private final GraphStore graphStore;
    private final OrchestratorMetrics metrics;
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    public NodeTransitioner(GraphStore graphStore, OrchestratorMetrics metrics) {
        this.graphStore = graphStore;
        this.metrics = metrics;
        addListener((node, from, lifecycle) -> {
            metrics.nodeTransition(node.kind(), from, lifecycle.status());
            if (lifecycle.status() == NodeStatus.COMPLETED && lifecycle.actualDuration() != null) {
                metrics.nodeCompleted(node.kind(), lifecycle.actualDuration());
            }
        });
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    /**
     * Attempt a transition.
     *
     * @return the new lifecycle, or empty if the node was no longer in {@code from}
     *         or the transition is not allowed
     */
    public Optional<NodeLifecycle> transition(NodeRef node, NodeStatus from, NodeStatus to, TransitionPayload payload) {
        NodeLifecycle lifecycle;
        try {
            lifecycle = graphStore.saveTransition(node, from, to, payload);
        } catch (ConflictException e) {
            log.debug("Discarded stale transition {} -> {} on {}: {}", from, to, node, e.getMessage());
            metrics.transitionConflict();
            return Optional.empty();
        } catch (InvalidStateTransitionException e) {
            log.warn("Refused transition {} -> {} on {}: {}", from, to, node, e.getMessage());
            return Optional.empty();
        }

        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(node, from, lifecycle);
            } catch (RuntimeException e) {
                log.error("Transition listener failed for {} ({} -> {})", node, from, to, e);
            }
        }
        return Optional.of(lifecycle);
    }

    /**
     * Cancel a node from whatever non-final state it is in.
     *
     * @param node The node
     * @param current Its lifecycle as last read
     * @param error Why it is cancelled
     * @param actor Who cancels it
     * @return true if the node is now cancelled by this call
     */
    public boolean cancel(NodeRef node, NodeLifecycle current, ErrorInfo error, String actor) {
        if (current.isFinal() || !current.status().canTransitionTo(NodeStatus.CANCELLED)) {
            return false;
        }
        return transition(node, current.status(), NodeStatus.CANCELLED,
            TransitionPayload.cancelled(error, actor)).isPresent();
    }
}
