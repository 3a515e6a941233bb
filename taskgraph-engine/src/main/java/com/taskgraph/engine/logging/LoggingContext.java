package com.taskgraph.engine.logging;

import com.taskgraph.core.model.NodeRef;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forNode(ref, attempt)) {
 *     log.info("Running step"); // Automatically includes workflowId, nodeId, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [taskgraph-worker-1] INFO  c.t.e.e.RunnerDispatcher - Running step
 *   workflowId=abc-123 nodeId=step:abc-123:build attempt=2 traceId=1f2e3d4c
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String NODE_ID = "nodeId";
    public static final String ATTEMPT = "attempt";
    public static final String SWEEP = "sweep";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for workflow-level operations.
     */
    public static LoggingContext forWorkflow(UUID workflowId) {
        LoggingContext ctx = new LoggingContext();
        if (workflowId != null) {
            MDC.put(WORKFLOW_ID, workflowId.toString());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a single attempt of a task or step.
     */
    public static LoggingContext forNode(NodeRef node, int attempt) {
        LoggingContext ctx = new LoggingContext();
        if (node.workflowId() != null) {
            MDC.put(WORKFLOW_ID, node.workflowId().toString());
        }
        MDC.put(NODE_ID, node.key());
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a periodic sweep.
     */
    public static LoggingContext forSweep(String sweepName) {
        LoggingContext ctx = new LoggingContext();
        MDC.put(SWEEP, sweepName);
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current workflow ID from context.
     */
    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    public static String getNodeId() {
        return MDC.get(NODE_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(NODE_ID);
        MDC.remove(ATTEMPT);
        MDC.remove(SWEEP);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
