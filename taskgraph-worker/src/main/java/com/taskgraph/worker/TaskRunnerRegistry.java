package com.taskgraph.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.model.TaskType;
import com.taskgraph.core.spi.RunContext;
import com.taskgraph.core.spi.TaskRunner;
import com.taskgraph.core.spi.TaskRunnerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TaskRunner} that routes each attempt to the handler registered for its task type.
 *
 * Usage:
 * <pre>
 * TaskRunnerRegistry registry = new TaskRunnerRegistry(objectMapper);
 * registry.register(TaskType.NOTIFICATION, context -> {
 *     // send the notification
 *     return context.toJsonNode(Map.of("sent", true));
 * });
 * registry.registerCustom("score", context -> ...);
 * </pre>
 */
public class TaskRunnerRegistry implements TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunnerRegistry.class);

    public static final String NO_HANDLER = "NO_HANDLER";
    public static final String HANDLER_ERROR = "HANDLER_ERROR";

    private static final String MDC_TASK_TYPE = "taskType";

    private final Map<TaskType, TaskHandler> handlers = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public TaskRunnerRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Register a handler for a task type, replacing any previous one.
     */
    public TaskRunnerRegistry register(TaskType taskType, TaskHandler handler) {
        TaskHandler previous = handlers.put(taskType, handler);
        if (previous != null) {
            log.warn("Replaced handler for task type: {}", taskType);
        } else {
            log.info("Registered handler for task type: {}", taskType);
        }
        return this;
    }

    /**
     * Register the handler that custom steps name in their configuration.
     */
    public TaskRunnerRegistry registerCustom(String handlerName, TaskHandler handler) {
        return register(TaskType.custom(handlerName), handler);
    }

    public boolean supports(TaskType taskType) {
        return handlers.containsKey(taskType);
    }

    public Set<TaskType> registeredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public JsonNode execute(RunContext context, JsonNode config, JsonNode input) throws TaskRunnerException {
        TaskHandler handler = handlers.get(context.getTaskType());
        if (handler == null) {
            throw TaskRunnerException.permanent(NO_HANDLER,
                "No handler registered for task type: " + context.getTaskType());
        }

        MDC.put(MDC_TASK_TYPE, context.getTaskType().name());
        try {
            log.debug("Executing {} attempt {} of {}",
                context.getTaskType(), context.getAttempt(), context.getNode());
            return handler.execute(new HandlerContext(context, config, input, objectMapper));
        } catch (TaskHandlerException e) {
            throw new TaskRunnerException(e.getErrorCode(), e.getMessage(), e, e.isRetryable());
        } catch (RuntimeException e) {
            log.error("Handler for {} threw unexpectedly on {}", context.getTaskType(), context.getNode(), e);
            throw new TaskRunnerException(HANDLER_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } finally {
            MDC.remove(MDC_TASK_TYPE);
        }
    }
}
