package com.taskgraph.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.NodeRef;
import com.taskgraph.core.spi.WebhookCompletionChannel;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Inbound signals for webhook steps.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private final WebhookCompletionChannel channel;

    public WebhookController(WebhookCompletionChannel channel) {
        this.channel = channel;
    }

    @PostMapping("/steps/{workflowId}/{stepId}/complete")
    public ResponseEntity<Map<String, Object>> complete(
            @PathVariable UUID workflowId,
            @PathVariable String stepId,
            @RequestBody(required = false) JsonNode output) {

        channel.complete(NodeRef.step(workflowId, stepId), output);
        return ResponseEntity.ok(Map.of("completed", true));
    }

    @PostMapping("/steps/{workflowId}/{stepId}/fail")
    public ResponseEntity<Map<String, Object>> fail(
            @PathVariable UUID workflowId,
            @PathVariable String stepId,
            @RequestBody FailRequest request) {

        channel.fail(NodeRef.step(workflowId, stepId), request.errorCode(), request.message());
        return ResponseEntity.ok(Map.of("recorded", true));
    }

    /**
     * Complete whichever running webhook step waits on this callback key.
     */
    @PostMapping("/callbacks/{callbackKey}")
    public ResponseEntity<Map<String, Object>> callback(
            @PathVariable String callbackKey,
            @RequestBody(required = false) JsonNode output) {

        NodeRef step = channel.completeByKey(callbackKey, output);
        return ResponseEntity.ok(Map.of(
            "completed", true,
            "workflowId", step.workflowId(),
            "stepId", step.nodeId()
        ));
    }

    public record FailRequest(String errorCode, String message) {}
}
