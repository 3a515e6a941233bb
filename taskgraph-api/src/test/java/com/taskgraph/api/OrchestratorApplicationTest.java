package com.taskgraph.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.repository.AuditRepository;
import com.taskgraph.engine.persistence.InMemoryAuditRepository;
import com.taskgraph.engine.scheduling.SchedulerLoop;
import com.taskgraph.recovery.RecoveryEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Boots the full application with the default in-memory wiring and runs a workflow over HTTP.
 */
@SpringBootTest(properties = {
    "taskgraph.engine.tick-interval=50ms",
    "taskgraph.engine.timer-poll-interval=50ms",
    "taskgraph.engine.recovery.sweep-interval=1s"
})
@AutoConfigureMockMvc
class OrchestratorApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SchedulerLoop schedulerLoop;

    @Autowired
    private RecoveryEngine recoveryEngine;

    @Autowired
    private AuditRepository auditRepository;

    @Test
    void testContextStartsBackgroundLoops() {
        assertThat(schedulerLoop.isRunning()).isTrue();
        assertThat(recoveryEngine.isRunning()).isTrue();
        assertThat(auditRepository).isInstanceOf(InMemoryAuditRepository.class);
    }

    @Test
    void testWorkflowRunsThroughRealScheduler() throws Exception {
        String created = mockMvc.perform(post("/api/v1/workflows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {
                      "name": "echo-pipeline",
                      "context": {"region": "eu-west"},
                      "steps": [
                        {"stepId": "first", "config": {"type": "task", "taskType": "noop"}},
                        {"stepId": "second", "config": {"type": "task", "taskType": "noop"}}
                      ],
                      "edges": [
                        {"stepId": "second", "dependsOn": "first"}
                      ]
                    }
                    """))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        String workflowId = objectMapper.readTree(created).get("id").asText();

        mockMvc.perform(post("/api/v1/workflows/{id}/start", workflowId))
            .andExpect(status().isOk());

        JsonNode view = null;
        long waitUntil = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < waitUntil) {
            view = objectMapper.readTree(mockMvc.perform(get("/api/v1/workflows/{id}", workflowId))
                .andReturn().getResponse().getContentAsString());
            if ("completed".equals(view.path("workflow").path("status").asText())) {
                break;
            }
            Thread.sleep(50);
        }

        assertThat(view).isNotNull();
        assertThat(view.path("workflow").path("status").asText()).isEqualTo("completed");
        assertThat(view.path("progressPercentage").asDouble()).isEqualTo(100.0);
    }

    @Test
    void testHealthEndpointReportsScheduler() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(jsonPath("$.status").exists());
    }
}
