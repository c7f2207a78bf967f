package com.meetprep.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the whole application with the stub step provider and drives a
 * full preparation job through the HTTP API until it finishes.
 */
@SpringBootTest(properties = "meetprep.steps.provider=stub")
@AutoConfigureMockMvc
class OrchestratorApplicationTest {

    @Autowired MockMvc      mockMvc;
    @Autowired ObjectMapper objectMapper;

    @Test
    void fullWorkflow_runsToCompletionOverHttp() throws Exception {
        String accepted = mockMvc.perform(post("/api/v1/meetings/prepare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"meeting_context\":\"Platform sync\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String jobId = objectMapper.readTree(accepted).get("job_id").asText();

        JsonNode job = null;
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            String body = mockMvc.perform(get("/api/v1/jobs/{id}", jobId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            job = objectMapper.readTree(body);
            if (job.get("status").asText().equals("completed")) break;
            Thread.sleep(20);
        }

        assertThat(job).isNotNull();
        assertThat(job.get("status").asText()).isEqualTo("completed");
        assertThat(job.get("results").get("final_output").asText()).startsWith("# Meeting briefing");
        assertThat(job.get("progress").get("completed_steps")).hasSize(5);
    }

    @Test
    void steps_listsTheCatalog() throws Exception {
        mockMvc.perform(get("/api/v1/steps"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(8));
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
