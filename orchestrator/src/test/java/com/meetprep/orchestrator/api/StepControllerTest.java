package com.meetprep.orchestrator.api;

import com.meetprep.orchestrator.step.StepCatalog;
import com.meetprep.orchestrator.step.StepRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StepController.class)
class StepControllerTest {

    @Autowired MockMvc        mockMvc;
    @MockitoBean StepRegistry registry;

    @Test
    void listSteps_returnsManifests() throws Exception {
        when(registry.manifests()).thenReturn(List.of(
                StepCatalog.CALENDAR_MANIFEST, StepCatalog.COORDINATOR_MANIFEST));

        mockMvc.perform(get("/api/v1/steps"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("calendar"))
                .andExpect(jsonPath("$[0].inputs[0]").value("meeting_context"))
                .andExpect(jsonPath("$[1].outputs[1]").value("final_output"));
    }
}
