package com.meetprep.orchestrator.api;

import com.meetprep.orchestrator.api.dto.StepResponse;
import com.meetprep.orchestrator.step.StepRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/steps — the steps a custom workflow may name, with the keys
 * each one reads and writes.
 */
@RestController
@RequestMapping("/api/v1/steps")
public class StepController {

    private final StepRegistry registry;

    public StepController(StepRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<StepResponse> listSteps() {
        return registry.manifests().stream()
                .map(StepResponse::from)
                .toList();
    }
}
