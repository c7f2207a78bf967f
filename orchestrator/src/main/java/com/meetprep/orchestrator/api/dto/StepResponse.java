package com.meetprep.orchestrator.api.dto;

import com.meetprep.orchestrator.step.StepManifest;

import java.util.List;

/**
 * Read-only view of a registered step returned by GET /api/v1/steps.
 */
public record StepResponse(String name, String description, List<String> inputs, List<String> outputs) {

    public static StepResponse from(StepManifest m) {
        return new StepResponse(m.name(), m.description(), m.inputKeys(), m.outputKeys());
    }
}
