package com.meetprep.orchestrator.api.dto;

/** Response body for POST /api/v1/steps/{name}/run. */
public record StepRunResponse(String step, String status, Object data, long executionTimeMs) {

    public static StepRunResponse success(String step, Object data, long executionTimeMs) {
        return new StepRunResponse(step, "success", data, executionTimeMs);
    }
}
