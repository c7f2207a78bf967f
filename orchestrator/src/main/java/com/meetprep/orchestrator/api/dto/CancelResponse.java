package com.meetprep.orchestrator.api.dto;

/** Response body for POST /api/v1/jobs/{id}/cancel. */
public record CancelResponse(String jobId, boolean cancelled) {}
