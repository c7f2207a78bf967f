package com.meetprep.orchestrator.step;

/**
 * Runtime context passed to every step invocation, so remote calls and log
 * lines can be tagged with the owning job.
 */
public record StepExecutionContext(String jobId, String stepName) {}
