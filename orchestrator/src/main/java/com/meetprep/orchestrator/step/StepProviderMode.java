package com.meetprep.orchestrator.step;

/**
 * Which {@link StepProvider} variant backs the registry.
 *
 * STUB   — deterministic in-process steps; no credentials or network needed.
 * REMOTE — every step is a call to the external research tool service.
 */
public enum StepProviderMode {
    STUB,
    REMOTE
}
