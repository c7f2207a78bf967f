package com.meetprep.orchestrator.step.stub;

import com.meetprep.orchestrator.step.ResearchStep;
import com.meetprep.orchestrator.step.StepExecutionContext;
import com.meetprep.orchestrator.step.StepInputs;
import com.meetprep.orchestrator.step.StepManifest;

import java.util.function.Function;

/**
 * In-process step that renders canned output from its inputs.
 * Used when no research tool service is configured, and in tests.
 */
public final class StubResearchStep implements ResearchStep {

    private final StepManifest manifest;
    private final Function<StepInputs, Object> renderer;

    public StubResearchStep(StepManifest manifest, Function<StepInputs, Object> renderer) {
        this.manifest = manifest;
        this.renderer = renderer;
    }

    @Override public StepManifest manifest() { return manifest; }

    @Override
    public Object execute(StepInputs inputs, StepExecutionContext ctx) {
        return renderer.apply(inputs);
    }
}
