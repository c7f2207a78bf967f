package com.meetprep.orchestrator.step.remote;

import com.meetprep.orchestrator.step.ResearchStep;
import com.meetprep.orchestrator.step.StepExecutionContext;
import com.meetprep.orchestrator.step.StepInputs;
import com.meetprep.orchestrator.step.StepManifest;

/**
 * A catalog step executed by the research tool service.
 */
public final class RemoteResearchStep implements ResearchStep {

    private final StepManifest       manifest;
    private final ResearchToolClient client;

    public RemoteResearchStep(StepManifest manifest, ResearchToolClient client) {
        this.manifest = manifest;
        this.client   = client;
    }

    @Override public StepManifest manifest() { return manifest; }

    @Override
    public Object execute(StepInputs inputs, StepExecutionContext ctx) throws InterruptedException {
        return client.invoke(manifest.name(), ctx.jobId(), inputs.asMap());
    }
}
