package com.meetprep.orchestrator.step.remote;

import com.meetprep.orchestrator.step.ResearchStep;
import com.meetprep.orchestrator.step.StepCatalog;
import com.meetprep.orchestrator.step.StepProvider;
import com.meetprep.orchestrator.step.StepProviderMode;

import java.util.List;

/**
 * Registers every catalog step as a call to the research tool service.
 */
public class RemoteStepProvider implements StepProvider {

    private final ResearchToolClient client;

    public RemoteStepProvider(ResearchToolClient client) {
        this.client = client;
    }

    @Override
    public StepProviderMode mode() {
        return StepProviderMode.REMOTE;
    }

    @Override
    public List<ResearchStep> steps() {
        return StepCatalog.ALL.stream()
                .<ResearchStep>map(manifest -> new RemoteResearchStep(manifest, client))
                .toList();
    }
}
