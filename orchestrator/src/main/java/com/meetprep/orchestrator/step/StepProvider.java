package com.meetprep.orchestrator.step;

import java.util.List;

/**
 * Source of the research steps registered at startup.
 *
 * Exactly one provider is selected per process (see {@link StepProviderMode});
 * there is no per-call fallback from one variant to the other.
 */
public interface StepProvider {

    StepProviderMode mode();

    List<ResearchStep> steps();
}
