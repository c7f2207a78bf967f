package com.meetprep.orchestrator.step.stub;

import com.meetprep.orchestrator.step.ResearchStep;
import com.meetprep.orchestrator.step.StepCatalog;
import com.meetprep.orchestrator.step.StepExecutionContext;
import com.meetprep.orchestrator.step.StepInputs;
import com.meetprep.orchestrator.step.StepProviderMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StubStepProviderTest {

    private final StubStepProvider provider = new StubStepProvider();

    private ResearchStep step(String name) {
        return provider.steps().stream()
                .filter(s -> s.manifest().name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private Object run(String name, Map<String, ?> inputs) throws Exception {
        ResearchStep s = step(name);
        return s.execute(StepInputs.select(inputs, s.manifest().inputKeys()),
                new StepExecutionContext("job-1", name));
    }

    @Test
    void providesEveryCatalogStep() {
        assertThat(provider.mode()).isEqualTo(StepProviderMode.STUB);
        assertThat(provider.steps())
                .extracting(ResearchStep::manifest)
                .containsExactlyElementsOf(StepCatalog.ALL);
    }

    @Test
    void calendar_echoesMeetingContext() throws Exception {
        assertThat(run(StepCatalog.CALENDAR, Map.of("meeting_context", "Quarterly review")))
                .asString()
                .startsWith("## Calendar")
                .contains("Quarterly review");
    }

    @Test
    void agenda_usesFocusMode() throws Exception {
        assertThat(run(StepCatalog.AGENDA_BUILDER, Map.of("focus_mode", "blockers")))
                .asString()
                .contains("## Agenda (blockers)");
    }

    @Test
    void coordinator_summarizesOnlyAvailableInputs() throws Exception {
        String out = (String) run(StepCatalog.COORDINATOR, Map.of(
                "calendar", "## Calendar\n- sync",
                "people_research", "## Attendee profiles\n- alice"));

        assertThat(out).startsWith("# Meeting briefing")
                .contains("### calendar", "## Calendar", "### people_research")
                .doesNotContain("### slack_context")
                .doesNotContain("- sync");
    }

    @Test
    void contextBriefing_listsEveryRole() throws Exception {
        String out = (String) run(StepCatalog.CONTEXT_BRIEFING,
                Map.of("participant_roles", Map.of("alice", "Engineering Manager", "bob", "Designer")));

        assertThat(out).contains("alice (Engineering Manager)", "bob (Designer)");
    }

    @Test
    void everyStep_returnsNonNullOutputWithoutInputs() throws Exception {
        for (String name : List.of(StepCatalog.CALENDAR, StepCatalog.SLACK_CONTEXT,
                StepCatalog.PREREAD_COLLECTOR, StepCatalog.TECHNICAL_CONTEXT)) {
            assertThat(run(name, Map.of())).as(name).isNotNull();
        }
    }
}
