package com.meetprep.orchestrator.step.stub;

import com.meetprep.orchestrator.step.ResearchStep;
import com.meetprep.orchestrator.step.StepInputs;
import com.meetprep.orchestrator.step.StepProvider;
import com.meetprep.orchestrator.step.StepProviderMode;

import java.util.List;
import java.util.Map;

import static com.meetprep.orchestrator.step.StepCatalog.*;

/**
 * Deterministic stand-ins for every catalog step.
 *
 * Outputs are plain markdown built from the step's inputs, so a caller can
 * see the data flowing through a pipeline without any external service.
 */
public class StubStepProvider implements StepProvider {

    @Override
    public StepProviderMode mode() {
        return StepProviderMode.STUB;
    }

    @Override
    public List<ResearchStep> steps() {
        return List.of(
                new StubResearchStep(CALENDAR_MANIFEST, StubStepProvider::calendar),
                new StubResearchStep(PEOPLE_RESEARCH_MANIFEST, in ->
                        "## Attendee profiles\n"
                        + "- alice@example.com: Engineering Manager, owns the platform roadmap\n"
                        + "- bob@example.com: Staff Engineer, API gateway maintainer\n"
                        + "_Based on:_ " + firstLine(in.text(CALENDAR))),
                new StubResearchStep(TECHNICAL_CONTEXT_MANIFEST, in ->
                        "## Technical context\n"
                        + "- Repository: example-org/platform (12 open issues, 3 labelled blocker)\n"
                        + "- Docs: API gateway design notes, updated last week\n"
                        + contextLine(in)),
                new StubResearchStep(SLACK_CONTEXT_MANIFEST, in ->
                        "## Recent discussions\n"
                        + "- #platform: rollout of the new gateway slipped by one sprint\n"
                        + "- #incidents: one open follow-up from last week's outage\n"),
                new StubResearchStep(AGENDA_BUILDER_MANIFEST, StubStepProvider::agenda),
                new StubResearchStep(COORDINATOR_MANIFEST, StubStepProvider::briefing),
                new StubResearchStep(PREREAD_COLLECTOR_MANIFEST, in ->
                        "## Pre-read packet\n"
                        + "1. Gateway design notes (relevance 9/10)\n"
                        + "2. Outage postmortem (relevance 7/10)\n"),
                new StubResearchStep(CONTEXT_BRIEFING_MANIFEST, StubStepProvider::participantBriefings)
        );
    }

    private static Object calendar(StepInputs in) {
        return "## Calendar\n"
                + "- Platform sync, tomorrow 10:00-10:45, attendees: alice@example.com, bob@example.com\n"
                + contextLine(in);
    }

    private static Object agenda(StepInputs in) {
        String focus = in.has(FOCUS_MODE) ? in.text(FOCUS_MODE) : DEFAULT_FOCUS_MODE;
        return "## Agenda (" + focus + ")\n"
                + "1. Blockers on the gateway rollout (15 min)\n"
                + "2. Design decisions pending review (15 min)\n"
                + "3. Action items and owners (10 min)\n"
                + contextLine(in);
    }

    private static Object briefing(StepInputs in) {
        StringBuilder sb = new StringBuilder("# Meeting briefing\n");
        for (String key : List.of(CALENDAR, PEOPLE_RESEARCH, TECHNICAL_CONTEXT, SLACK_CONTEXT, AGENDA)) {
            if (in.has(key)) {
                sb.append("\n### ").append(key).append('\n').append(firstLine(in.text(key))).append('\n');
            }
        }
        return sb.toString();
    }

    private static Object participantBriefings(StepInputs in) {
        StringBuilder sb = new StringBuilder("## Participant briefings\n");
        if (in.get(PARTICIPANT_ROLES).orElse(null) instanceof Map<?, ?> roles) {
            roles.forEach((person, role) ->
                    sb.append("- ").append(person).append(" (").append(role)
                      .append("): review agenda items relevant to ").append(role).append('\n'));
        }
        return sb.toString();
    }

    private static String contextLine(StepInputs in) {
        String context = in.text(MEETING_CONTEXT);
        return context.isBlank() ? "" : "_Context:_ " + context + "\n";
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }
}
