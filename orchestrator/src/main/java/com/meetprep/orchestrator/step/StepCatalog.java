package com.meetprep.orchestrator.step;

import com.meetprep.orchestrator.model.JobRecord;

import java.util.List;

/**
 * Names, seed keys and manifests of the research steps known to the
 * preparation workflows. Both step providers register against these
 * manifests, so the data flow is identical whichever variant runs.
 */
public final class StepCatalog {

    // Step names
    public static final String CALENDAR          = "calendar";
    public static final String PEOPLE_RESEARCH   = "people_research";
    public static final String TECHNICAL_CONTEXT = "technical_context";
    public static final String SLACK_CONTEXT     = "slack_context";
    public static final String AGENDA_BUILDER    = "agenda_builder";
    public static final String COORDINATOR       = "coordinator";
    public static final String PREREAD_COLLECTOR = "preread_collector";
    public static final String CONTEXT_BRIEFING  = "context_briefing";

    // Seed keys supplied by the caller rather than by a step
    public static final String MEETING_CONTEXT   = "meeting_context";
    public static final String FOCUS_MODE        = "focus_mode";
    public static final String PARTICIPANT_ROLES = "participant_roles";
    public static final String USER_PREFERENCES  = "user_preferences";

    // Result keys that differ from the producing step's name
    public static final String AGENDA            = "agenda";
    public static final String PREREAD_DOCUMENTS = "preread_documents";
    public static final String CONTEXT_BRIEFINGS = "context_briefings";

    public static final StepManifest CALENDAR_MANIFEST = new StepManifest(
            CALENDAR,
            "Retrieve upcoming and recent calendar events with attendees.",
            List.of(MEETING_CONTEXT),
            List.of(CALENDAR));

    public static final StepManifest PEOPLE_RESEARCH_MANIFEST = new StepManifest(
            PEOPLE_RESEARCH,
            "Research the meeting attendees found in the calendar data.",
            List.of(CALENDAR),
            List.of(PEOPLE_RESEARCH));

    public static final StepManifest TECHNICAL_CONTEXT_MANIFEST = new StepManifest(
            TECHNICAL_CONTEXT,
            "Search repositories, issues and documentation relevant to the meetings.",
            List.of(CALENDAR, MEETING_CONTEXT),
            List.of(TECHNICAL_CONTEXT));

    public static final StepManifest SLACK_CONTEXT_MANIFEST = new StepManifest(
            SLACK_CONTEXT,
            "Summarize recent chat discussions involving the attendees.",
            List.of(CALENDAR, PEOPLE_RESEARCH),
            List.of(SLACK_CONTEXT));

    public static final StepManifest AGENDA_BUILDER_MANIFEST = new StepManifest(
            AGENDA_BUILDER,
            "Build a prioritized agenda for the chosen focus mode.",
            List.of(MEETING_CONTEXT, FOCUS_MODE, CALENDAR, PEOPLE_RESEARCH,
                    TECHNICAL_CONTEXT, SLACK_CONTEXT),
            List.of(AGENDA));

    public static final StepManifest COORDINATOR_MANIFEST = new StepManifest(
            COORDINATOR,
            "Synthesize all research into the final meeting briefing.",
            List.of(CALENDAR, PEOPLE_RESEARCH, TECHNICAL_CONTEXT, SLACK_CONTEXT, AGENDA),
            List.of(COORDINATOR, JobRecord.FINAL_OUTPUT));

    public static final StepManifest PREREAD_COLLECTOR_MANIFEST = new StepManifest(
            PREREAD_COLLECTOR,
            "Collect supporting documents worth reading before the meeting.",
            List.of(MEETING_CONTEXT, AGENDA),
            List.of(PREREAD_DOCUMENTS));

    public static final StepManifest CONTEXT_BRIEFING_MANIFEST = new StepManifest(
            CONTEXT_BRIEFING,
            "Write a personalized briefing for each participant role.",
            List.of(MEETING_CONTEXT, PARTICIPANT_ROLES, AGENDA),
            List.of(CONTEXT_BRIEFINGS));

    public static final List<StepManifest> ALL = List.of(
            CALENDAR_MANIFEST,
            PEOPLE_RESEARCH_MANIFEST,
            TECHNICAL_CONTEXT_MANIFEST,
            SLACK_CONTEXT_MANIFEST,
            AGENDA_BUILDER_MANIFEST,
            COORDINATOR_MANIFEST,
            PREREAD_COLLECTOR_MANIFEST,
            CONTEXT_BRIEFING_MANIFEST);

    /** Accepted values for the agenda focus mode. */
    public static final List<String> FOCUS_MODES =
            List.of("blockers", "design", "progress", "planning", "balanced");

    public static final String DEFAULT_FOCUS_MODE = "balanced";

    private StepCatalog() {}
}
