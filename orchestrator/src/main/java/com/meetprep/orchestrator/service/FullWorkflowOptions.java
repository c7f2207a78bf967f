package com.meetprep.orchestrator.service;

import com.meetprep.orchestrator.step.StepCatalog;

import java.util.Map;

/**
 * Options of the full preparation workflow.
 *
 * @param meetingContext  free-text context passed to the research steps (optional)
 * @param userPreferences caller preferences, forwarded as seed data (optional)
 * @param includeSlack    run the chat-history step (default true)
 * @param includeAgenda   run the agenda step before final synthesis (default false)
 * @param focusMode       agenda focus, only read when includeAgenda is set
 */
public record FullWorkflowOptions(
        String              meetingContext,
        Map<String, Object> userPreferences,
        Boolean             includeSlack,
        Boolean             includeAgenda,
        String              focusMode
) {
    public FullWorkflowOptions {
        if (userPreferences == null) userPreferences = Map.of();
        if (includeSlack == null)    includeSlack = Boolean.TRUE;
        if (includeAgenda == null)   includeAgenda = Boolean.FALSE;
        if (focusMode == null || focusMode.isBlank()) focusMode = StepCatalog.DEFAULT_FOCUS_MODE;
    }

    public static FullWorkflowOptions defaults() {
        return new FullWorkflowOptions(null, null, null, null, null);
    }
}
