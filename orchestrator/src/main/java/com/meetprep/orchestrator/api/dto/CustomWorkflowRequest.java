package com.meetprep.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/meetings/prepare-custom.
 *
 * Required: steps (also accepted as "agents")
 * Optional: meetingContext, userPreferences, seedData. Seed data is keyed
 *   like step results, so {"calendar": ...} lets a caller skip the calendar
 *   step and still feed its data to later ones.
 */
public record CustomWorkflowRequest(@JsonAlias("agents") List<String> steps,
                                    String meetingContext,
                                    Map<String, Object> userPreferences,
                                    Map<String, Object> seedData) {

    /** Seed map handed to the orchestrator; explicit seed entries win. */
    public Map<String, Object> seeds() {
        Map<String, Object> seeds = new LinkedHashMap<>();
        if (meetingContext != null)  seeds.put("meeting_context", meetingContext);
        if (userPreferences != null) seeds.put("user_preferences", userPreferences);
        if (seedData != null)        seeds.putAll(seedData);
        return seeds;
    }
}
