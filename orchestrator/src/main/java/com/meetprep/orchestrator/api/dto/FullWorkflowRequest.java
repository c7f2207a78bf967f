package com.meetprep.orchestrator.api.dto;

import com.meetprep.orchestrator.service.FullWorkflowOptions;

import java.util.Map;

/**
 * Request body for POST /api/v1/meetings/prepare. Every field is optional;
 * an empty body runs the default pipeline with chat history and no agenda.
 */
public record FullWorkflowRequest(String meetingContext,
                                  Map<String, Object> userPreferences,
                                  Boolean includeSlack,
                                  Boolean includeAgenda,
                                  String focusMode) {

    public FullWorkflowOptions toOptions() {
        return new FullWorkflowOptions(meetingContext, userPreferences, includeSlack, includeAgenda, focusMode);
    }
}
