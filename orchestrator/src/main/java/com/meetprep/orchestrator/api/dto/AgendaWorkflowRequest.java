package com.meetprep.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /api/v1/agenda/comprehensive.
 *
 * participantRoles maps a person to their role; when absent or empty the
 * participant briefing step is skipped.
 */
public record AgendaWorkflowRequest(Map<String, Object> meetingContext,
                                    String focusMode,
                                    Map<String, String> participantRoles) {
}
