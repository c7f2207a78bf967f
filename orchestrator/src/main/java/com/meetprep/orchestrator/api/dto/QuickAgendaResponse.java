package com.meetprep.orchestrator.api.dto;

/** Response body for POST /api/v1/agenda/quick/{focusMode}. */
public record QuickAgendaResponse(String focusMode, String status, Object data) {}
