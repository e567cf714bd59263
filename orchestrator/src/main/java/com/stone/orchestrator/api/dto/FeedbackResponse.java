package com.stone.orchestrator.api.dto;

/** @param feedbackIssue null when no feedback was found */
public record FeedbackResponse(long issue, Long feedbackIssue) {}
