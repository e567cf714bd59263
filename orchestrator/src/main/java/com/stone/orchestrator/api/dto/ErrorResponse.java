package com.stone.orchestrator.api.dto;

public record ErrorResponse(String error, String message) {}
