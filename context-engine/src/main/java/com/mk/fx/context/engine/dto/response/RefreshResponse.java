package com.mk.fx.context.engine.dto.response;

public record RefreshResponse(
    String message, String caseId, String scope, double newContextScore, long executionTimeMs) {}
