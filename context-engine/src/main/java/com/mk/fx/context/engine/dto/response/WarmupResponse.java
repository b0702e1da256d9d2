package com.mk.fx.context.engine.dto.response;

import java.util.Map;

public record WarmupResponse(
    String message, int totalCases, int successful, int failed, Map<String, String> errors) {}
