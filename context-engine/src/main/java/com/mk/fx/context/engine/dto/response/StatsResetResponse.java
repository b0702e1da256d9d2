package com.mk.fx.context.engine.dto.response;

import java.util.Map;

public record StatsResetResponse(
    String message, Map<String, Object> previousStats, Map<String, Object> newStats) {}
