package com.mk.fx.context.engine.dto.response;

import java.util.Map;

/** Root endpoint payload describing the running service. */
public record ServiceInfoResponse(
    String service,
    String version,
    int port,
    String status,
    String description,
    Map<String, String> endpoints) {}
