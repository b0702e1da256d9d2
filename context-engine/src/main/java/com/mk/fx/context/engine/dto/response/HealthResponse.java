package com.mk.fx.context.engine.dto.response;

/** Response object for the health endpoint. */
public record HealthResponse(String status, String service, int port, String version) {}
