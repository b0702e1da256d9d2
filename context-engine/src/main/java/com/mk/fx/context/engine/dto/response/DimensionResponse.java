package com.mk.fx.context.engine.dto.response;

import com.mk.fx.context.engine.model.DimensionContext;

public record DimensionResponse(String caseId, String dimension, DimensionContext data) {}
