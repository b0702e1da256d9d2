package com.mk.fx.context.engine.dto.response;

import com.mk.fx.context.engine.model.ContextResponse;
import java.util.Map;

/**
 * Outcome of a batch retrieval.
 *
 * @param totalCases number of cases requested
 * @param successful number of contexts built
 * @param failed number of cases that failed
 * @param contexts built contexts by case id
 * @param errors failure messages by case id
 */
public record BatchContextResponse(
    int totalCases,
    int successful,
    int failed,
    Map<String, ContextResponse> contexts,
    Map<String, String> errors) {}
