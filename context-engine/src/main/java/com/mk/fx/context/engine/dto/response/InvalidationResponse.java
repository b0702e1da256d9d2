package com.mk.fx.context.engine.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Result of a cache invalidation; {@code client_id} and {@code scope} only for scoped deletes. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvalidationResponse(
    String message, String clientId, String caseId, String scope, int entriesDeleted) {}
