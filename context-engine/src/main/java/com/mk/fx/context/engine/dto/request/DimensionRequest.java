package com.mk.fx.context.engine.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** Request for a single dimension (WHO, WHAT, WHERE, WHEN or WHY) of a case. */
@Data
public class DimensionRequest {

  @NotBlank private String clientId;

  @NotBlank private String caseId;

  @NotBlank private String dimension;
}
