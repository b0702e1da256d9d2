package com.mk.fx.context.engine.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the context of one case. {@code include_dimensions}, when present, overrides the
 * dimensions implied by {@code scope}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextRetrievalRequest {

  @NotBlank private String clientId;

  @NotBlank private String caseId;

  @Builder.Default private String scope = "comprehensive";

  private List<String> includeDimensions;

  @Builder.Default private Boolean useCache = Boolean.TRUE;
}
