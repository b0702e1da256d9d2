package com.mk.fx.context.engine.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Data;

@Data
public class CacheWarmupRequest {

  @NotBlank private String clientId;

  @NotEmpty private List<@NotBlank String> caseIds;

  private String scope = "standard";
}
