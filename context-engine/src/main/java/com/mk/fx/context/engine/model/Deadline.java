package com.mk.fx.context.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deadline {
  private Instant deadlineDate;

  /** discovery, motion, trial... */
  private String deadlineType;

  private String description;
  private String caseId;

  @JsonProperty("is_met")
  private boolean met;

  /** high, medium or low. */
  @Builder.Default private String priority = "medium";
}
