package com.mk.fx.context.engine.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEvent {
  private Instant date;

  /** filing, hearing, motion, order... */
  private String eventType;

  private String description;
  private String caseId;
}
