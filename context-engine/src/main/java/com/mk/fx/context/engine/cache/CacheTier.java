package com.mk.fx.context.engine.cache;

import com.mk.fx.context.engine.model.CaseStatus;
import com.mk.fx.context.engine.model.ContextResponse;
import java.util.Optional;

/** One storage level of the context cache. Each tier applies its own TTL policy. */
public interface CacheTier {

  /** Short tier name used in statistics and metric tags. */
  String name();

  Optional<ContextResponse> get(String key);

  void put(String key, ContextResponse context, CaseStatus caseStatus);

  /** Removes every entry whose key starts with the prefix; returns how many were removed. */
  int deleteByPrefix(String prefix);
}
