package com.mk.fx.context.engine.model;

/** Common view over the five dimension contexts. */
public interface DimensionContext {

  String getCaseId();

  String getCaseName();

  static String defaultCaseName(String caseId) {
    return "Case " + caseId;
  }
}
