package com.mk.fx.context.engine.cfg;

/** Identity of this service as reported by the info, health and docs endpoints. */
public final class ServiceInfo {

  public static final String NAME = "context-engine-service";
  public static final String SHORT_NAME = "context-engine";
  public static final String VERSION = "1.0.0";
  public static final int DEFAULT_PORT = 8015;
  public static final String DESCRIPTION =
      "Multi-dimensional context retrieval for legal AI (WHO/WHAT/WHERE/WHEN/WHY)";

  private ServiceInfo() {}
}
