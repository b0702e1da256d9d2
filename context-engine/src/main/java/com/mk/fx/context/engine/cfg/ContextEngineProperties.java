package com.mk.fx.context.engine.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "context-engine")
public class ContextEngineProperties {

  @Valid private GraphRag graphrag = new GraphRag();
  @Valid private Supabase supabase = new Supabase();
  @Valid private Cache cache = new Cache();
  @Valid private Analysis analysis = new Analysis();
  @Valid private Health health = new Health();

  @Data
  public static class GraphRag {
    @NotBlank private String baseUrl = "http://10.10.0.87:8010";
    @NotNull private Duration timeout = Duration.ofSeconds(30);

    @Min(0)
    @Max(10)
    private int maxRetries = 3;

    @NotNull private Duration retryDelay = Duration.ofSeconds(1);
  }

  @Data
  public static class Supabase {
    @NotBlank private String url = "http://localhost:54321";

    /** Service role key; blank only for local development. */
    private String serviceKey = "";

    @NotNull private Duration timeout = Duration.ofSeconds(10);
  }

  @Data
  public static class Cache {
    @Positive private int memoryMaxSize = 1000;
    @Positive private long memoryTtlSeconds = 600;

    /** Enables the {@code context.cached_contexts} tier. */
    private boolean persistentEnabled = false;

    @Positive private long activeCaseTtlSeconds = 3600;
    @Positive private long closedCaseTtlSeconds = 86400;
  }

  @Data
  public static class Analysis {
    @Min(1)
    @Max(64)
    private int workerThreads = 5;

    @NotNull private Duration dimensionTimeout = Duration.ofSeconds(30);
  }

  @Data
  public static class Health {
    @Positive private long probeIntervalMs = 30_000;
  }
}
