package com.mk.fx.context.engine.cfg;

import com.mk.fx.context.client.graphrag.GraphRagClient;
import com.mk.fx.context.client.supabase.SupabaseRestClient;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the downstream service clients from {@link ContextEngineProperties}. */
@Slf4j
@Configuration
public class ClientCfg {

  @Bean(destroyMethod = "close")
  public GraphRagClient graphRagClient(ContextEngineProperties properties) {
    var cfg = properties.getGraphrag();
    return new GraphRagClient(
        cfg.getBaseUrl(), cfg.getTimeout(), cfg.getMaxRetries(), cfg.getRetryDelay());
  }

  @Bean(destroyMethod = "close")
  public SupabaseRestClient supabaseRestClient(ContextEngineProperties properties) {
    var cfg = properties.getSupabase();
    var key = cfg.getServiceKey() == null ? "" : cfg.getServiceKey();
    if (key.isBlank()) {
      log.warn("No Supabase service key configured; requests to {} will be anonymous", cfg.getUrl());
    }
    return new SupabaseRestClient(cfg.getUrl(), key, cfg.getTimeout());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
