package com.mk.fx.context.engine.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Swagger UI is served at {@code /docs}, the raw document at {@code /v3/api-docs}. */
@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi(@Value("${server.port:" + ServiceInfo.DEFAULT_PORT + "}") int port) {
    return new OpenAPI()
        .info(
            new Info()
                .title("Context Engine Service")
                .version(ServiceInfo.VERSION)
                .description(ServiceInfo.DESCRIPTION))
        .addServersItem(new Server().url("http://localhost:" + port).description("Local"));
  }
}
