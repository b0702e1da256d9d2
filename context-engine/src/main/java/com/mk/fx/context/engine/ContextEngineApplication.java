package com.mk.fx.context.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ContextEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContextEngineApplication.class, args);
  }
}
