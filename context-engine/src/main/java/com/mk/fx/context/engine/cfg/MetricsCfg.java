package com.mk.fx.context.engine.cfg;

import com.mk.fx.context.engine.metrics.ContextEngineMetrics;
import com.mk.fx.context.engine.metrics.RequestMetricsFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsCfg {

  @Bean
  public FilterRegistrationBean<RequestMetricsFilter> requestMetricsFilter(
      ContextEngineMetrics metrics) {
    var registration = new FilterRegistrationBean<>(new RequestMetricsFilter(metrics));
    registration.addUrlPatterns("/*");
    return registration;
  }
}
