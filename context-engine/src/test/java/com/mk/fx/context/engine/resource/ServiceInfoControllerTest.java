package com.mk.fx.context.engine.resource;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.context.engine.cfg.ObjectMapperConfig;
import com.mk.fx.context.engine.service.DependencyHealthMonitor;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ServiceInfoController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class, ObjectMapperConfig.class})
class ServiceInfoControllerTest {

  @Autowired MockMvc mvc;

  @MockBean DependencyHealthMonitor healthMonitor;

  @Test
  void root_describesService() throws Exception {
    mvc.perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.service").value("context-engine-service"))
        .andExpect(jsonPath("$.status").value("running"))
        .andExpect(jsonPath("$.port").value(8015))
        .andExpect(jsonPath("$.endpoints.health").value("/api/v1/health"));
  }

  @Test
  void health_reportsHealthy() throws Exception {
    mvc.perform(get("/api/v1/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.service").value("context-engine"))
        .andExpect(jsonPath("$.version").value("1.0.0"));
  }

  @Test
  void dependencies_returnsLastProbeResults() throws Exception {
    Map<String, Map<String, Object>> results = new LinkedHashMap<>();
    results.put("graphrag", Map.of("status", "healthy"));
    results.put("supabase", Map.of("status", "unhealthy", "error", "timeout"));
    when(healthMonitor.lastResults()).thenReturn(results);

    mvc.perform(get("/api/v1/health/dependencies"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.graphrag.status").value("healthy"))
        .andExpect(jsonPath("$.supabase.error").value("timeout"));
  }

  @Test
  void unknownRoute_isNotFound() throws Exception {
    mvc.perform(get("/scan/wp-login.php"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"));
  }

  @Test
  void wrongMethod_isMethodNotAllowed() throws Exception {
    mvc.perform(delete("/api/v1/health"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(jsonPath("$.error").value("Method Not Allowed"));
  }
}
