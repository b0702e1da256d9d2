package com.mk.fx.context.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import java.util.Map;

/** Shared JSON mapper for the wire formats of the downstream services, which use snake_case. */
public final class JsonUtil {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .addModule(new JavaTimeModule())
          .build();

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<Map<String, Object>>> ROWS_TYPE =
      new TypeReference<>() {};

  private JsonUtil() {}

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String toJson(Object value) throws JsonProcessingException {
    return MAPPER.writeValueAsString(value);
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new ServiceClientException(
          "Failed to parse response as " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
    }
  }

  /** Parses a JSON object; a blank body or a literal {@code null} reads as empty. */
  public static Map<String, Object> toMap(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      Map<String, Object> map = MAPPER.readValue(json, MAP_TYPE);
      return map != null ? map : Map.of();
    } catch (JsonProcessingException e) {
      throw new ServiceClientException("Failed to parse JSON object: " + e.getOriginalMessage(), e);
    }
  }

  public static List<Map<String, Object>> toRows(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      List<Map<String, Object>> rows = MAPPER.readValue(json, ROWS_TYPE);
      return rows != null ? rows : List.of();
    } catch (JsonProcessingException e) {
      throw new ServiceClientException("Failed to parse JSON array: " + e.getOriginalMessage(), e);
    }
  }

  /** Reads the array stored under {@code field} of a JSON object; missing or null is empty. */
  public static <T> List<T> listField(String json, String field, Class<T> elementType) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      JsonNode node = MAPPER.readTree(json).get(field);
      if (node == null || node.isNull()) {
        return List.of();
      }
      JavaType type = MAPPER.getTypeFactory().constructCollectionType(List.class, elementType);
      return MAPPER.convertValue(node, type);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new ServiceClientException(
          "Failed to read '" + field + "' as list of " + elementType.getSimpleName(), e);
    }
  }

  /** Converts a loosely typed value (for example a parsed JSON map) into the given type. */
  public static <T> T convert(Object value, Class<T> type) {
    return MAPPER.convertValue(value, type);
  }
}
