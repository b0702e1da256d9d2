package com.mk.fx.context.engine.store;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Row of {@code graph.nodes}.
 *
 * @param nodeId node id
 * @param entityType entity type, normalized to upper case
 * @param properties free-form node properties
 */
public record GraphNode(String nodeId, String entityType, Map<String, Object> properties) {

  public GraphNode {
    nodeId = nodeId == null ? "" : nodeId;
    entityType = entityType == null ? "" : entityType.trim().toUpperCase(Locale.ROOT);
    properties = properties == null ? Map.of() : properties;
  }

  public boolean isType(String type) {
    return type.equalsIgnoreCase(entityType);
  }

  /** String property, null when absent or blank. */
  public String text(String key) {
    Object value = properties.get(key);
    if (value == null) {
      return null;
    }
    var text = String.valueOf(value);
    return text.isBlank() ? null : text;
  }

  public String text(String key, String defaultValue) {
    var text = text(key);
    return text != null ? text : defaultValue;
  }

  /** Numeric property; numeric strings are parsed, anything else yields the default. */
  public double number(String key, double defaultValue) {
    Object value = properties.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String s) {
      try {
        return Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  /** List-of-strings property; a single value becomes a one-element list. */
  public List<String> strings(String key) {
    Object value = properties.get(key);
    if (value instanceof List<?> list) {
      return list.stream()
          .filter(item -> item != null)
          .map(String::valueOf)
          .collect(Collectors.toList());
    }
    return value == null ? List.of() : List.of(String.valueOf(value));
  }
}
