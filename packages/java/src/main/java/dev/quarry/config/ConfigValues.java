package dev.quarry.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Coercions shared by the {@code fromMap} readers.
 *
 * <p>Values arrive from JSON, YAML or TOML, so numbers may be any {@link Number} subtype and
 * booleans may be spelled as strings.</p>
 */
final class ConfigValues {
  private ConfigValues() {
  }

  static boolean asBoolean(Object value, boolean defaultValue) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue() != 0;
    }
    if (value instanceof String) {
      return Boolean.parseBoolean(((String) value).trim());
    }
    return defaultValue;
  }

  static Integer asInteger(Object value) {
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      try {
        return Integer.parseInt(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Expected an integer but found '" + value + "'", e);
      }
    }
    return null;
  }

  static Double asDouble(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      try {
        return Double.parseDouble(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Expected a number but found '" + value + "'", e);
      }
    }
    return null;
  }

  static String asString(Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    if (value instanceof Number || value instanceof Boolean) {
      return String.valueOf(value);
    }
    return null;
  }

  static List<String> asStringList(Object value) {
    if (value instanceof Iterable) {
      List<String> values = new ArrayList<>();
      for (Object entry : (Iterable<?>) value) {
        String text = asString(entry);
        if (text != null) {
          values.add(text);
        }
      }
      return values;
    }
    if (value instanceof String) {
      return List.of((String) value);
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> asMap(Object value) {
    if (value instanceof Map) {
      return (Map<String, Object>) value;
    }
    return null;
  }

  /**
   * Rewrites camelCase keys to snake_case at every depth.
   *
   * @param raw parsed configuration tree
   * @return a new tree with snake_case keys
   */
  static Map<String, Object> normalizeKeys(Map<String, Object> raw) {
    if (raw == null) {
      return Collections.emptyMap();
    }
    Map<String, Object> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      normalized.put(toSnakeCase(entry.getKey()), normalizeValue(entry.getValue()));
    }
    return normalized;
  }

  @SuppressWarnings("unchecked")
  private static Object normalizeValue(Object value) {
    if (value instanceof Map) {
      return normalizeKeys((Map<String, Object>) value);
    }
    if (value instanceof List) {
      List<Object> items = new ArrayList<>();
      for (Object item : (List<Object>) value) {
        items.add(normalizeValue(item));
      }
      return items;
    }
    return value;
  }

  static String toSnakeCase(String key) {
    StringBuilder out = new StringBuilder(key.length() + 4);
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && key.charAt(i - 1) != '_') {
          out.append('_');
        }
        out.append(Character.toLowerCase(c));
      } else if (c == '-') {
        out.append('_');
      } else {
        out.append(c);
      }
    }
    return out.toString().toLowerCase(Locale.ROOT);
  }
}
