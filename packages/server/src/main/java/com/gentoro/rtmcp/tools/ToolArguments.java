package com.gentoro.rtmcp.tools;

import com.gentoro.rtmcp.exception.InvalidArgumentException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tool arguments decoded against a {@link ToolDefinition}.
 *
 * <p>Decoding keeps only the declared parameters: unknown keys are dropped, missing optional ones
 * take their default, and every value is coerced to its declared type. A missing required
 * argument, a value of the wrong type or a value outside the allowed set raises {@link
 * InvalidArgumentException}; nothing reaches the RT API in that case.
 *
 * <p>Decoded types: {@code INTEGER} as {@link Long}, {@code IDENTIFIER} as {@link String}, {@code
 * ARRAY} as a {@link List} of decoded items, {@code OBJECT} as a {@link Map}.
 */
public final class ToolArguments {
  private static final org.slf4j.Logger log =
      com.gentoro.rtmcp.logging.LoggingService.getLogger(ToolArguments.class);

  private final Map<String, Object> values;

  private ToolArguments(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static ToolArguments decode(ToolDefinition definition, Map<String, Object> raw) {
    Map<String, Object> input = raw == null ? Map.of() : raw;
    for (String key : input.keySet()) {
      if (definition.parameter(key).isEmpty()) {
        log.debug("Dropping unknown argument '{}' for tool {}", key, definition.name());
      }
    }

    Map<String, Object> decoded = new LinkedHashMap<>();
    for (ToolProperty property : definition.parameters()) {
      Object value = input.get(property.name());
      if (value == null) {
        if (property.required()) {
          throw new InvalidArgumentException(
              "Missing required argument: %s".formatted(property.name()));
        }
        value = property.defaultValue();
        if (value == null) {
          continue;
        }
      }
      decoded.put(property.name(), coerce(property, value));
    }
    return new ToolArguments(decoded);
  }

  private static Object coerce(ToolProperty property, Object value) {
    Object coerced = coerce(property.name(), property.type(), property.itemType(), value);
    if (!property.allowedValues().isEmpty()
        && !property.allowedValues().contains(String.valueOf(coerced))) {
      throw new InvalidArgumentException(
          "Invalid value for %s: '%s' (expected one of %s)"
              .formatted(property.name(), coerced, property.allowedValues()));
    }
    return coerced;
  }

  private static Object coerce(
      String name, ToolProperty.Type type, ToolProperty.Type itemType, Object value) {
    switch (type) {
      case STRING:
        if (value instanceof String s) return s;
        throw mismatch(name, "a string", value);
      case INTEGER:
        return toLong(name, value);
      case BOOLEAN:
        return toBoolean(name, value);
      case IDENTIFIER:
        if (value instanceof String s) {
          if (s.isBlank()) throw mismatch(name, "a non-blank id or name", value);
          return s.trim();
        }
        if (value instanceof Number) return String.valueOf(toLong(name, value));
        throw mismatch(name, "an id or name", value);
      case STRING_OR_LIST:
        if (value instanceof String) return value;
        if (value instanceof List<?> list) {
          List<String> strings = new ArrayList<>(list.size());
          for (Object item : list) {
            if (!(item instanceof String s)) throw mismatch(name, "a list of strings", value);
            strings.add(s);
          }
          return strings;
        }
        throw mismatch(name, "a string or a list of strings", value);
      case ARRAY:
        if (value instanceof List<?> list) {
          List<Object> items = new ArrayList<>(list.size());
          for (Object item : list) {
            if (item == null) throw mismatch(name, "a list without null entries", value);
            items.add(coerce(name, itemType, null, item));
          }
          return items;
        }
        throw mismatch(name, "an array", value);
      case OBJECT:
        if (value instanceof Map<?, ?> map) {
          Map<String, Object> copy = new LinkedHashMap<>();
          map.forEach((k, v) -> copy.put(String.valueOf(k), v));
          return copy;
        }
        throw mismatch(name, "an object", value);
      default:
        throw new IllegalStateException("Unhandled property type: " + type);
    }
  }

  private static Long toLong(String name, Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      try {
        return big.longValueExact();
      } catch (ArithmeticException e) {
        throw mismatch(name, "an integer", value);
      }
    }
    if (value instanceof Number number) {
      try {
        return new BigDecimal(number.toString()).longValueExact();
      } catch (ArithmeticException | NumberFormatException e) {
        throw mismatch(name, "an integer", value);
      }
    }
    if (value instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        throw mismatch(name, "an integer", value);
      }
    }
    throw mismatch(name, "an integer", value);
  }

  private static Boolean toBoolean(String name, Object value) {
    if (value instanceof Boolean b) return b;
    if (value instanceof String s) {
      String normalized = s.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("true")) return Boolean.TRUE;
      if (normalized.equals("false")) return Boolean.FALSE;
    }
    throw mismatch(name, "a boolean", value);
  }

  private static InvalidArgumentException mismatch(String name, String expected, Object value) {
    return new InvalidArgumentException(
        "Invalid argument %s: expected %s but got %s"
            .formatted(name, expected, describe(value)));
  }

  private static String describe(Object value) {
    if (value instanceof String s) return "'" + s + "'";
    return value + " (" + value.getClass().getSimpleName() + ")";
  }

  // ---------------------------------------------------------------------------------------------
  // Accessors
  // ---------------------------------------------------------------------------------------------

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public String getString(String name) {
    return (String) values.get(name);
  }

  public Long getLong(String name) {
    return (Long) values.get(name);
  }

  /** Integer view of an {@code INTEGER} argument; values outside the int range are rejected. */
  public Integer getInt(String name) {
    Long value = getLong(name);
    if (value == null) return null;
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new InvalidArgumentException("Argument %s is out of range: %d".formatted(name, value));
    }
    return value.intValue();
  }

  public Boolean getBoolean(String name) {
    return (Boolean) values.get(name);
  }

  @SuppressWarnings("unchecked")
  public <T> List<T> getList(String name) {
    return (List<T>) values.get(name);
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> getMap(String name) {
    return (Map<String, Object>) values.get(name);
  }

  /** String, or list of strings, as supplied. */
  public Object getStringOrList(String name) {
    return values.get(name);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return values.keySet().toString();
  }
}
