package com.gentoro.rtmcp.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One named tool argument: its type, whether it is required, an optional default and an optional
 * set of allowed values.
 */
public record ToolProperty(
    String name,
    Type type,
    String description,
    boolean required,
    Object defaultValue,
    List<String> allowedValues,
    Type itemType) {

  /** Argument types understood by {@link ToolArguments#decode}. */
  public enum Type {
    STRING,
    INTEGER,
    BOOLEAN,
    /** Numeric id or a name; decoded as a string. */
    IDENTIFIER,
    /** A single string or a list of strings, passed through as given. */
    STRING_OR_LIST,
    ARRAY,
    OBJECT
  }

  public ToolProperty {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    description = description == null ? "" : description;
    allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    if (type == Type.ARRAY && itemType == null) {
      itemType = Type.STRING;
    }
  }

  public static ToolProperty required(String name, Type type, String description) {
    return new ToolProperty(name, type, description, true, null, null, null);
  }

  public static ToolProperty optional(String name, Type type, String description) {
    return new ToolProperty(name, type, description, false, null, null, null);
  }

  public static ToolProperty arrayOf(
      String name, Type itemType, String description, boolean required) {
    return new ToolProperty(name, Type.ARRAY, description, required, null, null, itemType);
  }

  public ToolProperty withDefault(Object value) {
    return new ToolProperty(name, type, description, false, value, allowedValues, itemType);
  }

  public ToolProperty withAllowedValues(List<String> values) {
    return new ToolProperty(name, type, description, required, defaultValue, values, itemType);
  }

  /** JSON Schema fragment describing this property. */
  public Map<String, Object> jsonSchema() {
    Map<String, Object> schema = new LinkedHashMap<>(schemaOf(type, itemType));
    if (!description.isEmpty()) {
      schema.put("description", description);
    }
    if (defaultValue != null) {
      schema.put("default", defaultValue);
    }
    if (!allowedValues.isEmpty()) {
      schema.put("enum", allowedValues);
    }
    return schema;
  }

  private static Map<String, Object> schemaOf(Type type, Type itemType) {
    switch (type) {
      case STRING:
        return Map.of("type", "string");
      case INTEGER:
        return Map.of("type", "integer");
      case BOOLEAN:
        return Map.of("type", "boolean");
      case IDENTIFIER:
        return Map.of("type", List.of("string", "integer"));
      case STRING_OR_LIST:
        return Map.of(
            "anyOf",
            List.of(
                Map.of("type", "string"),
                Map.of("type", "array", "items", Map.of("type", "string"))));
      case ARRAY:
        return Map.of("type", "array", "items", schemaOf(itemType, null));
      case OBJECT:
        return Map.of("type", "object");
      default:
        throw new IllegalStateException("Unhandled property type: " + type);
    }
  }
}
