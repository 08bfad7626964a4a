package com.gentoro.rtmcp.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.rtmcp.exception.SerializationException;
import java.util.Map;
import java.util.Optional;

/**
 * The one {@link ObjectMapper} of the server. Tool results and resources are rendered pretty;
 * request bodies and log payloads go out compact. Nulls are never written.
 */
public final class JacksonUtility {
  public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();
  private static final ObjectWriter COMPACT = MAPPER.writer();

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return MAPPER;
  }

  public static String toJson(Object value) {
    return write(PRETTY, value);
  }

  public static String toCompactJson(Object value) {
    return write(COMPACT, value);
  }

  /** Parse text as JSON; empty when it is blank or not JSON at all. */
  public static Optional<JsonNode> tryParse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(MAPPER.readTree(text)).filter(node -> !node.isMissingNode());
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  public static Map<String, Object> readMap(String json) {
    try {
      return MAPPER.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Not a JSON object: " + e.getOriginalMessage(), e);
    }
  }

  public static <T> T convert(Object value, Class<T> type) {
    try {
      return MAPPER.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Failed to convert value to " + type.getSimpleName(), e);
    }
  }

  public static Map<String, Object> convertToMap(Object value) {
    try {
      return MAPPER.convertValue(value, MAP_TYPE);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Failed to convert value to a map", e);
    }
  }

  private static String write(ObjectWriter writer, Object value) {
    try {
      return writer.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Failed to serialize " + (value == null ? "null" : value.getClass().getSimpleName()), e);
    }
  }
}
