package com.consullo.agentstream.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson helpers shared by the record-consuming detectors.
 *
 * @since 1.0
 */
public final class JsonRecords {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonRecords.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonRecords() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Parses a record, returning empty for malformed input.
   *
   * @param json record text
   * @return parsed tree, or empty if the text is not valid JSON
   */
  public static Optional<JsonNode> parse(final String json) {
    try {
      return Optional.ofNullable(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      LOGGER.debug("Skipping malformed record ({} chars): {}", json.length(), e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /**
   * Returns a textual field, or null when missing, null or not textual.
   *
   * @param node object node (may be null)
   * @param field field name
   * @return field text or null
   */
  public static String text(final JsonNode node, final String field) {
    if (node == null) {
      return null;
    }
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      return null;
    }
    return value.asText();
  }

  /**
   * Returns a non-empty textual field, or null.
   *
   * @param node object node (may be null)
   * @param field field name
   * @return field text or null when missing or empty
   */
  public static String nonEmptyText(final JsonNode node, final String field) {
    String s = text(node, field);
    return s == null || s.isEmpty() ? null : s;
  }

  /**
   * Returns a numeric field as a long.
   *
   * @param node object node (may be null)
   * @param field field name
   * @param fallback value when missing or not numeric
   * @return value
   */
  public static long number(final JsonNode node, final String field, final long fallback) {
    if (node == null) {
      return fallback;
    }
    JsonNode value = node.get(field);
    if (value == null || !value.isNumber()) {
      return fallback;
    }
    return value.asLong();
  }

  public static boolean isPresent(final JsonNode node) {
    return node != null && !node.isNull() && !node.isMissingNode();
  }

  public static ObjectNode newObject() {
    return MAPPER.createObjectNode();
  }

  /**
   * Serializes a tree or value to compact JSON.
   *
   * @param value value
   * @return JSON text
   */
  public static String write(final Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }
}
