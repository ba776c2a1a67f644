package com.consullo.agentstream.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Canonical event produced by a detector.
 *
 * <p>The payload is an insertion-ordered, unmodifiable map whose keys depend on {@link #type()}.
 * Values may be {@code null} where a vendor did not report a field (for example {@code model}).
 *
 * @since 1.0
 */
public final class AgentEvent {

  private final String sessionId;
  private final AgentEventType type;
  private final Instant timestamp;
  private final Map<String, Object> payload;

  private AgentEvent(String sessionId, AgentEventType type, Instant timestamp, Map<String, Object> payload) {
    this.sessionId = sessionId;
    this.type = type;
    this.timestamp = timestamp;
    this.payload = payload;
  }

  public static AgentEvent of(final String sessionId, final AgentEventType type, final Map<String, Object> payload) {
    return of(sessionId, type, Instant.now(), payload);
  }

  public static AgentEvent of(
      final String sessionId,
      final AgentEventType type,
      final Instant timestamp,
      final Map<String, Object> payload) {
    Validate.notNull(sessionId, "sessionId must not be null");
    Validate.notNull(type, "type must not be null");
    Validate.notNull(timestamp, "timestamp must not be null");
    Map<String, Object> copy = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    return new AgentEvent(sessionId, type, timestamp, copy);
  }

  /**
   * Starts a payload map.
   *
   * @return empty payload builder
   */
  public static PayloadBuilder payloadBuilder() {
    return new PayloadBuilder();
  }

  public String sessionId() {
    return sessionId;
  }

  public AgentEventType type() {
    return type;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public Map<String, Object> payload() {
    return payload;
  }

  /**
   * Returns a payload value cast to the requested type.
   *
   * @param key payload key
   * @param valueType expected type
   * @param <T> value type
   * @return value, or null when absent
   * @throws ClassCastException if the value has another type
   */
  public <T> T payloadValue(final String key, final Class<T> valueType) {
    return valueType.cast(payload.get(key));
  }

  @Override
  public String toString() {
    return "AgentEvent{" + type.wireName() + " session=" + sessionId + " payload=" + payload + "}";
  }

  /**
   * Fluent builder for ordered payload maps.
   */
  public static final class PayloadBuilder {

    private final Map<String, Object> values = new LinkedHashMap<>();

    private PayloadBuilder() {
    }

    public PayloadBuilder put(String key, Object value) {
      values.put(key, value);
      return this;
    }

    /**
     * Adds the entry only when the value is non-null.
     *
     * @param key payload key
     * @param value value
     * @return this builder
     */
    public PayloadBuilder putIfPresent(String key, Object value) {
      if (value != null) {
        values.put(key, value);
      }
      return this;
    }

    public Map<String, Object> build() {
      return values;
    }
  }
}
