package com.consullo.agentstream.detect.review;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity vocabulary accepted for review findings.
 *
 * @since 1.0
 */
public enum Severity {
  CRITICAL,
  WARNING,
  INFO,
  SUGGESTION;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Normalizes free-form severity text (case and surrounding whitespace are ignored).
   *
   * @param text severity as written by the agent
   * @return severity, or empty when outside the vocabulary
   */
  public static Optional<Severity> parse(final String text) {
    if (text == null) {
      return Optional.empty();
    }
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    for (Severity severity : values()) {
      if (severity.wireName().equals(normalized)) {
        return Optional.of(severity);
      }
    }
    return Optional.empty();
  }
}
