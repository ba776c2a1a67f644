package com.consullo.agentstream.core.text;

import org.apache.commons.lang3.Validate;

/**
 * Append-only text buffer that keeps only the most recent {@code capacity} characters.
 *
 * <p>Not thread-safe; owned by a single session state.
 *
 * @since 1.0
 */
public final class RollingTextBuffer {

  private final int capacity;
  private final StringBuilder text;

  public RollingTextBuffer(final int capacity) {
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.capacity = capacity;
    this.text = new StringBuilder();
  }

  /**
   * Appends text, dropping the oldest characters once capacity is exceeded.
   *
   * @param s text to append (null is ignored)
   */
  public void append(final String s) {
    if (s == null || s.isEmpty()) {
      return;
    }
    text.append(s);
    int overflow = text.length() - capacity;
    if (overflow > 0) {
      text.delete(0, overflow);
    }
  }

  /**
   * Replaces the whole content, keeping only the trailing {@code capacity} characters.
   *
   * @param s new content
   */
  public void replace(final String s) {
    text.setLength(0);
    append(s);
  }

  public void clear() {
    text.setLength(0);
  }

  public int length() {
    return text.length();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Returns the last {@code n} characters (or everything if shorter).
   *
   * @param n number of characters
   * @return tail text
   */
  public String tail(final int n) {
    int start = Math.max(0, text.length() - n);
    return text.substring(start);
  }

  @Override
  public String toString() {
    return text.toString();
  }
}
