package com.consullo.agentstream.detect.naming;

import org.apache.commons.lang3.StringUtils;

/**
 * Cleans summarizer output into a terminal name.
 */
final class SuggestedNames {

  static final int MAX_LENGTH = 50;
  static final int MAX_WORDS = 5;

  private static final String QUOTES = "\"'`";

  private SuggestedNames() {
  }

  /**
   * Keeps the first line, strips surrounding quotes and whitespace.
   *
   * @param raw summarizer output
   * @return cleaned name, or null when empty, too long or too wordy
   */
  static String clean(String raw) {
    if (raw == null) {
      return null;
    }
    String name = raw.strip();
    int newline = StringUtils.indexOfAny(name, '\r', '\n');
    if (newline >= 0) {
      name = name.substring(0, newline);
    }
    name = StringUtils.strip(StringUtils.strip(name), QUOTES).strip();
    if (name.isEmpty() || name.length() > MAX_LENGTH) {
      return null;
    }
    if (StringUtils.split(name).length > MAX_WORDS) {
      return null;
    }
    return name;
  }
}
