package com.consullo.agentstream.core.text;

import java.util.regex.Pattern;

/**
 * Removes terminal control sequences from PTY output before pattern matching.
 *
 * <p>Line breaks, carriage returns and tabs are preserved; record extraction and line-based
 * matchers rely on them.
 *
 * @since 1.0
 */
public final class AnsiText {

  // CSI: ESC [ params intermediates final, including DEC private modes like ?25h
  private static final Pattern CSI = Pattern.compile("\u001B\\[[0-9:;<=>?]*[ -/]*[@-~]");

  // OSC: ESC ] ... BEL or ESC ] ... ESC \
  private static final Pattern OSC = Pattern.compile("\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)");

  // Two-byte escapes such as ESC = or ESC ( B
  private static final Pattern SHORT_ESCAPE = Pattern.compile("\u001B[()][0-9A-Za-z]|\u001B[=>78cDEHM]");

  private AnsiText() {
  }

  /**
   * Strips CSI, OSC and short escape sequences.
   *
   * @param s raw output (may be null)
   * @return text without control sequences; empty string for null input
   */
  public static String strip(final String s) {
    if (s == null || s.isEmpty()) {
      return "";
    }
    if (s.indexOf('\u001B') < 0) {
      return s;
    }
    String out = CSI.matcher(s).replaceAll("");
    out = OSC.matcher(out).replaceAll("");
    return SHORT_ESCAPE.matcher(out).replaceAll("");
  }
}
