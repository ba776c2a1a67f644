package com.consullo.agentstream.core.json;

/**
 * Finds the end of a bracket-balanced span, ignoring brackets inside JSON string literals.
 *
 * <p>A double quote toggles string state unless escaped; inside a string a backslash consumes
 * exactly the next character.
 *
 * @since 1.0
 */
public final class BalancedSpanScanner {

  /** Returned when the span is still open at the end of the text. */
  public static final int UNTERMINATED = -1;

  private BalancedSpanScanner() {
  }

  /**
   * Scans from {@code start}, which must hold the opening character, to the matching close.
   *
   * @param text text to scan
   * @param start index of the opening character
   * @param open opening character, e.g. '{'
   * @param close closing character, e.g. '}'
   * @return index of the matching closing character, or {@link #UNTERMINATED}
   */
  public static int findClose(final CharSequence text, final int start, final char open, final char close) {
    int depth = 0;
    boolean inString = false;
    boolean escapeNext = false;

    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);

      if (escapeNext) {
        escapeNext = false;
        continue;
      }
      if (inString) {
        if (c == '\\') {
          escapeNext = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == open) {
        depth++;
      } else if (c == close) {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return UNTERMINATED;
  }
}
