package com.consullo.agentstream.core.json;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts complete brace-delimited JSON records from a rolling PTY output buffer.
 *
 * <p>
 * PTYs re-wrap long lines, so a record may arrive split across several writes and with
 * {@code \r}/{@code \n} inserted anywhere inside it. This extractor:
 * <ul>
 * <li>skips everything outside records (prompts, log lines, spinner residue),</li>
 * <li>matches braces while ignoring those inside string literals,</li>
 * <li>removes every line break found inside a completed record,</li>
 * <li>returns an unterminated trailing record as the remainder for the next pass.</li>
 * </ul>
 * Text before the remainder that is not part of a record is discarded. Stateless and
 * thread-safe.
 * </p>
 *
 * @since 1.0
 */
public final class JsonRecordExtractor {

  private JsonRecordExtractor() {
  }

  /**
   * Scans the buffer for complete records.
   *
   * @param buffer accumulated output (remainder of the previous pass plus new text)
   * @return records and remainder
   */
  public static ExtractionResult extract(final String buffer) {
    List<String> records = new ArrayList<>();
    if (buffer == null || buffer.isEmpty()) {
      return new ExtractionResult(records, "");
    }

    int i = 0;
    while (i < buffer.length()) {
      if (buffer.charAt(i) != '{') {
        i++;
        continue;
      }
      int end = BalancedSpanScanner.findClose(buffer, i, '{', '}');
      if (end == BalancedSpanScanner.UNTERMINATED) {
        return new ExtractionResult(records, buffer.substring(i));
      }
      records.add(removeLineBreaks(buffer, i, end + 1));
      i = end + 1;
    }
    return new ExtractionResult(records, "");
  }

  private static String removeLineBreaks(String s, int start, int end) {
    StringBuilder sb = new StringBuilder(end - start);
    for (int i = start; i < end; i++) {
      char c = s.charAt(i);
      if (c != '\r' && c != '\n') {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
