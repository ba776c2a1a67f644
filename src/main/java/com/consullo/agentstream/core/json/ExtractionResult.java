package com.consullo.agentstream.core.json;

import java.util.List;

/**
 * Outcome of one extraction pass over a buffer.
 *
 * @param records complete records in buffer order, with PTY line breaks removed
 * @param remainder unterminated record to carry into the next pass (empty if none)
 * @since 1.0
 */
public record ExtractionResult(List<String> records, String remainder) {

  public ExtractionResult {
    records = List.copyOf(records);
    remainder = remainder == null ? "" : remainder;
  }
}
