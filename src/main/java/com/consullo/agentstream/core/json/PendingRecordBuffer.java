package com.consullo.agentstream.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Carries an unterminated record between chunks and yields parsed records as they complete.
 *
 * <p>Not thread-safe; owned by a single session state.
 *
 * @since 1.0
 */
public final class PendingRecordBuffer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PendingRecordBuffer.class);

  private final int maxPendingChars;
  private String pending = "";

  /**
   * Creates a buffer.
   *
   * @param maxPendingChars largest unterminated record retained; a longer one is dropped
   */
  public PendingRecordBuffer(final int maxPendingChars) {
    Validate.isTrue(maxPendingChars > 0, "maxPendingChars must be positive");
    this.maxPendingChars = maxPendingChars;
  }

  /**
   * Appends a control-code-free chunk and returns every record it completes. Malformed records
   * are skipped.
   *
   * @param chunk text to append
   * @return parsed records in stream order
   */
  public List<JsonNode> feed(final String chunk) {
    ExtractionResult result = JsonRecordExtractor.extract(pending + (chunk == null ? "" : chunk));
    pending = result.remainder();
    if (pending.length() > maxPendingChars) {
      LOGGER.warn("Dropping unterminated record of {} chars (limit {})", pending.length(), maxPendingChars);
      pending = "";
    }

    List<JsonNode> records = new ArrayList<>(result.records().size());
    for (String record : result.records()) {
      JsonRecords.parse(record).ifPresent(records::add);
    }
    return records;
  }

  public int pendingLength() {
    return pending.length();
  }
}
