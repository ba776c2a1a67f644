package com.consullo.agentstream.core.json;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for brace-balanced record extraction.
 *
 * @since 1.0
 */
public class JsonRecordExtractorTest {

  private static final String STREAM = "$ codex exec --json\r\n"
      + "{\"type\":\"thread.started\",\"thread_id\":\"t-1\"}\n"
      + "noise } with a stray brace\n"
      + "{\"type\":\"item.completed\",\"item\":{\"id\":\"i1\",\"type\":\"agent_message\",\"text\":\"use {x} and \\\"q\\\"\"}}\n"
      + "{\"type\":\"turn.completed\",\"usage\":{\"input_tokens\":10,\"output_tokens\":3}}\n";

  @Test
  @DisplayName("Should extract every complete record and skip surrounding noise")
  void extract_MixedOutput_ReturnsRecordsInOrder() {
    ExtractionResult result = JsonRecordExtractor.extract(STREAM);

    assertThat(result.records()).hasSize(3);
    assertThat(result.records().get(0)).isEqualTo("{\"type\":\"thread.started\",\"thread_id\":\"t-1\"}");
    assertThat(result.records().get(2)).startsWith("{\"type\":\"turn.completed\"");
    assertThat(result.remainder()).isEmpty();
  }

  @Test
  @DisplayName("Should yield the same records when fed chunk by chunk with the remainder carried over")
  void extract_AnyChunking_MatchesSingleCall() {
    List<String> whole = JsonRecordExtractor.extract(STREAM).records();

    for (int chunkSize = 1; chunkSize <= 40; chunkSize++) {
      List<String> chunked = new ArrayList<>();
      String remainder = "";
      for (int i = 0; i < STREAM.length(); i += chunkSize) {
        String chunk = STREAM.substring(i, Math.min(STREAM.length(), i + chunkSize));
        ExtractionResult result = JsonRecordExtractor.extract(remainder + chunk);
        chunked.addAll(result.records());
        remainder = result.remainder();
      }
      assertThat(chunked).as("chunk size %d", chunkSize).isEqualTo(whole);
    }
  }

  @Test
  @DisplayName("Should remove line breaks inserted inside a record by terminal wrapping")
  void extract_WrappedRecord_RemovesLineBreaks() {
    ExtractionResult result = JsonRecordExtractor.extract("{\"type\":\"item.up\r\ndated\",\"n\":\n1}");

    assertThat(result.records()).containsExactly("{\"type\":\"item.updated\",\"n\":1}");
    assertThat(JsonRecords.parse(result.records().get(0))).isPresent();
  }

  @Test
  @DisplayName("Should not count braces inside string literals, including after escaped quotes")
  void extract_BracesInStrings_DoNotAffectDepth() {
    String record = "{\"a\":\"}}}{\",\"b\":\"say \\\"{\\\" now\",\"c\":\"back\\\\\"}";

    ExtractionResult result = JsonRecordExtractor.extract(record + " tail");

    assertThat(result.records()).containsExactly(record);
    assertThat(result.remainder()).isEmpty();
  }

  @Test
  @DisplayName("Should return an unterminated record as the remainder")
  void extract_UnterminatedRecord_ReturnsRemainder() {
    ExtractionResult result = JsonRecordExtractor.extract("junk {\"a\":1} more {\"b\":{\"c\":");

    assertThat(result.records()).containsExactly("{\"a\":1}");
    assertThat(result.remainder()).isEqualTo("{\"b\":{\"c\":");
  }

  @Test
  @DisplayName("Should return nothing for text without records")
  void extract_NoRecords_ReturnsEmpty() {
    ExtractionResult result = JsonRecordExtractor.extract("plain text ] } \"quoted\"");

    assertThat(result.records()).isEmpty();
    assertThat(result.remainder()).isEmpty();
  }
}
