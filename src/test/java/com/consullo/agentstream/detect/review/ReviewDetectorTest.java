package com.consullo.agentstream.detect.review;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for review findings capture.
 *
 * @since 1.0
 */
public class ReviewDetectorTest {

  private static final String SESSION = "review-term";
  private static final String REVIEW = "rev-1";

  private static final String FINDING =
      "{\"file\":\"src/Main.java\",\"line\":\"12\",\"severity\":\" Warning \",\"title\":\"Unclosed stream\","
          + "\"description\":\"The reader is never closed.\",\"suggestion\":\"Use try-with-resources\"}";

  private ReviewDetector detector;

  @BeforeEach
  void setUp() {
    detector = new ReviewDetector();
  }

  @Test
  @DisplayName("Should ignore output of sessions that were not armed")
  void processOutput_NotArmed_EmitsNothing() {
    assertThat(detector.processOutput(SESSION, "[" + FINDING + "]")).isEmpty();
    assertThat(detector.onExit(SESSION, 0)).isEmpty();
  }

  @Test
  @DisplayName("Should extract findings from a fenced JSON block and normalize them")
  void processOutput_FencedJson_EmitsFindings() {
    detector.registerExtractionSession(SESSION, REVIEW);

    List<AgentEvent> events = detector.processOutput(SESSION,
        "Here is my review:\n```json\n[" + FINDING + "]\n```\n");

    assertThat(events).hasSize(1);
    AgentEvent event = events.get(0);
    assertThat(event.type()).isEqualTo(AgentEventType.REVIEW_COMPLETED);
    assertThat(event.payload()).containsEntry("reviewId", REVIEW);
    List<ReviewFinding> findings = findings(event);
    assertThat(findings).hasSize(1);
    ReviewFinding finding = findings.get(0);
    assertThat(finding.severity()).isEqualTo(Severity.WARNING);
    assertThat(finding.line()).isEqualTo(12);
    assertThat(finding.endLine()).isNull();
    assertThat(finding.category()).isEqualTo("General");
    assertThat(finding.suggestion()).isEqualTo("Use try-with-resources");
  }

  @Test
  @DisplayName("Should find a bracketed array assembled across chunks, past the echoed template")
  void processOutput_ArrayAcrossChunks_SkipsTemplate() {
    detector.registerExtractionSession(SESSION, REVIEW);
    String template = "Respond with [{\"file\":\"relative/path\",\"severity\":\"critical|warning|info|suggestion\","
        + "\"title\":\"Short title\",\"description\":\"...\"}]\n";

    assertThat(detector.processOutput(SESSION, template)).isEmpty();
    assertThat(detector.processOutput(SESSION, "[" + FINDING.substring(0, 30))).isEmpty();
    List<AgentEvent> events = detector.processOutput(SESSION, FINDING.substring(30) + "]\n");

    assertThat(events).hasSize(1);
    assertThat(findings(events.get(0))).extracting(ReviewFinding::file).containsExactly("src/Main.java");
  }

  @Test
  @DisplayName("Should complete with an empty list for a literal empty array")
  void processOutput_EmptyArray_CompletesWithNoFindings() {
    detector.registerExtractionSession(SESSION, REVIEW);

    List<AgentEvent> events = detector.processOutput(SESSION, "[]\n");

    assertThat(events).hasSize(1);
    assertThat(events.get(0).type()).isEqualTo(AgentEventType.REVIEW_COMPLETED);
    assertThat(findings(events.get(0))).isEmpty();
  }

  @Test
  @DisplayName("Should complete with an empty list when the agent reports no issues")
  void processOutput_NoIssuesPhrase_CompletesWithNoFindings() {
    detector.registerExtractionSession(SESSION, REVIEW);

    List<AgentEvent> events = detector.processOutput(SESSION, "I reviewed the diff. No issues found.\n");

    assertThat(events).hasSize(1);
    assertThat(findings(events.get(0))).isEmpty();
  }

  @Test
  @DisplayName("Should emit at most one completion per armed session")
  void processOutput_AfterCompletion_EmitsNothing() {
    detector.registerExtractionSession(SESSION, REVIEW);
    detector.processOutput(SESSION, "[" + FINDING + "]");

    assertThat(detector.processOutput(SESSION, "[" + FINDING + "]")).isEmpty();
    assertThat(detector.onExit(SESSION, 0)).isEmpty();
  }

  @Test
  @DisplayName("Should drop invalid findings and keep the valid ones")
  void validate_MixedEntries_KeepsValidOnly() {
    detector.registerExtractionSession(SESSION, REVIEW);
    String missingTitle = "{\"file\":\"a.js\",\"severity\":\"info\",\"description\":\"d\"}";
    String badSeverity = "{\"file\":\"a.js\",\"severity\":\"blocker\",\"title\":\"t\",\"description\":\"d\"}";
    String pipeCategory = "{\"file\":\"a.js\",\"severity\":\"info\",\"category\":\"bug|style\",\"title\":\"t\",\"description\":\"d\"}";

    List<AgentEvent> events = detector.processOutput(SESSION,
        "[" + missingTitle + "," + badSeverity + "," + pipeCategory + "," + FINDING + "]");

    assertThat(findings(events.get(0))).extracting(ReviewFinding::title).containsExactly("Unclosed stream");
  }

  @Test
  @DisplayName("Should complete with no findings on a clean exit without a result")
  void onExit_CleanExitWithoutResult_CompletesEmpty() {
    detector.registerExtractionSession(SESSION, REVIEW);
    detector.processOutput(SESSION, "thinking about the diff...\n");

    List<AgentEvent> events = detector.onExit(SESSION, 0);

    assertThat(events).hasSize(1);
    assertThat(events.get(0).type()).isEqualTo(AgentEventType.REVIEW_COMPLETED);
    assertThat(findings(events.get(0))).isEmpty();
  }

  @Test
  @DisplayName("Should report failure with the output tail on a non-zero exit without a result")
  void onExit_FailedWithoutResult_EmitsReviewFailed() {
    detector.registerExtractionSession(SESSION, REVIEW);
    detector.processOutput(SESSION, "fatal: not a git repository\n");

    List<AgentEvent> events = detector.onExit(SESSION, 128);

    assertThat(events).hasSize(1);
    assertThat(events.get(0).type()).isEqualTo(AgentEventType.REVIEW_FAILED);
    assertThat(events.get(0).payload())
        .containsEntry("reviewId", REVIEW)
        .containsEntry("error", "Review process exited with code 128")
        .containsEntry("output", "fatal: not a git repository\n");
  }

  @Test
  @DisplayName("Should keep the captured output of a finished review available by review id")
  void buffer_AfterExit_ReturnsRetainedOutput() {
    detector.registerExtractionSession(SESSION, REVIEW);
    detector.processOutput(SESSION, "partial output");
    assertThat(detector.buffer(REVIEW)).contains("partial output");

    detector.onExit(SESSION, 1);

    assertThat(detector.buffer(REVIEW)).contains("partial output");
    assertThat(detector.buffer("unknown")).isEmpty();
  }

  @Test
  @DisplayName("Should retain only the configured number of completed buffers")
  void buffer_ManyReviews_EvictsOldest() {
    ReviewDetector small = new ReviewDetector(new ReviewConfig(1000, 2, 100));
    for (int i = 0; i < 3; i++) {
      small.registerExtractionSession("t" + i, "r" + i);
      small.processOutput("t" + i, "out" + i);
      small.onExit("t" + i, 0);
    }

    assertThat(small.buffer("r0")).isEmpty();
    assertThat(small.buffer("r1")).contains("out1");
    assertThat(small.buffer("r2")).contains("out2");
  }

  @SuppressWarnings("unchecked")
  private static List<ReviewFinding> findings(AgentEvent event) {
    return (List<ReviewFinding>) event.payload().get("findings");
  }
}
