package com.consullo.agentstream.detect.review;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import com.consullo.agentstream.core.ExtractionSessionAware;
import com.consullo.agentstream.core.OutputDetector;
import com.consullo.agentstream.core.state.SessionStateTable;
import com.consullo.agentstream.core.text.AnsiText;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures the output of a code review run and emits its findings once they can be parsed.
 *
 * <p>Only sessions armed through {@link #registerExtractionSession(String, String)} are captured.
 * Each armed session completes at most once: with the findings found in its output, with an
 * empty list when the agent reports no issues or exits cleanly without a result, or with
 * {@link AgentEventType#REVIEW_FAILED} when the process exits non-zero and nothing was found.
 *
 * @since 1.0
 */
public final class ReviewDetector implements OutputDetector, ExtractionSessionAware {

  public static final String ID = "review-detector";

  private static final Logger LOGGER = LoggerFactory.getLogger(ReviewDetector.class);

  private final ReviewConfig config;
  private final SessionStateTable<ReviewSessionState> states;
  // review id -> final buffer, oldest first
  private final Map<String, String> completedBuffers;

  public ReviewDetector() {
    this(ReviewConfig.defaults());
  }

  public ReviewDetector(final ReviewConfig config) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
    this.states = new SessionStateTable<>(id -> new ReviewSessionState(config.bufferSize()));
    this.completedBuffers = new LinkedHashMap<>() {
      private static final long serialVersionUID = 1L;

      @Override
      protected boolean removeEldestEntry(final Map.Entry<String, String> eldest) {
        return size() > config.retainedBuffers();
      }
    };
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public void registerExtractionSession(final String sessionId, final String extractionSessionId) {
    Validate.notNull(sessionId, "sessionId must not be null");
    Validate.notBlank(extractionSessionId, "extractionSessionId must not be blank");
    ReviewSessionState state = states.getOrCreate(sessionId);
    synchronized (state) {
      state.arm(extractionSessionId);
    }
    LOGGER.info("Capturing review {} in session {}", extractionSessionId, sessionId);
  }

  @Override
  public List<AgentEvent> processOutput(final String sessionId, final String data) {
    ReviewSessionState state = states.find(sessionId).orElse(null);
    if (state == null) {
      return List.of();
    }
    synchronized (state) {
      if (!state.capturing || state.completed) {
        return List.of();
      }
      state.buffer.append(AnsiText.strip(data));
      Optional<List<ReviewFinding>> findings = FindingsExtractor.extract(state.buffer.toString());
      if (findings.isEmpty()) {
        return List.of();
      }
      return List.of(complete(sessionId, state, findings.get()));
    }
  }

  @Override
  public List<AgentEvent> onExit(final String sessionId, final int exitCode) {
    ReviewSessionState state = states.remove(sessionId).orElse(null);
    if (state == null) {
      return List.of();
    }
    List<AgentEvent> events = new ArrayList<>();
    synchronized (state) {
      if (state.reviewId == null) {
        return events;
      }
      retain(state.reviewId, state.buffer.toString());
      if (!state.capturing || state.completed) {
        return events;
      }
      Optional<List<ReviewFinding>> findings = FindingsExtractor.extract(state.buffer.toString());
      if (findings.isPresent() || exitCode == 0) {
        events.add(complete(sessionId, state, findings.orElse(List.of())));
      } else {
        state.capturing = false;
        events.add(AgentEvent.of(sessionId, AgentEventType.REVIEW_FAILED, AgentEvent.payloadBuilder()
            .put("reviewId", state.reviewId)
            .put("error", "Review process exited with code " + exitCode)
            .put("output", state.buffer.tail(config.failureTailSize()))
            .build()));
        LOGGER.warn("Review {} failed: process exited with code {}", state.reviewId, exitCode);
      }
    }
    return events;
  }

  @Override
  public void cleanup(final String sessionId) {
    states.remove(sessionId).ifPresent(state -> {
      synchronized (state) {
        if (state.reviewId != null) {
          retain(state.reviewId, state.buffer.toString());
        }
      }
      LOGGER.debug("Cleaned up review state for session {}", sessionId);
    });
  }

  /**
   * Returns the captured output of a review, active or recently completed.
   *
   * @param reviewId review id given to {@link #registerExtractionSession(String, String)}
   * @return captured output, or empty when unknown or no longer retained
   */
  public Optional<String> buffer(final String reviewId) {
    for (ReviewSessionState state : states.values()) {
      synchronized (state) {
        if (reviewId != null && reviewId.equals(state.reviewId)) {
          return Optional.of(state.buffer.toString());
        }
      }
    }
    synchronized (completedBuffers) {
      return Optional.ofNullable(completedBuffers.get(reviewId));
    }
  }

  private AgentEvent complete(String sessionId, ReviewSessionState state, List<ReviewFinding> findings) {
    state.completed = true;
    state.capturing = false;
    retain(state.reviewId, state.buffer.toString());
    LOGGER.info("Review {} completed with {} finding(s)", state.reviewId, findings.size());
    return AgentEvent.of(sessionId, AgentEventType.REVIEW_COMPLETED, AgentEvent.payloadBuilder()
        .put("reviewId", state.reviewId)
        .put("findings", List.copyOf(findings))
        .build());
  }

  private void retain(String reviewId, String buffer) {
    synchronized (completedBuffers) {
      completedBuffers.remove(reviewId);
      completedBuffers.put(reviewId, buffer);
    }
  }
}
