package com.consullo.agentstream.registry;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AsyncEventSource;
import com.consullo.agentstream.core.ExtractionSessionAware;
import com.consullo.agentstream.core.OutputDetector;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans terminal output out to every registered {@link OutputDetector} and the resulting events
 * out to every subscriber.
 *
 * <p>Detectors run in registration order and events of one call are collected in that order. A
 * detector or subscriber that throws is logged and skipped; nothing is thrown back to the caller.
 * Detectors implementing {@link AsyncEventSource} are wired to the same subscriber dispatch when
 * registered and detached when unregistered.
 *
 * @since 1.0
 */
public final class DetectorRegistry implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DetectorRegistry.class);

  private final CopyOnWriteArrayList<OutputDetector> detectors = new CopyOnWriteArrayList<>();
  private final CopyOnWriteArrayList<Consumer<AgentEvent>> subscribers = new CopyOnWriteArrayList<>();

  /**
   * Adds a detector. A detector registered under an existing id replaces it in place.
   *
   * @param detector detector to add
   */
  public void register(final OutputDetector detector) {
    Validate.notNull(detector, "detector must not be null");
    Validate.notBlank(detector.id(), "detector id must not be blank");
    synchronized (detectors) {
      int existing = indexOf(detector.id());
      if (existing >= 0) {
        detach(detectors.set(existing, detector));
        LOGGER.info("Replaced detector {}", detector.id());
      } else {
        detectors.add(detector);
        LOGGER.info("Registered detector {}", detector.id());
      }
    }
    if (detector instanceof AsyncEventSource) {
      ((AsyncEventSource) detector).onAsyncEvent(event -> dispatch(List.of(event)));
    }
  }

  /**
   * Removes a detector by id.
   *
   * @param detectorId detector id
   * @return true if a detector was removed
   */
  public boolean unregister(final String detectorId) {
    OutputDetector removed = null;
    synchronized (detectors) {
      int index = indexOf(detectorId);
      if (index >= 0) {
        removed = detectors.remove(index);
      }
    }
    if (removed == null) {
      return false;
    }
    detach(removed);
    LOGGER.info("Unregistered detector {}", detectorId);
    return true;
  }

  /**
   * Returns the registered detector with the given id.
   *
   * @param detectorId detector id
   * @param type expected detector type
   * @param <T> detector type
   * @return detector, or empty when missing or of another type
   */
  public <T extends OutputDetector> Optional<T> detector(final String detectorId, final Class<T> type) {
    for (OutputDetector detector : detectors) {
      if (detector.id().equals(detectorId) && type.isInstance(detector)) {
        return Optional.of(type.cast(detector));
      }
    }
    return Optional.empty();
  }

  public List<String> detectorIds() {
    List<String> ids = new ArrayList<>();
    for (OutputDetector detector : detectors) {
      ids.add(detector.id());
    }
    return ids;
  }

  /**
   * Arms every extraction-capable detector for a session.
   *
   * @param sessionId terminal session id
   * @param extractionSessionId caller-side extraction id
   * @return number of detectors armed
   */
  public int registerExtractionSession(final String sessionId, final String extractionSessionId) {
    int armed = 0;
    for (OutputDetector detector : detectors) {
      if (detector instanceof ExtractionSessionAware) {
        try {
          ((ExtractionSessionAware) detector).registerExtractionSession(sessionId, extractionSessionId);
          armed++;
        } catch (RuntimeException e) {
          LOGGER.error("Detector {} failed to arm extraction {} for session {}",
              detector.id(), extractionSessionId, sessionId, e);
        }
      }
    }
    if (armed == 0) {
      LOGGER.warn("No detector accepts extraction session {} for session {}", extractionSessionId, sessionId);
    }
    return armed;
  }

  /**
   * Adds a subscriber for all events, synchronous and asynchronous.
   *
   * @param subscriber event callback
   * @return handle removing the subscriber
   */
  public Subscription subscribe(final Consumer<AgentEvent> subscriber) {
    Validate.notNull(subscriber, "subscriber must not be null");
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  /**
   * Runs a chunk of output through every detector.
   *
   * @param sessionId terminal session id
   * @param data decoded output chunk
   * @return events produced, in detector registration order
   */
  public List<AgentEvent> processOutput(final String sessionId, final String data) {
    List<AgentEvent> events = new ArrayList<>();
    for (OutputDetector detector : detectors) {
      try {
        events.addAll(detector.processOutput(sessionId, data));
      } catch (Exception e) {
        LOGGER.error("Detector {} failed processing output of session {}", detector.id(), sessionId, e);
      }
    }
    dispatch(events);
    return events;
  }

  /**
   * Reports process termination to every detector.
   *
   * @param sessionId terminal session id
   * @param exitCode process exit code
   * @return closing events, in detector registration order
   */
  public List<AgentEvent> onExit(final String sessionId, final int exitCode) {
    List<AgentEvent> events = new ArrayList<>();
    for (OutputDetector detector : detectors) {
      try {
        events.addAll(detector.onExit(sessionId, exitCode));
      } catch (Exception e) {
        LOGGER.error("Detector {} failed handling exit of session {}", detector.id(), sessionId, e);
      }
    }
    LOGGER.debug("Session {} exited with code {}: {} event(s)", sessionId, exitCode, events.size());
    dispatch(events);
    return events;
  }

  /**
   * Releases every detector's state for a session.
   *
   * @param sessionId terminal session id
   */
  public void cleanup(final String sessionId) {
    for (OutputDetector detector : detectors) {
      try {
        detector.cleanup(sessionId);
      } catch (Exception e) {
        LOGGER.error("Detector {} failed cleaning up session {}", detector.id(), sessionId, e);
      }
    }
  }

  /**
   * Unregisters all detectors, closing those that hold resources.
   */
  @Override
  public void close() {
    List<OutputDetector> removed;
    synchronized (detectors) {
      removed = new ArrayList<>(detectors);
      detectors.clear();
    }
    for (OutputDetector detector : removed) {
      detach(detector);
      if (detector instanceof AutoCloseable) {
        try {
          ((AutoCloseable) detector).close();
        } catch (Exception e) {
          LOGGER.warn("Failed to close detector {}", detector.id(), e);
        }
      }
    }
    subscribers.clear();
  }

  private void dispatch(List<AgentEvent> events) {
    if (events.isEmpty()) {
      return;
    }
    for (Consumer<AgentEvent> subscriber : subscribers) {
      for (AgentEvent event : events) {
        try {
          subscriber.accept(event);
        } catch (RuntimeException e) {
          LOGGER.warn("Subscriber failed on event {} of session {}", event.type().wireName(), event.sessionId(), e);
        }
      }
    }
  }

  private static void detach(OutputDetector detector) {
    if (detector instanceof AsyncEventSource) {
      ((AsyncEventSource) detector).onAsyncEvent(null);
    }
  }

  private int indexOf(String detectorId) {
    for (int i = 0; i < detectors.size(); i++) {
      if (detectors.get(i).id().equals(detectorId)) {
        return i;
      }
    }
    return -1;
  }
}
