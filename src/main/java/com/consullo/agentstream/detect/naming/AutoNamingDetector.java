package com.consullo.agentstream.detect.naming;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import com.consullo.agentstream.core.AsyncEventSource;
import com.consullo.agentstream.core.OutputDetector;
import com.consullo.agentstream.core.state.SessionStateTable;
import com.consullo.agentstream.core.text.AnsiText;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Suggests a terminal name once output has been quiet for a while.
 *
 * <p>Every chunk restarts the session's debounce timer. When it fires, the buffered output is
 * handed to the {@link NameSuggester}; a usable, changed name is emitted as
 * {@link AgentEventType#NAME_SUGGESTED} through the channel set by
 * {@link #onAsyncEvent(Consumer)}. {@link #processOutput} and {@link #onExit} never return events.
 *
 * <p>Deferred work re-checks that its session state is still current, so nothing is emitted
 * for a session after {@link #cleanup(String)}.
 *
 * @since 1.0
 */
public final class AutoNamingDetector implements OutputDetector, AsyncEventSource, AutoCloseable {

  public static final String ID = "auto-naming-detector";

  private static final Logger LOGGER = LoggerFactory.getLogger(AutoNamingDetector.class);

  private final NameSuggester suggester;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsScheduler;
  private final Clock clock;
  private final NamingConfig config;
  private final SessionStateTable<NamingSessionState> states;

  private volatile Consumer<AgentEvent> sink;

  /**
   * Creates a detector with default timings and its own single daemon timer thread, released by
   * {@link #close()}.
   *
   * @param suggester name source
   */
  public AutoNamingDetector(final NameSuggester suggester) {
    this(suggester, newTimerThread(), true, Clock.systemUTC(), NamingConfig.defaults());
  }

  /**
   * Creates a detector scheduling on a caller-owned executor.
   *
   * @param suggester name source
   * @param scheduler timer executor (not shut down by {@link #close()})
   * @param clock time source for the cooldown
   * @param config timings
   */
  public AutoNamingDetector(
      final NameSuggester suggester,
      final ScheduledExecutorService scheduler,
      final Clock clock,
      final NamingConfig config) {
    this(suggester, scheduler, false, clock, config);
  }

  private AutoNamingDetector(
      NameSuggester suggester,
      ScheduledExecutorService scheduler,
      boolean ownsScheduler,
      Clock clock,
      NamingConfig config) {
    Validate.notNull(suggester, "suggester must not be null");
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(clock, "clock must not be null");
    Validate.notNull(config, "config must not be null");
    this.suggester = suggester;
    this.scheduler = scheduler;
    this.ownsScheduler = ownsScheduler;
    this.clock = clock;
    this.config = config;
    this.states = new SessionStateTable<>(id -> new NamingSessionState(config.bufferSize()));
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public void onAsyncEvent(final Consumer<AgentEvent> sink) {
    this.sink = sink;
  }

  @Override
  public List<AgentEvent> processOutput(final String sessionId, final String data) {
    NamingSessionState state = states.getOrCreate(sessionId);
    synchronized (state) {
      state.buffer.append(AnsiText.strip(data));
      state.cancelDebounce();
      state.debounceTask = scheduler.schedule(
          () -> onDebounceElapsed(sessionId, state),
          config.debounce().toMillis(),
          TimeUnit.MILLISECONDS);
    }
    return List.of();
  }

  @Override
  public List<AgentEvent> onExit(final String sessionId, final int exitCode) {
    cleanup(sessionId);
    return List.of();
  }

  @Override
  public void cleanup(final String sessionId) {
    states.remove(sessionId).ifPresent(state -> {
      synchronized (state) {
        state.cancelDebounce();
      }
      LOGGER.debug("Cleaned up naming state for session {}", sessionId);
    });
  }

  /**
   * Returns the last name emitted for a session.
   *
   * @param sessionId session id
   * @return current name, or null if none was emitted
   */
  public String currentName(final String sessionId) {
    return states.find(sessionId).map(state -> {
      synchronized (state) {
        return state.currentName;
      }
    }).orElse(null);
  }

  @Override
  public void close() {
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
  }

  void onDebounceElapsed(String sessionId, NamingSessionState state) {
    String text;
    synchronized (state) {
      if (!states.isCurrent(sessionId, state)) {
        return;
      }
      state.debounceTask = null;
      if (state.queryInFlight) {
        LOGGER.debug("Name query already running for session {}", sessionId);
        return;
      }
      if (state.buffer.length() < config.minOutputLength()) {
        LOGGER.debug("Output too short ({} chars) to name session {}", state.buffer.length(), sessionId);
        return;
      }
      Instant now = clock.instant();
      if (state.lastNameChange != null && Duration.between(state.lastNameChange, now).compareTo(config.cooldown()) < 0) {
        LOGGER.debug("Naming cooldown active for session {}", sessionId);
        return;
      }
      state.queryInFlight = true;
      text = state.buffer.toString();
    }

    LOGGER.debug("Requesting name for session {}", sessionId);
    CompletableFuture<String> suggestion;
    try {
      suggestion = suggester.generateShortName(text);
    } catch (RuntimeException e) {
      LOGGER.warn("Name suggester failed for session {}", sessionId, e);
      finishQuery(state);
      return;
    }
    if (suggestion == null) {
      finishQuery(state);
      return;
    }
    suggestion
        .orTimeout(config.suggestionTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((name, error) -> onSuggestion(sessionId, state, name, error));
  }

  private void onSuggestion(String sessionId, NamingSessionState state, String rawName, Throwable error) {
    finishQuery(state);
    if (error != null) {
      LOGGER.warn("No name suggestion for session {}: {}", sessionId, error.toString());
      return;
    }
    String name = SuggestedNames.clean(rawName);
    if (name == null) {
      LOGGER.debug("Discarding unusable name suggestion for session {}: {}", sessionId, rawName);
      return;
    }

    synchronized (state) {
      if (!states.isCurrent(sessionId, state)) {
        LOGGER.debug("Session {} was cleaned up before its name arrived", sessionId);
        return;
      }
      if (name.equals(state.currentName)) {
        return;
      }
      state.currentName = name;
      state.lastNameChange = clock.instant();
    }

    Consumer<AgentEvent> target = sink;
    if (target == null) {
      LOGGER.warn("No async event channel wired; dropping name '{}' for session {}", name, sessionId);
      return;
    }
    LOGGER.info("Suggested name '{}' for session {}", name, sessionId);
    target.accept(AgentEvent.of(sessionId, AgentEventType.NAME_SUGGESTED, AgentEvent.payloadBuilder()
        .put("suggestedName", name)
        .build()));
  }

  private static void finishQuery(NamingSessionState state) {
    synchronized (state) {
      state.queryInFlight = false;
    }
  }

  private static ScheduledExecutorService newTimerThread() {
    return Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "auto-naming-timer");
      thread.setDaemon(true);
      return thread;
    });
  }
}
