package com.consullo.agentstream.core.state;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.apache.commons.lang3.Validate;

/**
 * Per-session state owned by a single detector.
 *
 * <p>Backed by a {@link ConcurrentHashMap}, so sessions are sharded by id. Callers serialize work
 * on one session by synchronizing on the state object they obtained.
 *
 * @param <S> state type
 * @since 1.0
 */
public final class SessionStateTable<S> {

  private final ConcurrentHashMap<String, S> states = new ConcurrentHashMap<>();
  private final Function<String, S> factory;

  /**
   * Creates a table.
   *
   * @param factory creates fresh state for a session id on first use
   */
  public SessionStateTable(final Function<String, S> factory) {
    Validate.notNull(factory, "factory must not be null");
    this.factory = factory;
  }

  /**
   * Returns the session's state, allocating a fresh record if none exists.
   *
   * @param sessionId session id
   * @return state
   */
  public S getOrCreate(final String sessionId) {
    Validate.notNull(sessionId, "sessionId must not be null");
    return states.computeIfAbsent(sessionId, factory);
  }

  public Optional<S> find(final String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(states.get(sessionId));
  }

  /**
   * Removes the session's state.
   *
   * @param sessionId session id
   * @return removed state, if any
   */
  public Optional<S> remove(final String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(states.remove(sessionId));
  }

  /**
   * Returns true if {@code state} is still the live record for the session. Used by deferred
   * tasks to detect that the session was cleaned up after they were scheduled.
   *
   * @param sessionId session id
   * @param state state captured when the task was scheduled
   * @return true if still current
   */
  public boolean isCurrent(final String sessionId, final S state) {
    return sessionId != null && states.get(sessionId) == state;
  }

  public Collection<S> values() {
    return states.values();
  }

  public int size() {
    return states.size();
  }
}
