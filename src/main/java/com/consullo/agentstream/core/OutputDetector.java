package com.consullo.agentstream.core;

import java.util.List;

/**
 * Watches terminal output for one kind of pattern and turns it into canonical events.
 *
 * <p>Implementations keep their own per-session state, created lazily on first output. For a
 * given session, callers must deliver chunks in arrival order and must not call into the detector
 * concurrently for that session. Distinct sessions may be driven from different threads.
 *
 * @since 1.0
 */
public interface OutputDetector {

  /**
   * Unique identifier for this detector.
   *
   * @return detector id
   */
  String id();

  /**
   * Processes one chunk of output. Terminal control sequences are stripped by the detector.
   *
   * @param sessionId terminal session id
   * @param data decoded output chunk (may contain ANSI codes and PTY line-wrap corruption)
   * @return detected events, possibly empty
   * @throws Exception if processing fails
   */
  List<AgentEvent> processOutput(final String sessionId, final String data) throws Exception;

  /**
   * Handles termination of the underlying process. Called once per process; lifecycles left open
   * are closed with synthetic events and the session state is released.
   *
   * @param sessionId terminal session id
   * @param exitCode process exit code
   * @return detected events, possibly empty
   * @throws Exception if processing fails
   */
  List<AgentEvent> onExit(final String sessionId, final int exitCode) throws Exception;

  /**
   * Releases state and cancels pending timers for a session. Idempotent.
   *
   * @param sessionId terminal session id
   * @throws Exception if cleanup fails
   */
  void cleanup(final String sessionId) throws Exception;
}
