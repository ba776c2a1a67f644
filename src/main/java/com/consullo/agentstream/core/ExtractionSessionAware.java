package com.consullo.agentstream.core;

/**
 * Implemented by detectors that only capture output once a caller has armed them for a session.
 *
 * @since 1.0
 */
public interface ExtractionSessionAware {

  /**
   * Arms the detector for a terminal session. Any previous capture for the session is discarded.
   *
   * @param sessionId terminal session id
   * @param extractionSessionId caller-side id reported back in completion events
   */
  void registerExtractionSession(final String sessionId, final String extractionSessionId);
}
