package com.consullo.agentstream.detect;

/**
 * Lifecycle phase of one agent session as seen by a stream-normalization detector.
 *
 * @since 1.0
 */
public enum StreamPhase {
  /** No session record seen yet. */
  IDLE,
  /** Session record seen, no turn in progress. */
  SESSION_OPEN,
  /** A turn (canonical message) is in progress. */
  TURN_OPEN,
  /** The last turn completed or failed. */
  TURN_CLOSED
}
