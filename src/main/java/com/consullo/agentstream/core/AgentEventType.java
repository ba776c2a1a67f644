package com.consullo.agentstream.core;

/**
 * Closed taxonomy of canonical event types.
 *
 * <p>Each constant carries the wire name consumers see; the names match the event channel the
 * renderer already understands.
 *
 * @since 1.0
 */
public enum AgentEventType {

  SESSION_INIT("agent-session-init"),
  MESSAGE_START("agent-message-start"),
  MESSAGE_END("agent-message-end"),
  TEXT_START("agent-text-start"),
  TEXT_DELTA("agent-text-delta"),
  THINKING_START("agent-thinking-start"),
  THINKING_DELTA("agent-thinking-delta"),
  TOOL_START("agent-tool-start"),
  TOOL_INPUT_DELTA("agent-tool-input-delta"),
  BLOCK_START("agent-block-start"),
  CONTENT_DELTA("agent-content-delta"),
  BLOCK_END("agent-block-end"),
  ERROR("agent-error"),
  PROCESS_EXIT("agent-process-exit"),
  APPROVAL_REQUEST("agent-approval-request"),
  SERVER_DETECTED("server-detected"),
  SERVER_ERROR("server-error"),
  SERVER_CRASHED("server-crashed"),
  REVIEW_COMPLETED("review-completed"),
  REVIEW_FAILED("review-failed"),
  NAME_SUGGESTED("terminal-name-auto");

  private final String wireName;

  AgentEventType(final String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name used on the consumer channel.
   *
   * @return wire name
   */
  public String wireName() {
    return this.wireName;
  }

  /**
   * Resolves a wire name back to its type.
   *
   * @param wireName wire name
   * @return matching type
   * @throws IllegalArgumentException if no type carries the name
   */
  public static AgentEventType fromWireName(final String wireName) {
    for (AgentEventType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown event type: " + wireName);
  }

  /**
   * Returns the block-start type for a canonical block kind.
   *
   * @param kind block kind
   * @return start event type
   */
  public static AgentEventType startOf(final BlockKind kind) {
    switch (kind) {
      case TEXT:
        return TEXT_START;
      case THINKING:
        return THINKING_START;
      case TOOL_USE:
        return TOOL_START;
      default:
        return BLOCK_START;
    }
  }

  /**
   * Returns the delta type for a canonical block kind.
   *
   * @param kind block kind
   * @return delta event type
   */
  public static AgentEventType deltaOf(final BlockKind kind) {
    switch (kind) {
      case TEXT:
        return TEXT_DELTA;
      case THINKING:
        return THINKING_DELTA;
      case TOOL_USE:
        return TOOL_INPUT_DELTA;
      default:
        return CONTENT_DELTA;
    }
  }
}
