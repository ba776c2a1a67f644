package com.consullo.agentstream.core;

/**
 * Token accounting reported by an agent for one message or turn.
 *
 * @param inputTokens prompt tokens
 * @param outputTokens completion tokens
 * @param cachedInputTokens prompt tokens served from cache (0 when not reported)
 * @since 1.0
 */
public record TokenUsage(long inputTokens, long outputTokens, long cachedInputTokens) {

  public static TokenUsage of(final long inputTokens, final long outputTokens) {
    return new TokenUsage(inputTokens, outputTokens, 0L);
  }

  /**
   * Returns a copy with the output token count replaced.
   *
   * @param outputTokens new output count
   * @return updated usage
   */
  public TokenUsage withOutputTokens(final long outputTokens) {
    return new TokenUsage(this.inputTokens, outputTokens, this.cachedInputTokens);
  }
}
