package com.consullo.agentstream.detect;

/**
 * Configuration shared by the vendor stream-normalization detectors.
 *
 * @param maxPendingChars largest unterminated record kept between chunks
 * @since 1.0
 */
public record StreamDetectorConfig(int maxPendingChars) {

  public static StreamDetectorConfig defaults() {
    return new StreamDetectorConfig(4_000_000);
  }
}
