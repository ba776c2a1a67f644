package com.consullo.agentstream.detect.review;

import org.apache.commons.lang3.Validate;

/**
 * Configuration for {@link ReviewDetector}.
 *
 * @param bufferSize maximum captured characters per session
 * @param retainedBuffers number of completed review buffers kept for {@link ReviewDetector#buffer}
 * @param failureTailSize characters of output attached to a failure event
 * @since 1.0
 */
public record ReviewConfig(int bufferSize, int retainedBuffers, int failureTailSize) {

  public ReviewConfig {
    Validate.isTrue(bufferSize > 0, "bufferSize must be positive");
    Validate.isTrue(retainedBuffers >= 0, "retainedBuffers must not be negative");
    Validate.isTrue(failureTailSize >= 0, "failureTailSize must not be negative");
  }

  public static ReviewConfig defaults() {
    return new ReviewConfig(500_000, 10, 2000);
  }
}
