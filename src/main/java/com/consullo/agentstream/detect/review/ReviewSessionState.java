package com.consullo.agentstream.detect.review;

import com.consullo.agentstream.core.text.RollingTextBuffer;

/**
 * Per-session state of {@link ReviewDetector}. Guarded by its own monitor.
 */
final class ReviewSessionState {

  final RollingTextBuffer buffer;
  String reviewId;
  boolean capturing;
  boolean completed;

  ReviewSessionState(int bufferSize) {
    this.buffer = new RollingTextBuffer(bufferSize);
  }

  void arm(String reviewId) {
    this.reviewId = reviewId;
    this.capturing = true;
    this.completed = false;
    buffer.clear();
  }
}
