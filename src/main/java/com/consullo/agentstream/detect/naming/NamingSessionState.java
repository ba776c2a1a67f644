package com.consullo.agentstream.detect.naming;

import com.consullo.agentstream.core.text.RollingTextBuffer;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-session state of {@link AutoNamingDetector}. Guarded by its own monitor.
 */
final class NamingSessionState {

  final RollingTextBuffer buffer;
  ScheduledFuture<?> debounceTask;
  boolean queryInFlight;
  Instant lastNameChange;
  String currentName;

  NamingSessionState(int bufferSize) {
    this.buffer = new RollingTextBuffer(bufferSize);
  }

  void cancelDebounce() {
    if (debounceTask != null) {
      debounceTask.cancel(false);
      debounceTask = null;
    }
  }
}
