package com.consullo.agentstream.detect.server;

import com.consullo.agentstream.core.text.RollingTextBuffer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-session state of {@link ServerDetector}. Guarded by its own monitor.
 */
final class ServerSessionState {

  // trailing text after the last newline, rescanned with the next chunk
  final RollingTextBuffer partialLine;
  // normalized url -> server, in discovery order
  final Map<String, DetectedServer> servers = new LinkedHashMap<>();
  boolean errorReported;

  ServerSessionState(int bufferSize) {
    this.partialLine = new RollingTextBuffer(bufferSize);
  }
}
