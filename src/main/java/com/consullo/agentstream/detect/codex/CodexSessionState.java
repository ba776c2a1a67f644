package com.consullo.agentstream.detect.codex;

import com.consullo.agentstream.core.TokenUsage;
import com.consullo.agentstream.core.json.PendingRecordBuffer;
import com.consullo.agentstream.detect.OpenBlock;
import com.consullo.agentstream.detect.StreamPhase;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable protocol state for one Codex session. Guarded by its own monitor.
 *
 * @since 1.0
 */
final class CodexSessionState {

  final PendingRecordBuffer records;

  StreamPhase phase = StreamPhase.IDLE;
  String threadId;
  boolean messageStarted;
  int blockIndex = -1;
  // item id -> open block, in start order
  final Map<String, OpenBlock> openItems = new LinkedHashMap<>();
  TokenUsage usage;
  Instant lastEventTime = Instant.now();

  CodexSessionState(int maxPendingChars) {
    this.records = new PendingRecordBuffer(maxPendingChars);
  }

  /**
   * Resets per-turn counters when a turn starts or ends.
   */
  void resetTurn() {
    messageStarted = false;
    blockIndex = -1;
    openItems.clear();
  }
}
