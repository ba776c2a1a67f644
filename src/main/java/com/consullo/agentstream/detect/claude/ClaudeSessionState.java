package com.consullo.agentstream.detect.claude;

import com.consullo.agentstream.core.TokenUsage;
import com.consullo.agentstream.core.json.PendingRecordBuffer;
import com.consullo.agentstream.detect.OpenBlock;
import com.consullo.agentstream.detect.StreamPhase;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable protocol state for one Claude session. Guarded by its own monitor.
 *
 * @since 1.0
 */
final class ClaudeSessionState {

  private static final int STREAMED_IDS_RETAINED = 64;

  final PendingRecordBuffer records;

  StreamPhase phase = StreamPhase.IDLE;
  String sessionId;
  String messageId;
  String model;
  boolean messageStarted;
  int blockIndex = -1;
  // vendor block index -> open block
  final Map<Integer, OpenBlock> openBlocks = new LinkedHashMap<>();
  TokenUsage usage;
  String stopReason;
  Instant lastEventTime = Instant.now();

  // ids of messages delivered through stream events, so print-mode copies are not replayed
  private final Set<String> streamedMessageIds = new LinkedHashSet<>();

  ClaudeSessionState(int maxPendingChars) {
    this.records = new PendingRecordBuffer(maxPendingChars);
  }

  void resetMessage() {
    messageId = null;
    messageStarted = false;
    blockIndex = -1;
    openBlocks.clear();
    usage = null;
    stopReason = null;
  }

  void markStreamed(String id) {
    if (id == null) {
      return;
    }
    streamedMessageIds.add(id);
    if (streamedMessageIds.size() > STREAMED_IDS_RETAINED) {
      streamedMessageIds.remove(streamedMessageIds.iterator().next());
    }
  }

  boolean wasStreamed(String id) {
    return id != null && streamedMessageIds.contains(id);
  }
}
