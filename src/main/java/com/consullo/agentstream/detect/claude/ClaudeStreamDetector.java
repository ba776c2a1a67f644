package com.consullo.agentstream.detect.claude;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import com.consullo.agentstream.core.BlockKind;
import com.consullo.agentstream.core.OutputDetector;
import com.consullo.agentstream.core.TokenUsage;
import com.consullo.agentstream.core.json.JsonRecords;
import com.consullo.agentstream.core.state.SessionStateTable;
import com.consullo.agentstream.core.text.AnsiText;
import com.consullo.agentstream.detect.OpenBlock;
import com.consullo.agentstream.detect.StreamDetectorConfig;
import com.consullo.agentstream.detect.StreamPhase;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes Claude CLI {@code --output-format stream-json} output into canonical agent events.
 *
 * <p>
 * Two record families are understood:
 * <ul>
 * <li>Streaming events ({@code message_start}, {@code content_block_start/delta/stop},
 * {@code message_delta}, {@code message_stop}, {@code error}), bare or wrapped as
 * {@code {"type":"stream_event","event":{...}}}.</li>
 * <li>Print-mode records: {@code system}/{@code init} (session), {@code assistant} (a complete
 * message) and {@code result} (final summary).</li>
 * </ul>
 * An {@code assistant} record whose message id was already streamed is not replayed.
 * </p>
 *
 * @since 1.0
 */
public final class ClaudeStreamDetector implements OutputDetector {

  public static final String ID = "stream-json-detector";

  private static final Logger LOGGER = LoggerFactory.getLogger(ClaudeStreamDetector.class);

  private final SessionStateTable<ClaudeSessionState> states;

  public ClaudeStreamDetector() {
    this(StreamDetectorConfig.defaults());
  }

  public ClaudeStreamDetector(final StreamDetectorConfig config) {
    Validate.notNull(config, "config must not be null");
    this.states = new SessionStateTable<>(id -> new ClaudeSessionState(config.maxPendingChars()));
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public List<AgentEvent> processOutput(final String sessionId, final String data) throws Exception {
    List<AgentEvent> events = new ArrayList<>();
    ClaudeSessionState state = states.getOrCreate(sessionId);
    synchronized (state) {
      for (JsonNode record : state.records.feed(AnsiText.strip(data))) {
        if (!record.isObject()) {
          continue;
        }
        JsonNode event = record;
        if ("stream_event".equals(JsonRecords.text(record, "type")) && record.path("event").isObject()) {
          event = record.get("event");
        }
        processEvent(sessionId, state, event, events);
      }
    }
    return events;
  }

  @Override
  public List<AgentEvent> onExit(final String sessionId, final int exitCode) throws Exception {
    List<AgentEvent> events = new ArrayList<>();
    ClaudeSessionState state = states.remove(sessionId).orElse(null);
    if (state != null) {
      synchronized (state) {
        if (state.messageStarted) {
          for (OpenBlock block : state.openBlocks.values()) {
            events.add(blockEnd(sessionId, state, block.index(), block.kind()));
          }
          events.add(AgentEvent.of(sessionId, AgentEventType.MESSAGE_END, AgentEvent.payloadBuilder()
              .put("messageId", state.messageId)
              .put("model", state.model)
              .put("stopReason", "terminal_exit")
              .put("exitCode", exitCode)
              .put("usage", state.usage)
              .build()));
          LOGGER.info("Session {} exited mid-message {} (code {})", sessionId, state.messageId, exitCode);
        }
      }
    }
    events.add(AgentEvent.of(sessionId, AgentEventType.PROCESS_EXIT, AgentEvent.payloadBuilder()
        .put("exitCode", exitCode)
        .build()));
    return events;
  }

  @Override
  public void cleanup(final String sessionId) {
    states.remove(sessionId);
  }

  /**
   * Returns the lifecycle phase for a session (IDLE if unknown).
   *
   * @param sessionId session id
   * @return phase
   */
  public StreamPhase phase(final String sessionId) {
    return states.find(sessionId).map(s -> {
      synchronized (s) {
        return s.phase;
      }
    }).orElse(StreamPhase.IDLE);
  }

  private void processEvent(String sessionId, ClaudeSessionState state, JsonNode event, List<AgentEvent> out) {
    String type = JsonRecords.text(event, "type");
    if (type == null) {
      return;
    }
    state.lastEventTime = Instant.now();

    switch (type) {
      case "system":
        onSystem(sessionId, state, event, out);
        break;
      case "message_start":
        onMessageStart(sessionId, state, event.path("message"), out);
        break;
      case "content_block_start":
        onBlockStart(sessionId, state, event, out);
        break;
      case "content_block_delta":
        onBlockDelta(sessionId, state, event, out);
        break;
      case "content_block_stop":
        onBlockStop(sessionId, state, event, out);
        break;
      case "message_delta":
        onMessageDelta(state, event);
        break;
      case "message_stop":
        if (state.messageStarted) {
          out.add(messageEnd(sessionId, state, state.stopReason, state.usage));
        }
        state.resetMessage();
        state.phase = StreamPhase.TURN_CLOSED;
        break;
      case "error":
        fail(sessionId, state, errorText(event.get("error"), "Unknown error"), out);
        break;
      case "assistant":
        onAssistant(sessionId, state, event.path("message"), out);
        break;
      case "result":
        if (event.path("is_error").asBoolean(false)) {
          String error = JsonRecords.nonEmptyText(event, "result");
          if (error == null) {
            error = JsonRecords.nonEmptyText(event, "subtype");
          }
          fail(sessionId, state, error != null ? error : "Agent run failed", out);
        } else {
          LOGGER.debug("Run finished in session {} ({})", sessionId, JsonRecords.text(event, "subtype"));
        }
        break;
      default:
        LOGGER.debug("Ignoring Claude record type {} in session {}", type, sessionId);
        break;
    }
  }

  private void onSystem(String sessionId, ClaudeSessionState state, JsonNode event, List<AgentEvent> out) {
    String agentSessionId = JsonRecords.nonEmptyText(event, "session_id");
    if (!"init".equals(JsonRecords.text(event, "subtype")) || agentSessionId == null) {
      return;
    }
    state.sessionId = agentSessionId;
    state.model = JsonRecords.nonEmptyText(event, "model");
    state.phase = StreamPhase.SESSION_OPEN;
    out.add(AgentEvent.of(sessionId, AgentEventType.SESSION_INIT, AgentEvent.payloadBuilder()
        .put("sessionId", agentSessionId)
        .put("model", state.model == null ? "" : state.model)
        .putIfPresent("cwd", JsonRecords.text(event, "cwd"))
        .build()));
    LOGGER.info("Claude session {} initialized in terminal {} (model {})", agentSessionId, sessionId, state.model);
  }

  private void onMessageStart(String sessionId, ClaudeSessionState state, JsonNode message, List<AgentEvent> out) {
    if (!message.isObject()) {
      return;
    }
    state.resetMessage();
    state.messageId = JsonRecords.text(message, "id");
    String model = JsonRecords.nonEmptyText(message, "model");
    if (model != null) {
      state.model = model;
    }
    state.usage = usageOf(message.get("usage"));
    state.markStreamed(state.messageId);
    startMessage(sessionId, state, state.usage, out);
  }

  private void onBlockStart(String sessionId, ClaudeSessionState state, JsonNode event, List<AgentEvent> out) {
    JsonNode contentBlock = event.get("content_block");
    if (contentBlock == null || !contentBlock.isObject()) {
      return;
    }
    ensureMessageStart(sessionId, state, out);
    int index = indexOf(event, state.blockIndex + 1);
    state.blockIndex = index;

    String rawType = JsonRecords.text(contentBlock, "type");
    BlockKind kind = BlockKind.fromWireName(rawType);
    OpenBlock block = new OpenBlock(index, kind, JsonRecords.text(contentBlock, "name"));
    state.openBlocks.put(index, block);

    AgentEvent.PayloadBuilder payload = AgentEvent.payloadBuilder()
        .put("messageId", state.messageId)
        .put("blockIndex", index)
        .put("blockType", rawType)
        .putIfPresent("blockId", JsonRecords.text(contentBlock, "id"));
    if (kind == BlockKind.TOOL_USE) {
      payload.put("toolId", JsonRecords.text(contentBlock, "id"))
          .put("name", block.toolName())
          .put("toolName", block.toolName());
    }
    payload.putIfPresent("text", JsonRecords.nonEmptyText(contentBlock, "text"))
        .putIfPresent("thinking", JsonRecords.nonEmptyText(contentBlock, "thinking"));
    out.add(AgentEvent.of(sessionId, AgentEventType.startOf(kind), payload.build()));
  }

  private void onBlockDelta(String sessionId, ClaudeSessionState state, JsonNode event, List<AgentEvent> out) {
    JsonNode delta = event.get("delta");
    if (delta == null || !delta.isObject()) {
      return;
    }
    String deltaType = JsonRecords.text(delta, "type");
    if ("signature_delta".equals(deltaType)) {
      return;
    }
    int index = indexOf(event, state.blockIndex);
    OpenBlock block = state.openBlocks.get(index);
    if (block == null) {
      // No start observed for this block: open it from the delta's shape.
      ensureMessageStart(sessionId, state, out);
      if (index < 0) {
        index = 0;
      }
      BlockKind kind = kindOfDelta(deltaType);
      block = new OpenBlock(index, kind, null);
      state.openBlocks.put(index, block);
      state.blockIndex = Math.max(state.blockIndex, index);
      out.add(AgentEvent.of(sessionId, AgentEventType.startOf(kind), AgentEvent.payloadBuilder()
          .put("messageId", state.messageId)
          .put("blockIndex", index)
          .put("blockType", kind.wireName())
          .build()));
    }

    BlockKind effective = block.kind() != BlockKind.OTHER ? block.kind() : kindOfDelta(deltaType);
    out.add(AgentEvent.of(sessionId, AgentEventType.deltaOf(effective), AgentEvent.payloadBuilder()
        .put("messageId", state.messageId)
        .put("blockIndex", block.index())
        .put("blockType", block.kind().wireName())
        .putIfPresent("text", JsonRecords.text(delta, "text"))
        .putIfPresent("thinking", JsonRecords.text(delta, "thinking"))
        .putIfPresent("partialJson", JsonRecords.text(delta, "partial_json"))
        .build()));
  }

  private void onBlockStop(String sessionId, ClaudeSessionState state, JsonNode event, List<AgentEvent> out) {
    int index = indexOf(event, state.blockIndex);
    OpenBlock block = state.openBlocks.remove(index);
    BlockKind kind = block != null ? block.kind() : BlockKind.OTHER;
    out.add(blockEnd(sessionId, state, index, kind));
  }

  private void onMessageDelta(ClaudeSessionState state, JsonNode event) {
    String stopReason = JsonRecords.nonEmptyText(event.get("delta"), "stop_reason");
    if (stopReason != null) {
      state.stopReason = stopReason;
    }
    JsonNode usage = event.get("usage");
    if (usage != null && usage.has("output_tokens")) {
      long outputTokens = JsonRecords.number(usage, "output_tokens", 0L);
      state.usage = state.usage != null ? state.usage.withOutputTokens(outputTokens) : TokenUsage.of(0L, outputTokens);
    }
  }

  /**
   * Emits a complete print-mode message: start, one start/delta/end triple per block, end.
   */
  private void onAssistant(String sessionId, ClaudeSessionState state, JsonNode message, List<AgentEvent> out) {
    if (!message.isObject()) {
      return;
    }
    String messageId = JsonRecords.text(message, "id");
    if (state.wasStreamed(messageId)) {
      LOGGER.debug("Skipping print-mode copy of streamed message {}", messageId);
      return;
    }

    state.resetMessage();
    state.messageId = messageId;
    String model = JsonRecords.nonEmptyText(message, "model");
    if (model != null) {
      state.model = model;
    }
    TokenUsage usage = usageOf(message.get("usage"));
    state.usage = usage;
    startMessage(sessionId, state, usage, out);

    JsonNode content = message.path("content");
    int index = 0;
    for (JsonNode block : content) {
      String blockType = JsonRecords.text(block, "type");
      BlockKind kind = BlockKind.fromWireName(blockType);
      String body = null;
      String bodyKey = null;
      AgentEvent.PayloadBuilder start = AgentEvent.payloadBuilder()
          .put("messageId", state.messageId)
          .put("blockIndex", index)
          .put("blockType", blockType);
      switch (kind) {
        case TEXT:
          body = JsonRecords.nonEmptyText(block, "text");
          bodyKey = "text";
          break;
        case THINKING:
          body = JsonRecords.nonEmptyText(block, "thinking");
          bodyKey = "thinking";
          break;
        case TOOL_USE:
          String name = JsonRecords.text(block, "name");
          start.put("toolId", JsonRecords.text(block, "id")).put("name", name).put("toolName", name);
          if (JsonRecords.isPresent(block.get("input"))) {
            body = JsonRecords.write(block.get("input"));
          }
          bodyKey = "partialJson";
          break;
        default:
          // tool results and other non-renderable blocks
          continue;
      }
      if (kind != BlockKind.TOOL_USE && body == null) {
        continue;
      }
      state.blockIndex = index;
      out.add(AgentEvent.of(sessionId, AgentEventType.startOf(kind), start.build()));
      if (body != null) {
        out.add(AgentEvent.of(sessionId, AgentEventType.deltaOf(kind), AgentEvent.payloadBuilder()
            .put("messageId", state.messageId)
            .put("blockIndex", index)
            .put("blockType", blockType)
            .put(bodyKey, body)
            .build()));
      }
      out.add(blockEnd(sessionId, state, index, kind));
      index++;
    }

    String stopReason = JsonRecords.nonEmptyText(message, "stop_reason");
    out.add(messageEnd(sessionId, state, stopReason, usage));
    state.resetMessage();
    state.phase = StreamPhase.TURN_CLOSED;
  }

  private void fail(String sessionId, ClaudeSessionState state, String error, List<AgentEvent> out) {
    out.add(AgentEvent.of(sessionId, AgentEventType.ERROR, AgentEvent.payloadBuilder()
        .put("error", error)
        .build()));
    if (state.messageStarted) {
      out.add(messageEnd(sessionId, state, "error", state.usage));
    }
    LOGGER.warn("Claude error in session {}: {}", sessionId, error);
    state.resetMessage();
    state.phase = StreamPhase.TURN_CLOSED;
  }

  private void ensureMessageStart(String sessionId, ClaudeSessionState state, List<AgentEvent> out) {
    if (!state.messageStarted) {
      startMessage(sessionId, state, state.usage, out);
    }
  }

  private static void startMessage(String sessionId, ClaudeSessionState state, TokenUsage usage, List<AgentEvent> out) {
    state.messageStarted = true;
    state.phase = StreamPhase.TURN_OPEN;
    out.add(AgentEvent.of(sessionId, AgentEventType.MESSAGE_START, AgentEvent.payloadBuilder()
        .put("messageId", state.messageId)
        .put("model", state.model)
        .put("usage", usage)
        .build()));
  }

  private static AgentEvent messageEnd(String sessionId, ClaudeSessionState state, String stopReason, TokenUsage usage) {
    return AgentEvent.of(sessionId, AgentEventType.MESSAGE_END, AgentEvent.payloadBuilder()
        .put("messageId", state.messageId)
        .put("model", state.model)
        .put("stopReason", stopReason)
        .put("usage", usage)
        .build());
  }

  private static AgentEvent blockEnd(String sessionId, ClaudeSessionState state, int index, BlockKind kind) {
    return AgentEvent.of(sessionId, AgentEventType.BLOCK_END, AgentEvent.payloadBuilder()
        .put("messageId", state.messageId)
        .put("blockIndex", index)
        .put("blockType", kind.wireName())
        .build());
  }

  private static int indexOf(JsonNode event, int fallback) {
    JsonNode index = event.get("index");
    return index != null && index.canConvertToInt() && index.isIntegralNumber() ? index.asInt() : fallback;
  }

  private static BlockKind kindOfDelta(String deltaType) {
    if (deltaType == null) {
      return BlockKind.OTHER;
    }
    switch (deltaType) {
      case "text_delta":
        return BlockKind.TEXT;
      case "thinking_delta":
        return BlockKind.THINKING;
      case "input_json_delta":
        return BlockKind.TOOL_USE;
      default:
        return BlockKind.OTHER;
    }
  }

  private static TokenUsage usageOf(JsonNode usage) {
    if (usage == null || !usage.isObject()) {
      return null;
    }
    return new TokenUsage(
        JsonRecords.number(usage, "input_tokens", 0L),
        JsonRecords.number(usage, "output_tokens", 0L),
        JsonRecords.number(usage, "cache_read_input_tokens", 0L));
  }

  private static String errorText(JsonNode error, String fallback) {
    if (error == null) {
      return fallback;
    }
    if (error.isTextual() && !error.asText().isEmpty()) {
      return error.asText();
    }
    String message = JsonRecords.nonEmptyText(error, "message");
    return message != null ? message : fallback;
  }
}
