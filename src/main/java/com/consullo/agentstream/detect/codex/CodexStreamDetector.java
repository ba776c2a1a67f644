package com.consullo.agentstream.detect.codex;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes the Codex CLI {@code --json} stream into canonical agent events.
 *
 * <p>
 * Codex event flow:
 * <pre>
 * thread.started -> turn.started -> item.started / item.updated / item.completed -> turn.completed
 * </pre>
 * Mapping:
 * <ul>
 * <li>{@code thread.started} -> session-init</li>
 * <li>first item record of a turn -> message-start (synthetic; turn.started may be missing)</li>
 * <li>first record of an item -> text / thinking / tool start, later records -> deltas</li>
 * <li>{@code item.completed} -> unstreamed content, then block-end</li>
 * <li>{@code turn.completed} -> message-end with usage</li>
 * <li>{@code turn.failed} / {@code error} -> error, plus message-end(error) if a message is open</li>
 * </ul>
 * JSON-RPC approval requests skip the state machine entirely.
 * </p>
 *
 * @since 1.0
 */
public final class CodexStreamDetector implements OutputDetector {

  public static final String ID = "codex-stream-detector";

  private static final Logger LOGGER = LoggerFactory.getLogger(CodexStreamDetector.class);

  private final SessionStateTable<CodexSessionState> states;

  public CodexStreamDetector() {
    this(StreamDetectorConfig.defaults());
  }

  public CodexStreamDetector(final StreamDetectorConfig config) {
    Validate.notNull(config, "config must not be null");
    this.states = new SessionStateTable<>(id -> new CodexSessionState(config.maxPendingChars()));
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public List<AgentEvent> processOutput(final String sessionId, final String data) throws Exception {
    List<AgentEvent> events = new ArrayList<>();
    CodexSessionState state = states.getOrCreate(sessionId);
    synchronized (state) {
      for (JsonNode record : state.records.feed(AnsiText.strip(data))) {
        if (!record.isObject()) {
          continue;
        }
        if (CodexApprovalTranslator.isApprovalRequest(record)) {
          AgentEvent approval = CodexApprovalTranslator.translate(sessionId, record);
          LOGGER.info("Approval request {} for session {}", approval.payload().get("method"), sessionId);
          events.add(approval);
          continue;
        }
        processRecord(sessionId, state, record, events);
      }
    }
    return events;
  }

  @Override
  public List<AgentEvent> onExit(final String sessionId, final int exitCode) throws Exception {
    List<AgentEvent> events = new ArrayList<>();
    CodexSessionState state = states.remove(sessionId).orElse(null);
    if (state != null) {
      synchronized (state) {
        if (state.messageStarted) {
          for (OpenBlock block : state.openItems.values()) {
            events.add(blockEnd(sessionId, state, block.index(), block.kind()));
          }
          events.add(AgentEvent.of(sessionId, AgentEventType.MESSAGE_END, AgentEvent.payloadBuilder()
              .put("messageId", state.threadId)
              .put("model", null)
              .put("stopReason", "terminal_exit")
              .put("exitCode", exitCode)
              .put("usage", state.usage)
              .build()));
          LOGGER.info("Session {} exited mid-turn (code {}), closed message", sessionId, exitCode);
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

  private void processRecord(String sessionId, CodexSessionState state, JsonNode record, List<AgentEvent> out) {
    String type = JsonRecords.text(record, "type");
    if (type == null) {
      return;
    }
    state.lastEventTime = Instant.now();

    switch (type) {
      case "thread.started":
        state.threadId = JsonRecords.text(record, "thread_id");
        state.phase = StreamPhase.SESSION_OPEN;
        out.add(AgentEvent.of(sessionId, AgentEventType.SESSION_INIT, AgentEvent.payloadBuilder()
            .put("sessionId", state.threadId)
            .put("model", "")
            .build()));
        LOGGER.info("Codex thread {} started in session {}", state.threadId, sessionId);
        break;

      case "turn.started":
        state.resetTurn();
        state.usage = null;
        state.phase = StreamPhase.TURN_OPEN;
        break;

      case "turn.completed":
        JsonNode usage = record.get("usage");
        if (JsonRecords.isPresent(usage)) {
          state.usage = new TokenUsage(
              JsonRecords.number(usage, "input_tokens", 0L),
              JsonRecords.number(usage, "output_tokens", 0L),
              JsonRecords.number(usage, "cached_input_tokens", 0L));
        }
        if (state.messageStarted) {
          out.add(messageEnd(sessionId, state, "end_turn"));
        }
        state.resetTurn();
        state.phase = StreamPhase.TURN_CLOSED;
        break;

      case "turn.failed":
        failTurn(sessionId, state, errorText(record, "Turn failed"), out);
        break;

      case "error":
        failTurn(sessionId, state, errorText(record, "Unknown error"), out);
        break;

      case "item.started":
      case "item.updated":
      case "item.completed":
        JsonNode item = record.get("item");
        if (item == null || !item.isObject()) {
          LOGGER.debug("Ignoring {} without item in session {}", type, sessionId);
          return;
        }
        processItem(sessionId, state, type, item, out);
        break;

      default:
        LOGGER.debug("Ignoring Codex record type {} in session {}", type, sessionId);
        break;
    }
  }

  private void processItem(String sessionId, CodexSessionState state, String type, JsonNode item, List<AgentEvent> out) {
    ensureMessageStart(sessionId, state, out);

    String itemId = JsonRecords.text(item, "id");
    if (itemId == null) {
      itemId = "";
    }
    CodexItemKind kind = CodexItemKind.fromWireName(JsonRecords.text(item, "type"));

    OpenBlock block = state.openItems.get(itemId);
    if (block == null) {
      state.blockIndex++;
      block = new OpenBlock(state.blockIndex, kind.blockKind(), toolNameFor(kind, item));
      state.openItems.put(itemId, block);
      out.add(blockStart(sessionId, state, block, itemId));
    }

    switch (type) {
      case "item.started":
        break;
      case "item.updated":
        emitDelta(sessionId, state, block, kind, item, false, out);
        break;
      default:
        emitDelta(sessionId, state, block, kind, item, true, out);
        // Known imprecision: the block-end index is the turn's running index, not the item's.
        out.add(blockEnd(sessionId, state, state.blockIndex, block.kind()));
        state.openItems.remove(itemId);
        break;
    }
  }

  private void emitDelta(
      String sessionId,
      CodexSessionState state,
      OpenBlock block,
      CodexItemKind kind,
      JsonNode item,
      boolean completed,
      List<AgentEvent> out) {
    switch (kind) {
      case AGENT_MESSAGE:
        textDelta(sessionId, state, block, JsonRecords.nonEmptyText(item, "text"), out);
        break;
      case PLAN_UPDATE:
        textDelta(sessionId, state, block, JsonRecords.nonEmptyText(item, "plan"), out);
        break;
      case REASONING:
        String reasoning = JsonRecords.nonEmptyText(item, "reasoning");
        if (reasoning == null) {
          reasoning = JsonRecords.nonEmptyText(item, "text");
        }
        textDelta(sessionId, state, block, reasoning, out);
        break;
      default:
        JsonNode input = toolInput(kind, item, completed);
        if (input != null) {
          out.add(AgentEvent.of(sessionId, AgentEventType.TOOL_INPUT_DELTA, AgentEvent.payloadBuilder()
              .put("messageId", state.threadId)
              .put("blockIndex", block.index())
              .put("partialJson", JsonRecords.write(input))
              .build()));
        }
        break;
    }
  }

  private void textDelta(String sessionId, CodexSessionState state, OpenBlock block, String snapshot, List<AgentEvent> out) {
    String delta = block.advanceTo(snapshot);
    if (delta.isEmpty()) {
      return;
    }
    boolean thinking = block.kind() == BlockKind.THINKING;
    out.add(AgentEvent.of(sessionId, AgentEventType.deltaOf(block.kind()), AgentEvent.payloadBuilder()
        .put("messageId", state.threadId)
        .put("blockIndex", block.index())
        .put("blockType", block.kind().wireName())
        .put(thinking ? "thinking" : "text", delta)
        .build()));
  }

  /**
   * Builds the tool-input snapshot for an item, or null when it carries nothing to show yet.
   */
  private static JsonNode toolInput(CodexItemKind kind, JsonNode item, boolean completed) {
    ObjectNode input = JsonRecords.newObject();
    switch (kind) {
      case COMMAND_EXECUTION:
        String command = JsonRecords.nonEmptyText(item, "command");
        String output = JsonRecords.nonEmptyText(item, "aggregated_output");
        if (output == null) {
          output = JsonRecords.nonEmptyText(item, "output");
        }
        if (!completed) {
          output = null;
        }
        if (command == null && output == null) {
          return null;
        }
        input.put("command", command);
        if (output != null) {
          input.put("output", output);
        }
        if (completed && item.hasNonNull("exit_code")) {
          input.set("exit_code", item.get("exit_code"));
        }
        return input;

      case FILE_CHANGE:
        String filename = JsonRecords.nonEmptyText(item, "filename");
        if (filename != null) {
          input.put("filename", filename);
          putIfPresent(input, "diff", JsonRecords.nonEmptyText(item, "diff"));
          if (completed) {
            putIfPresent(input, "content", JsonRecords.nonEmptyText(item, "content"));
          }
          return input;
        }
        JsonNode changes = item.get("changes");
        if (changes != null && changes.isArray() && changes.size() > 0) {
          input.set("changes", changes);
          return input;
        }
        return null;

      case MCP_TOOL_CALL:
        JsonNode arguments = item.get("arguments");
        return JsonRecords.isPresent(arguments) ? arguments : null;

      case WEB_SEARCH:
        String query = JsonRecords.nonEmptyText(item, "query");
        if (query == null) {
          return null;
        }
        input.put("query", query);
        return input;

      default:
        return null;
    }
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private void failTurn(String sessionId, CodexSessionState state, String error, List<AgentEvent> out) {
    out.add(AgentEvent.of(sessionId, AgentEventType.ERROR, AgentEvent.payloadBuilder()
        .put("error", error)
        .build()));
    if (state.messageStarted) {
      out.add(messageEnd(sessionId, state, "error"));
    }
    LOGGER.warn("Codex error in session {}: {}", sessionId, error);
    state.resetTurn();
    state.phase = StreamPhase.TURN_CLOSED;
  }

  private void ensureMessageStart(String sessionId, CodexSessionState state, List<AgentEvent> out) {
    if (state.messageStarted) {
      return;
    }
    state.messageStarted = true;
    state.phase = StreamPhase.TURN_OPEN;
    out.add(AgentEvent.of(sessionId, AgentEventType.MESSAGE_START, AgentEvent.payloadBuilder()
        .put("messageId", state.threadId)
        .put("model", null)
        .put("usage", null)
        .build()));
  }

  private static AgentEvent messageEnd(String sessionId, CodexSessionState state, String stopReason) {
    return AgentEvent.of(sessionId, AgentEventType.MESSAGE_END, AgentEvent.payloadBuilder()
        .put("messageId", state.threadId)
        .put("model", null)
        .put("stopReason", stopReason)
        .put("usage", state.usage)
        .build());
  }

  private static AgentEvent blockStart(String sessionId, CodexSessionState state, OpenBlock block, String itemId) {
    AgentEvent.PayloadBuilder payload = AgentEvent.payloadBuilder()
        .put("messageId", state.threadId)
        .put("blockIndex", block.index())
        .put("blockType", block.kind().wireName());
    if (block.kind() == BlockKind.TOOL_USE) {
      payload.put("toolId", itemId)
          .put("name", block.toolName())
          .put("toolName", block.toolName());
    }
    return AgentEvent.of(sessionId, AgentEventType.startOf(block.kind()), payload.build());
  }

  private static AgentEvent blockEnd(String sessionId, CodexSessionState state, int blockIndex, BlockKind kind) {
    return AgentEvent.of(sessionId, AgentEventType.BLOCK_END, AgentEvent.payloadBuilder()
        .put("messageId", state.threadId)
        .put("blockIndex", blockIndex)
        .put("blockType", kind.wireName())
        .build());
  }

  private static String toolNameFor(CodexItemKind kind, JsonNode item) {
    switch (kind) {
      case MCP_TOOL_CALL:
        String toolName = JsonRecords.nonEmptyText(item, "tool_name");
        if (toolName == null) {
          toolName = JsonRecords.nonEmptyText(item, "tool");
        }
        return toolName != null ? toolName : kind.wireName();
      case UNKNOWN:
        String rawType = JsonRecords.nonEmptyText(item, "type");
        return rawType != null ? rawType : kind.wireName();
      default:
        return kind.wireName();
    }
  }

  private static String errorText(JsonNode record, String fallback) {
    String message = JsonRecords.nonEmptyText(record, "message");
    if (message != null) {
      return message;
    }
    JsonNode error = record.get("error");
    if (error != null && error.isTextual() && !error.asText().isEmpty()) {
      return error.asText();
    }
    String nested = JsonRecords.nonEmptyText(error, "message");
    return nested != null ? nested : fallback;
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

  /**
   * Returns the ids of items currently open in the session's turn.
   *
   * @param sessionId session id
   * @return open item ids in start order
   */
  public List<String> openItemIds(final String sessionId) {
    return states.find(sessionId).map(s -> {
      synchronized (s) {
        return List.copyOf(s.openItems.keySet());
      }
    }).orElse(List.of());
  }

  /**
   * Returns the running block index of the session's current turn (-1 if none).
   *
   * @param sessionId session id
   * @return block index
   */
  public int currentBlockIndex(final String sessionId) {
    return states.find(sessionId).map(s -> {
      synchronized (s) {
        return s.blockIndex;
      }
    }).orElse(-1);
  }
}
