package com.consullo.agentstream.detect.claude;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import com.consullo.agentstream.core.TokenUsage;
import com.consullo.agentstream.detect.StreamPhase;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.consullo.agentstream.core.AgentEventType.BLOCK_END;
import static com.consullo.agentstream.core.AgentEventType.BLOCK_START;
import static com.consullo.agentstream.core.AgentEventType.ERROR;
import static com.consullo.agentstream.core.AgentEventType.MESSAGE_END;
import static com.consullo.agentstream.core.AgentEventType.MESSAGE_START;
import static com.consullo.agentstream.core.AgentEventType.PROCESS_EXIT;
import static com.consullo.agentstream.core.AgentEventType.SESSION_INIT;
import static com.consullo.agentstream.core.AgentEventType.TEXT_DELTA;
import static com.consullo.agentstream.core.AgentEventType.TEXT_START;
import static com.consullo.agentstream.core.AgentEventType.THINKING_DELTA;
import static com.consullo.agentstream.core.AgentEventType.THINKING_START;
import static com.consullo.agentstream.core.AgentEventType.TOOL_INPUT_DELTA;
import static com.consullo.agentstream.core.AgentEventType.TOOL_START;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the Claude stream-json state machine.
 *
 * @since 1.0
 */
public class ClaudeStreamDetectorTest {

  private static final String SESSION = "term-7";

  private static final String INIT =
      "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"sess-42\",\"model\":\"claude-sonnet\",\"cwd\":\"/work\"}";
  private static final String MESSAGE_START_RECORD = stream(
      "{\"type\":\"message_start\",\"message\":{\"id\":\"msg_1\",\"model\":\"claude-sonnet\","
          + "\"usage\":{\"input_tokens\":25,\"output_tokens\":1}}}");

  private ClaudeStreamDetector detector;

  @BeforeEach
  void setUp() {
    detector = new ClaudeStreamDetector();
  }

  @Test
  @DisplayName("Should normalize a streamed text message from init to message_stop")
  void processOutput_StreamedTextMessage_EmitsFullLifecycle() throws Exception {
    List<AgentEvent> events = feed(
        INIT,
        MESSAGE_START_RECORD,
        stream("{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\",\"text\":\"\"}}"),
        stream("{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hi there\"}}"),
        stream("{\"type\":\"content_block_stop\",\"index\":0}"),
        stream("{\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"end_turn\"},\"usage\":{\"output_tokens\":12}}"),
        stream("{\"type\":\"message_stop\"}"));

    assertThat(types(events))
        .containsExactly(SESSION_INIT, MESSAGE_START, TEXT_START, TEXT_DELTA, BLOCK_END, MESSAGE_END);
    assertThat(events.get(0).payload())
        .containsEntry("sessionId", "sess-42")
        .containsEntry("model", "claude-sonnet");
    assertThat(events.get(1).payload()).containsEntry("messageId", "msg_1");
    assertThat(events.get(3).payload()).containsEntry("text", "Hi there").containsEntry("blockIndex", 0);

    AgentEvent end = events.get(5);
    assertThat(end.payload()).containsEntry("stopReason", "end_turn");
    assertThat(end.payloadValue("usage", TokenUsage.class)).isEqualTo(new TokenUsage(25, 12, 0));
    assertThat(detector.phase(SESSION)).isEqualTo(StreamPhase.TURN_CLOSED);
  }

  @Test
  @DisplayName("Should accept bare streaming events without the stream_event wrapper")
  void processOutput_UnwrappedEvents_AreHandled() throws Exception {
    List<AgentEvent> events = feed(
        "{\"type\":\"message_start\",\"message\":{\"id\":\"m\"}}",
        "{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"thinking\",\"thinking\":\"\"}}",
        "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"thinking_delta\",\"thinking\":\"hmm\"}}",
        "{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"signature_delta\",\"signature\":\"abc\"}}");

    assertThat(types(events)).containsExactly(MESSAGE_START, THINKING_START, THINKING_DELTA);
    assertThat(events.get(2).payload()).containsEntry("thinking", "hmm");
  }

  @Test
  @DisplayName("Should emit tool start with name and raw partial JSON deltas")
  void processOutput_ToolUseBlock_EmitsToolEvents() throws Exception {
    List<AgentEvent> events = feed(
        MESSAGE_START_RECORD,
        stream("{\"type\":\"content_block_start\",\"index\":1,\"content_block\":{\"type\":\"tool_use\","
            + "\"id\":\"toolu_1\",\"name\":\"Bash\",\"input\":{}}}"),
        stream("{\"type\":\"content_block_delta\",\"index\":1,\"delta\":{\"type\":\"input_json_delta\","
            + "\"partial_json\":\"{\\\"command\\\": \\\"ls\"}}"),
        stream("{\"type\":\"content_block_stop\",\"index\":1}"));

    assertThat(types(events)).containsExactly(MESSAGE_START, TOOL_START, TOOL_INPUT_DELTA, BLOCK_END);
    assertThat(events.get(1).payload())
        .containsEntry("toolId", "toolu_1")
        .containsEntry("toolName", "Bash")
        .containsEntry("blockIndex", 1);
    assertThat(events.get(2).payload()).containsEntry("partialJson", "{\"command\": \"ls");
    assertThat(events.get(3).payload()).containsEntry("blockType", "tool_use");
  }

  @Test
  @DisplayName("Should synthesize message and block starts for a delta with no preceding start")
  void processOutput_DeltaWithoutStart_SynthesizesStarts() throws Exception {
    List<AgentEvent> events = feed(
        stream("{\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"late\"}}"));

    assertThat(types(events)).containsExactly(MESSAGE_START, TEXT_START, TEXT_DELTA);
  }

  @Test
  @DisplayName("Should map unknown block types to generic block events")
  void processOutput_UnknownBlockType_UsesGenericBlock() throws Exception {
    List<AgentEvent> events = feed(
        MESSAGE_START_RECORD,
        stream("{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"server_tool_use\",\"id\":\"s\"}}"),
        stream("{\"type\":\"content_block_stop\",\"index\":0}"));

    assertThat(types(events)).containsExactly(MESSAGE_START, BLOCK_START, BLOCK_END);
    assertThat(events.get(1).payload()).containsEntry("blockType", "server_tool_use");
  }

  @Test
  @DisplayName("Should expand a print-mode assistant record into a complete message")
  void processOutput_AssistantRecord_EmitsCompleteMessage() throws Exception {
    List<AgentEvent> events = feed(
        "{\"type\":\"assistant\",\"message\":{\"id\":\"msg_p\",\"model\":\"claude-sonnet\",\"stop_reason\":\"tool_use\","
            + "\"usage\":{\"input_tokens\":5,\"output_tokens\":9},\"content\":["
            + "{\"type\":\"text\",\"text\":\"Listing files\"},"
            + "{\"type\":\"tool_use\",\"id\":\"toolu_9\",\"name\":\"Bash\",\"input\":{\"command\":\"ls\"}}]}}");

    assertThat(types(events)).containsExactly(
        MESSAGE_START, TEXT_START, TEXT_DELTA, BLOCK_END, TOOL_START, TOOL_INPUT_DELTA, BLOCK_END, MESSAGE_END);
    assertThat(events.get(5).payload()).containsEntry("partialJson", "{\"command\":\"ls\"}");
    assertThat(events.get(7).payload()).containsEntry("stopReason", "tool_use");
    assertThat(events.get(7).payloadValue("usage", TokenUsage.class)).isEqualTo(TokenUsage.of(5, 9));
  }

  @Test
  @DisplayName("Should not replay an assistant record for a message that was already streamed")
  void processOutput_AssistantAfterStream_IsSkipped() throws Exception {
    feed(MESSAGE_START_RECORD, stream("{\"type\":\"message_stop\"}"));

    List<AgentEvent> events = feed(
        "{\"type\":\"assistant\",\"message\":{\"id\":\"msg_1\",\"content\":[{\"type\":\"text\",\"text\":\"dup\"}]}}");

    assertThat(events).isEmpty();
  }

  @Test
  @DisplayName("Should report an error result and close the open message")
  void processOutput_ErrorResult_EmitsErrorAndMessageEnd() throws Exception {
    List<AgentEvent> events = feed(
        MESSAGE_START_RECORD,
        "{\"type\":\"result\",\"subtype\":\"error_during_execution\",\"is_error\":true}");

    assertThat(types(events)).containsExactly(MESSAGE_START, ERROR, MESSAGE_END);
    assertThat(events.get(1).payload()).containsEntry("error", "error_during_execution");
    assertThat(events.get(2).payload()).containsEntry("stopReason", "error");
  }

  @Test
  @DisplayName("Should ignore a successful result record")
  void processOutput_SuccessResult_EmitsNothing() throws Exception {
    assertThat(feed("{\"type\":\"result\",\"subtype\":\"success\",\"is_error\":false,\"result\":\"ok\"}")).isEmpty();
  }

  @Test
  @DisplayName("Should emit an error for a streamed error event")
  void processOutput_StreamError_EmitsError() throws Exception {
    List<AgentEvent> events = feed(
        stream("{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}"));

    assertThat(types(events)).containsExactly(ERROR);
    assertThat(events.get(0).payload()).containsEntry("error", "Overloaded");
  }

  @Test
  @DisplayName("Should close open blocks and the message on abrupt exit")
  void onExit_MidMessage_EmitsTerminalExitThenProcessExit() throws Exception {
    feed(
        MESSAGE_START_RECORD,
        stream("{\"type\":\"content_block_start\",\"index\":0,\"content_block\":{\"type\":\"text\"}}"));

    List<AgentEvent> events = detector.onExit(SESSION, 1);

    assertThat(types(events)).containsExactly(BLOCK_END, MESSAGE_END, PROCESS_EXIT);
    assertThat(events.get(1).payload())
        .containsEntry("stopReason", "terminal_exit")
        .containsEntry("exitCode", 1);
    assertThat(events.get(1).payloadValue("usage", TokenUsage.class)).isEqualTo(TokenUsage.of(25, 1));
  }

  @Test
  @DisplayName("Should start from fresh state after cleanup")
  void cleanup_ThenOutput_StartsFresh() throws Exception {
    feed(MESSAGE_START_RECORD);

    detector.cleanup(SESSION);

    assertThat(detector.phase(SESSION)).isEqualTo(StreamPhase.IDLE);
    assertThat(types(detector.onExit(SESSION, 0))).containsExactly(PROCESS_EXIT);
  }

  private List<AgentEvent> feed(String... records) throws Exception {
    List<AgentEvent> events = new ArrayList<>();
    for (String record : records) {
      events.addAll(detector.processOutput(SESSION, record + "\r\n"));
    }
    return events;
  }

  private static String stream(String event) {
    return "{\"type\":\"stream_event\",\"event\":" + event + "}";
  }

  private static List<AgentEventType> types(List<AgentEvent> events) {
    return events.stream().map(AgentEvent::type).collect(Collectors.toList());
  }
}
