package com.consullo.agentstream.detect.codex;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import com.consullo.agentstream.core.json.JsonRecords;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Translates Codex JSON-RPC approval requests into {@link AgentEventType#APPROVAL_REQUEST}
 * events.
 *
 * <p>Approval requests share the transport with the typed protocol events but carry a
 * {@code method} and a numeric {@code id} instead of a {@code type}, for example:
 * <pre>
 * {"method":"item/commandExecution/requestApproval","id":7,"params":{"command":"rm -rf build"}}
 * </pre>
 *
 * @since 1.0
 */
final class CodexApprovalTranslator {

  private static final int SUMMARY_COMMAND_MAX = 120;

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private CodexApprovalTranslator() {
  }

  static boolean isApprovalRequest(JsonNode record) {
    JsonNode method = record.get("method");
    JsonNode id = record.get("id");
    return method != null && method.isTextual() && !method.asText().isEmpty() && id != null && id.isNumber();
  }

  static AgentEvent translate(String sessionId, JsonNode request) {
    String method = request.get("method").asText();
    JsonNode paramsNode = request.path("params");
    Map<String, Object> params = paramsNode.isObject()
        ? JsonRecords.mapper().convertValue(paramsNode, MAP_TYPE)
        : new LinkedHashMap<>();

    String toolName = toolNameFor(method);
    String command = commandText(paramsNode);
    String reason = JsonRecords.nonEmptyText(paramsNode, "reason");
    String risk = JsonRecords.nonEmptyText(paramsNode, "risk");

    Map<String, Object> toolInput = new LinkedHashMap<>();
    if (command != null) {
      toolInput.put("command", command);
    }
    if (reason != null) {
      toolInput.put("reason", reason);
    }
    if (risk != null) {
      toolInput.put("risk", risk);
    }
    toolInput.putAll(params);

    return AgentEvent.of(sessionId, AgentEventType.APPROVAL_REQUEST, AgentEvent.payloadBuilder()
        .put("jsonRpcId", request.get("id").asLong())
        .put("method", method)
        .put("toolName", toolName)
        .put("summary", summarize(toolName, method, command, reason, risk))
        .put("toolInput", toolInput)
        .put("params", params)
        .build());
  }

  static String toolNameFor(String method) {
    if (method.contains("commandExecution")) {
      return "command_execution";
    }
    if (method.contains("fileChange")) {
      return "file_change";
    }
    String last = StringUtils.substringAfterLast(method, "/");
    if (last.isEmpty()) {
      last = method;
    }
    return last.isEmpty() ? "unknown" : last;
  }

  // parsedCmd wins over the raw command; command may be a string or an argv array
  private static String commandText(JsonNode params) {
    String parsed = JsonRecords.nonEmptyText(params, "parsedCmd");
    if (parsed != null) {
      return parsed;
    }
    JsonNode command = params.get("command");
    if (command == null) {
      return null;
    }
    if (command.isTextual()) {
      return StringUtils.trimToNull(command.asText());
    }
    if (command.isArray()) {
      List<String> argv = new ArrayList<>();
      command.forEach(arg -> argv.add(arg.asText()));
      return StringUtils.trimToNull(String.join(" ", argv));
    }
    return null;
  }

  private static String summarize(String toolName, String method, String command, String reason, String risk) {
    String summary;
    if (command != null) {
      summary = "Run command: " + StringUtils.abbreviate(command, SUMMARY_COMMAND_MAX);
    } else if ("file_change".equals(toolName)) {
      summary = reason != null ? "Apply file changes: " + reason : "Apply file changes";
    } else if (reason != null) {
      summary = reason;
    } else {
      summary = "Approve " + method;
    }
    return risk != null ? summary + " (risk: " + risk + ")" : summary;
  }
}
