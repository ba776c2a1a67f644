package com.consullo.agentstream.detect.codex;

import com.consullo.agentstream.core.BlockKind;

/**
 * Codex item types and the canonical block kind each renders as.
 *
 * @since 1.0
 */
enum CodexItemKind {

  AGENT_MESSAGE("agent_message", BlockKind.TEXT),
  PLAN_UPDATE("plan_update", BlockKind.TEXT),
  REASONING("reasoning", BlockKind.THINKING),
  COMMAND_EXECUTION("command_execution", BlockKind.TOOL_USE),
  FILE_CHANGE("file_change", BlockKind.TOOL_USE),
  MCP_TOOL_CALL("mcp_tool_call", BlockKind.TOOL_USE),
  WEB_SEARCH("web_search", BlockKind.TOOL_USE),
  UNKNOWN("unknown", BlockKind.TOOL_USE);

  private final String wireName;
  private final BlockKind blockKind;

  CodexItemKind(String wireName, BlockKind blockKind) {
    this.wireName = wireName;
    this.blockKind = blockKind;
  }

  String wireName() {
    return wireName;
  }

  BlockKind blockKind() {
    return blockKind;
  }

  static CodexItemKind fromWireName(String type) {
    for (CodexItemKind kind : values()) {
      if (kind.wireName.equals(type)) {
        return kind;
      }
    }
    return UNKNOWN;
  }
}
