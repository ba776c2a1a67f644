package com.consullo.agentstream.detect;

import com.consullo.agentstream.core.BlockKind;

/**
 * A content block that has been started but not yet ended.
 *
 * <p>Vendors that report cumulative snapshots (the whole text so far) are turned into
 * incremental deltas by remembering what has already been streamed.
 *
 * @since 1.0
 */
public final class OpenBlock {

  private final int index;
  private final BlockKind kind;
  private final String toolName;
  private String streamed = "";

  public OpenBlock(final int index, final BlockKind kind, final String toolName) {
    this.index = index;
    this.kind = kind;
    this.toolName = toolName;
  }

  public int index() {
    return index;
  }

  public BlockKind kind() {
    return kind;
  }

  public String toolName() {
    return toolName;
  }

  /**
   * Returns the part of a cumulative snapshot not yet streamed and marks it streamed.
   *
   * <p>If the snapshot does not extend what was streamed (the vendor rewrote the text), the whole
   * snapshot is returned.
   *
   * @param snapshot full text so far
   * @return new text, empty if nothing new
   */
  public String advanceTo(final String snapshot) {
    if (snapshot == null || snapshot.isEmpty()) {
      return "";
    }
    String delta = snapshot.startsWith(streamed) ? snapshot.substring(streamed.length()) : snapshot;
    streamed = snapshot;
    return delta;
  }

  public String streamed() {
    return streamed;
  }
}
