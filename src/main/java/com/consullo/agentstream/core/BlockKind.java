package com.consullo.agentstream.core;

/**
 * Canonical content-block kinds a vendor item is mapped onto.
 *
 * @since 1.0
 */
public enum BlockKind {

  TEXT("text"),
  THINKING("thinking"),
  TOOL_USE("tool_use"),
  OTHER("other");

  private final String wireName;

  BlockKind(final String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return this.wireName;
  }

  /**
   * Maps a vendor block type string onto a kind.
   *
   * @param type vendor block type (may be null)
   * @return kind, {@link #OTHER} when unrecognized
   */
  public static BlockKind fromWireName(final String type) {
    if (type == null) {
      return OTHER;
    }
    for (BlockKind kind : values()) {
      if (kind.wireName.equals(type)) {
        return kind;
      }
    }
    return OTHER;
  }
}
