package com.consullo.agentstream.core.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for terminal control sequence stripping.
 *
 * @since 1.0
 */
public class AnsiTextTest {

  @Test
  @DisplayName("Should strip color, cursor, private mode and title sequences but keep line breaks")
  void strip_ControlSequences_Removed() {
    String raw = "\u001B[?25l\u001B[32m  Local:\u001B[0m   http://localhost:\u001B[1m5173\u001B[22m/\r\n"
        + "\u001B]0;vite\u0007done\u001B(B";

    assertThat(AnsiText.strip(raw)).isEqualTo("  Local:   http://localhost:5173/\r\ndone");
  }

  @Test
  @DisplayName("Should return empty text for null input")
  void strip_Null_ReturnsEmpty() {
    assertThat(AnsiText.strip(null)).isEmpty();
  }
}
