package com.consullo.agentstream.pty;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Configuration for spawning an agent CLI attached to a PTY.
 *
 * @param command command and arguments (e.g., ["codex", "exec", "--json", "..."])
 * @param workingDirectory working directory for the spawned process
 * @param environment variables added to or overriding the inherited environment (may be null)
 * @param initialColumns initial PTY columns
 * @param initialRows initial PTY rows
 * @since 1.0
 */
public record PtyProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int initialColumns,
    int initialRows) {

  public PtyProcessConfig {
    Validate.notEmpty(command, "command must not be empty");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.isTrue(initialColumns > 0, "initialColumns must be positive");
    Validate.isTrue(initialRows > 0, "initialRows must be positive");
    command = List.copyOf(command);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  /**
   * Creates a configuration with the inherited environment and a 120x40 terminal.
   *
   * @param workingDirectory working directory
   * @param command command and arguments
   * @return configuration
   */
  public static PtyProcessConfig of(final Path workingDirectory, final String... command) {
    return new PtyProcessConfig(List.of(command), workingDirectory, null, 120, 40);
  }
}
