package com.consullo.agentstream.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PTY controller implemented with pty4j.
 *
 * <p>The child inherits this JVM's environment, overlaid with {@link PtyProcessConfig#environment()},
 * and gets {@code TERM=xterm-256color} unless the configuration sets {@code TERM}.
 *
 * @since 1.0
 */
public final class PtyProcessControllerPty4j implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyProcessControllerPty4j.class);

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();

  /**
   * Spawns a PTY-attached process.
   *
   * @param config process configuration
   * @throws Exception if the process cannot be started
   */
  public PtyProcessControllerPty4j(final PtyProcessConfig config) throws Exception {
    Validate.notNull(config, "config must not be null");

    final Map<String, String> env = new HashMap<>(System.getenv());
    env.putIfAbsent("TERM", "xterm-256color");
    env.putAll(config.environment());

    this.process = new PtyProcessBuilder(config.command().toArray(new String[0]))
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(env)
        .setInitialColumns(config.initialColumns())
        .setInitialRows(config.initialRows())
        .setRedirectErrorStream(true)
        .start();
    LOGGER.info("Started {} (pid {}) in {}", config.command().get(0), process.pid(), config.workingDirectory());

    startExitMonitorThread();
  }

  @Override
  public InputStream getPtyOutput() {
    return this.process.getInputStream();
  }

  @Override
  public OutputStream getPtyInput() {
    return this.process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    this.process.setWinSize(new WinSize(columns, rows));
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return this.exitFuture;
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  @Override
  public void close() {
    if (this.process.isAlive()) {
      LOGGER.debug("Destroying pid {}", this.process.pid());
      this.process.destroy();
    }
  }

  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        this.exitFuture.complete(this.process.waitFor());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        this.exitFuture.completeExceptionally(e);
      }
    }, "pty-exit-" + this.process.pid());
    monitor.setDaemon(true);
    monitor.start();
  }
}
