package com.consullo.agentstream.pty;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal controller for a PTY-attached agent process.
 *
 * @since 1.0
 */
public interface PtyProcessController extends AutoCloseable {

  /**
   * Returns the stream of bytes the process writes to the terminal.
   *
   * @return PTY output
   * @throws Exception if the stream is unavailable
   */
  InputStream getPtyOutput() throws Exception;

  OutputStream getPtyInput() throws Exception;

  void resize(final int columns, final int rows) throws Exception;

  /**
   * Returns a future completing with the exit code once the process has terminated.
   *
   * @return exit future
   * @throws Exception if exit monitoring is unavailable
   */
  CompletableFuture<Integer> onExit() throws Exception;

  boolean isAlive() throws Exception;

  @Override
  void close() throws Exception;
}
