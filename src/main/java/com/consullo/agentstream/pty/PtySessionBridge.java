package com.consullo.agentstream.pty;

import com.consullo.agentstream.registry.DetectorRegistry;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link DetectorRegistry} from one PTY-attached process.
 *
 * <p>A daemon thread decodes the PTY output as UTF-8 (multi-byte characters split across reads
 * are reassembled by the decoder) and hands each chunk to
 * {@link DetectorRegistry#processOutput(String, String)}. Once the output is drained it waits for
 * the exit code and reports it through {@link DetectorRegistry#onExit(String, int)}, then
 * completes {@link #completion()}.
 *
 * @since 1.0
 */
public final class PtySessionBridge implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtySessionBridge.class);

  /** Exit code reported when the process exit status could not be obtained. */
  public static final int UNKNOWN_EXIT_CODE = -1;

  private static final int READ_BUFFER_CHARS = 8192;

  private final String sessionId;
  private final PtyProcessController pty;
  private final DetectorRegistry registry;
  private final CompletableFuture<Integer> completion = new CompletableFuture<>();

  private PtySessionBridge(String sessionId, PtyProcessController pty, DetectorRegistry registry) {
    this.sessionId = sessionId;
    this.pty = pty;
    this.registry = registry;
  }

  /**
   * Spawns a process with pty4j and starts pumping its output.
   *
   * @param sessionId session id used for all events
   * @param config process configuration
   * @param registry registry receiving output and exit
   * @return running bridge
   * @throws Exception if the process cannot be started
   */
  public static PtySessionBridge spawn(
      final String sessionId,
      final PtyProcessConfig config,
      final DetectorRegistry registry) throws Exception {
    return start(sessionId, new PtyProcessControllerPty4j(config), registry);
  }

  /**
   * Starts pumping output of an already running process.
   *
   * @param sessionId session id used for all events
   * @param pty process controller
   * @param registry registry receiving output and exit
   * @return running bridge
   * @throws Exception if the PTY output stream is unavailable
   */
  public static PtySessionBridge start(
      final String sessionId,
      final PtyProcessController pty,
      final DetectorRegistry registry) throws Exception {
    Validate.notBlank(sessionId, "sessionId must not be blank");
    Validate.notNull(pty, "pty must not be null");
    Validate.notNull(registry, "registry must not be null");

    PtySessionBridge bridge = new PtySessionBridge(sessionId, pty, registry);
    Reader reader = new InputStreamReader(pty.getPtyOutput(), StandardCharsets.UTF_8);
    Thread pump = new Thread(() -> bridge.pump(reader), "pty-read-" + sessionId);
    pump.setDaemon(true);
    pump.start();
    return bridge;
  }

  public String sessionId() {
    return sessionId;
  }

  /**
   * Returns a future completing with the exit code after all output and the exit have been
   * delivered to the registry.
   *
   * @return completion future
   */
  public CompletableFuture<Integer> completion() {
    return completion;
  }

  /**
   * Writes text to the process's terminal input.
   *
   * @param text text to write
   */
  public void sendText(final String text) {
    Validate.notNull(text, "text must not be null");
    try {
      OutputStream in = pty.getPtyInput();
      in.write(text.getBytes(StandardCharsets.UTF_8));
      in.flush();
    } catch (Exception e) {
      throw new IllegalStateException("Failed writing to PTY of session " + sessionId, e);
    }
  }

  public void sendLine(final String line) {
    sendText(line + "\n");
  }

  /**
   * Terminates the process. Output already read and the exit are still delivered.
   *
   * @throws Exception if the process cannot be terminated
   */
  @Override
  public void close() throws Exception {
    pty.close();
  }

  private void pump(Reader reader) {
    char[] buffer = new char[READ_BUFFER_CHARS];
    try (reader) {
      int n;
      while ((n = reader.read(buffer)) >= 0) {
        if (n > 0) {
          registry.processOutput(sessionId, new String(buffer, 0, n));
        }
      }
    } catch (IOException e) {
      // Linux PTYs report EIO instead of EOF once the child has exited.
      LOGGER.debug("PTY output of session {} closed: {}", sessionId, e.getMessage());
    }

    int exitCode = awaitExitCode();
    LOGGER.info("Session {} process exited with code {}", sessionId, exitCode);
    registry.onExit(sessionId, exitCode);
    completion.complete(exitCode);
  }

  private int awaitExitCode() {
    try {
      Integer code = pty.onExit().get();
      return code != null ? code : UNKNOWN_EXIT_CODE;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted waiting for exit of session {}", sessionId);
      return UNKNOWN_EXIT_CODE;
    } catch (ExecutionException e) {
      LOGGER.warn("Exit status of session {} unavailable", sessionId, e.getCause());
      return UNKNOWN_EXIT_CODE;
    } catch (Exception e) {
      LOGGER.warn("Exit monitoring of session {} failed", sessionId, e);
      return UNKNOWN_EXIT_CODE;
    }
  }
}
