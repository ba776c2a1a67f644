package com.consullo.agentstream.detect.server;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import java.util.List;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for server announcement detection.
 *
 * @since 1.0
 */
public class ServerDetectorTest {

  private static final String SESSION = "dev-1";

  private ServerDetector detector;

  @BeforeEach
  void setUp() {
    detector = new ServerDetector();
  }

  @Test
  @DisplayName("Should detect a Vite banner once with a normalized URL")
  void processOutput_ViteBanner_DetectsServer() {
    List<AgentEvent> events = detector.processOutput(SESSION,
        "\n  VITE v5.0.0  ready in 312 ms\n\n"
            + "  \u001B[32m➜\u001B[39m  \u001B[1mLocal\u001B[22m:   \u001B[36mhttp://localhost:\u001B[1m5173\u001B[22m/\u001B[39m\n"
            + "  ➜  Network: use --host to expose\n");

    assertThat(events).hasSize(1);
    AgentEvent event = events.get(0);
    assertThat(event.type()).isEqualTo(AgentEventType.SERVER_DETECTED);
    assertThat(event.payload())
        .containsEntry("url", "http://localhost:5173")
        .containsEntry("port", 5173)
        .containsEntry("protocol", "http")
        .containsEntry("host", "localhost");
  }

  @Test
  @DisplayName("Should not report the same endpoint twice in a session")
  void processOutput_RepeatedAnnouncement_Deduplicated() {
    detector.processOutput(SESSION, "Server running at http://localhost:3000\n");

    List<AgentEvent> again = detector.processOutput(SESSION, "Local: http://localhost:3000/\n");

    assertThat(again).isEmpty();
    assertThat(detector.servers(SESSION)).extracting(DetectedServer::url).containsExactly("http://localhost:3000");
  }

  @Test
  @DisplayName("Should build a localhost URL from a bare port announcement")
  void processOutput_BarePort_DetectsLocalhost() {
    List<AgentEvent> events = detector.processOutput(SESSION, "Server listening on port 8081\n");

    assertThat(events).extracting(e -> e.payload().get("url")).containsExactly("http://localhost:8081");
  }

  @Test
  @DisplayName("Should reject privileged ports")
  void processOutput_PrivilegedPort_Ignored() {
    assertThat(detector.processOutput(SESSION, "nginx running on port 80\n")).isEmpty();
  }

  @Test
  @DisplayName("Should wait for the rest of a line before reporting a port at its end")
  void processOutput_PortSplitAcrossChunks_ReportsFullPort() {
    List<AgentEvent> first = detector.processOutput(SESSION, "Listening on http://127.0.0.1:3000");
    List<AgentEvent> second = detector.processOutput(SESSION, "1\n");

    assertThat(first).isEmpty();
    assertThat(second).extracting(e -> e.payload().get("url")).containsExactly("http://127.0.0.1:30001");
  }

  @Test
  @DisplayName("Should report a start failure once per session")
  void processOutput_AddressInUse_EmitsSingleError() {
    List<AgentEvent> first = detector.processOutput(SESSION, "Error: listen EADDRINUSE: address already in use :::3000\n");
    List<AgentEvent> second = detector.processOutput(SESSION, "Error: listen EADDRINUSE again\n");

    assertThat(first).extracting(AgentEvent::type).containsExactly(AgentEventType.SERVER_ERROR);
    assertThat(second).isEmpty();
  }

  @Test
  @DisplayName("Should report known servers as crashed when the process exits")
  void onExit_WithServers_EmitsCrashed() {
    detector.processOutput(SESSION, "Local: http://localhost:4200/\n");

    List<AgentEvent> events = detector.onExit(SESSION, 1);

    assertThat(events).hasSize(1);
    assertThat(events.get(0).type()).isEqualTo(AgentEventType.SERVER_CRASHED);
    assertThat(events.get(0).payload()).containsEntry("exitCode", 1);
    assertThat(events.get(0).payload().get("servers"))
        .asInstanceOf(InstanceOfAssertFactories.list(DetectedServer.class))
        .extracting(DetectedServer::port)
        .containsExactly(4200);
    assertThat(detector.servers(SESSION)).isEmpty();
  }

  @Test
  @DisplayName("Should emit nothing on exit when no server was seen")
  void onExit_NoServers_EmitsNothing() {
    detector.processOutput(SESSION, "compiling...\n");

    assertThat(detector.onExit(SESSION, 0)).isEmpty();
  }

  @Test
  @DisplayName("Should keep sessions apart and forget a session on cleanup")
  void cleanup_ForgetsOnlyThatSession() {
    detector.processOutput(SESSION, "Local: http://localhost:4200/\n");
    detector.processOutput("dev-2", "Local: http://localhost:4200/\n");

    detector.cleanup(SESSION);

    assertThat(detector.servers(SESSION)).isEmpty();
    assertThat(detector.servers("dev-2")).hasSize(1);
    assertThat(detector.processOutput(SESSION, "Local: http://localhost:4200/\n")).hasSize(1);
  }
}
