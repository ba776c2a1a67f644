package com.consullo.agentstream.detect.server;

import com.consullo.agentstream.core.AgentEvent;
import com.consullo.agentstream.core.AgentEventType;
import com.consullo.agentstream.core.OutputDetector;
import com.consullo.agentstream.core.state.SessionStateTable;
import com.consullo.agentstream.core.text.AnsiText;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recognizes "server is listening" announcements and server start failures in terminal output.
 *
 * <p>Complete lines are scanned as they arrive. The unterminated last line is kept and rescanned
 * with the next chunk; a match that runs up to the end of that partial line is deferred, so a port
 * number split across two writes is not reported truncated.
 *
 * @since 1.0
 */
public final class ServerDetector implements OutputDetector {

  public static final String ID = "server-detector";

  private static final Logger LOGGER = LoggerFactory.getLogger(ServerDetector.class);

  private static final Pattern[] SERVER_PATTERNS = {
    // labelled URL or host:port
    Pattern.compile(
        "(?:Local|Network|running at|running on|available at|listening on|server started at|started on)[\\s:]+"
            + "((?:https?://)?[a-zA-Z0-9\\-._~:/?#\\[\\]@!$&'()*+,;=]+:\\d+)",
        Pattern.CASE_INSENSITIVE),
    // bare port
    Pattern.compile(
        "(?:running on|listening on|started on|server.* on|port)[:\\s]+(?:localhost:)?(\\d{2,5})",
        Pattern.CASE_INSENSITIVE),
    // loopback and wildcard URLs printed by frameworks
    Pattern.compile(
        "(https?://(?:localhost|127\\.0\\.0\\.1|0\\.0\\.0\\.0|[:a-fA-F0-9]+):\\d+)",
        Pattern.CASE_INSENSITIVE),
    // Next.js / Vite banners
    Pattern.compile("(?:Local:|Network:)\\s+(https?://[^\\s)]+)", Pattern.CASE_INSENSITIVE),
  };

  private static final Pattern[] ERROR_PATTERNS = {
    Pattern.compile("EADDRINUSE", Pattern.CASE_INSENSITIVE),
    Pattern.compile("address already in use", Pattern.CASE_INSENSITIVE),
    Pattern.compile("port.*already in use", Pattern.CASE_INSENSITIVE),
    Pattern.compile("error.*starting server", Pattern.CASE_INSENSITIVE),
    Pattern.compile("failed to start", Pattern.CASE_INSENSITIVE),
    Pattern.compile("cannot start server", Pattern.CASE_INSENSITIVE),
  };

  private static final Pattern URL_PREFIX = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
  private static final Pattern PORT_ONLY = Pattern.compile("^\\d{2,5}$");

  private final ServerDetectorConfig config;
  private final SessionStateTable<ServerSessionState> states;

  public ServerDetector() {
    this(ServerDetectorConfig.defaults());
  }

  public ServerDetector(final ServerDetectorConfig config) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
    this.states = new SessionStateTable<>(id -> new ServerSessionState(config.bufferSize()));
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public List<AgentEvent> processOutput(final String sessionId, final String data) {
    List<AgentEvent> events = new ArrayList<>();
    ServerSessionState state = states.getOrCreate(sessionId);
    synchronized (state) {
      String text = state.partialLine + AnsiText.strip(data);
      int lineEnd = text.lastIndexOf('\n') + 1;
      String lines = text.substring(0, lineEnd);
      String partial = text.substring(lineEnd);
      state.partialLine.replace(partial);

      Map<String, DetectedServer> found = new LinkedHashMap<>();
      detectServers(lines, false, found);
      detectServers(partial, true, found);
      for (DetectedServer server : found.values()) {
        if (state.servers.putIfAbsent(server.url(), server) == null) {
          events.add(AgentEvent.of(sessionId, AgentEventType.SERVER_DETECTED, server.detectedAt(), AgentEvent.payloadBuilder()
              .put("url", server.url())
              .put("port", server.port())
              .put("protocol", server.protocol())
              .put("host", server.host())
              .put("detectedAt", server.detectedAt())
              .build()));
          LOGGER.info("Detected server {} in session {}", server.url(), sessionId);
        }
      }

      if (!state.errorReported && hasError(text)) {
        state.errorReported = true;
        events.add(AgentEvent.of(sessionId, AgentEventType.SERVER_ERROR, AgentEvent.payloadBuilder()
            .put("message", "Server error detected")
            .build()));
        LOGGER.warn("Server error detected in session {}", sessionId);
      }
    }
    return events;
  }

  @Override
  public List<AgentEvent> onExit(final String sessionId, final int exitCode) {
    ServerSessionState state = states.remove(sessionId).orElse(null);
    if (state == null) {
      return List.of();
    }
    synchronized (state) {
      if (state.servers.isEmpty()) {
        return List.of();
      }
      List<DetectedServer> servers = List.copyOf(state.servers.values());
      LOGGER.info("Session {} exited with code {} while serving {} endpoint(s)", sessionId, exitCode, servers.size());
      return List.of(AgentEvent.of(sessionId, AgentEventType.SERVER_CRASHED, AgentEvent.payloadBuilder()
          .put("exitCode", exitCode)
          .put("servers", servers)
          .build()));
    }
  }

  @Override
  public void cleanup(final String sessionId) {
    if (states.remove(sessionId).isPresent()) {
      LOGGER.debug("Cleaned up server state for session {}", sessionId);
    }
  }

  /**
   * Returns the servers detected so far for a session, in discovery order.
   *
   * @param sessionId session id
   * @return detected servers (empty for unknown sessions)
   */
  public List<DetectedServer> servers(final String sessionId) {
    return states.find(sessionId).map(state -> {
      synchronized (state) {
        return List.copyOf(state.servers.values());
      }
    }).orElse(List.of());
  }

  private void detectServers(String text, boolean partial, Map<String, DetectedServer> found) {
    if (text.isEmpty()) {
      return;
    }
    for (Pattern pattern : SERVER_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        if (partial && matcher.end(1) == text.length()) {
          continue;
        }
        DetectedServer server = toServer(matcher.group(1));
        if (server != null) {
          found.putIfAbsent(server.url(), server);
        }
      }
    }
  }

  private DetectedServer toServer(String captured) {
    String candidate = captured.trim();
    String url;
    if (URL_PREFIX.matcher(candidate).find()) {
      url = candidate;
    } else if (PORT_ONLY.matcher(candidate).matches()) {
      url = "http://localhost:" + candidate;
    } else {
      url = "http://" + candidate;
    }

    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      LOGGER.debug("Ignoring unparseable server address {}: {}", url, e.getMessage());
      return null;
    }
    String host = uri.getHost();
    int port = uri.getPort();
    if (StringUtils.isEmpty(host) || !config.acceptsPort(port)) {
      return null;
    }
    String protocol = uri.getScheme().toLowerCase(Locale.ROOT);
    return new DetectedServer(protocol + "://" + host + ":" + port, port, protocol, host, Instant.now());
  }

  private static boolean hasError(String text) {
    for (Pattern pattern : ERROR_PATTERNS) {
      if (pattern.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }
}
