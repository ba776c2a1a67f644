package com.consullo.agentstream.detect.server;

import org.apache.commons.lang3.Validate;

/**
 * Configuration for {@link ServerDetector}.
 *
 * @param bufferSize maximum characters kept for an unterminated output line
 * @param minPort lowest port accepted as a server announcement
 * @param maxPort highest port accepted
 * @since 1.0
 */
public record ServerDetectorConfig(int bufferSize, int minPort, int maxPort) {

  public ServerDetectorConfig {
    Validate.isTrue(bufferSize > 0, "bufferSize must be positive");
    Validate.isTrue(minPort > 0 && minPort <= maxPort && maxPort <= 65535, "invalid port range %d-%d", minPort, maxPort);
  }

  public static ServerDetectorConfig defaults() {
    return new ServerDetectorConfig(5000, 1024, 65535);
  }

  boolean acceptsPort(int port) {
    return port >= minPort && port <= maxPort;
  }
}
