package com.consullo.agentstream.detect.server;

import java.time.Instant;

/**
 * A listening endpoint announced in terminal output.
 *
 * @param url normalized {@code scheme://host:port}
 * @param port port number
 * @param protocol {@code http} or {@code https}
 * @param host host name or address
 * @param detectedAt when the announcement was seen
 * @since 1.0
 */
public record DetectedServer(String url, int port, String protocol, String host, Instant detectedAt) {
}
