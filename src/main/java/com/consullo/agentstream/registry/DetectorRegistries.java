package com.consullo.agentstream.registry;

import com.consullo.agentstream.detect.claude.ClaudeStreamDetector;
import com.consullo.agentstream.detect.codex.CodexStreamDetector;
import com.consullo.agentstream.detect.naming.AutoNamingDetector;
import com.consullo.agentstream.detect.naming.NameSuggester;
import com.consullo.agentstream.detect.review.ReviewDetector;
import com.consullo.agentstream.detect.server.ServerDetector;
import org.apache.commons.lang3.Validate;

/**
 * Factory for registries with the standard detector set.
 *
 * @since 1.0
 */
public final class DetectorRegistries {

  private DetectorRegistries() {
  }

  /**
   * Creates a registry with the server, review, naming, Claude and Codex detectors, in that order,
   * using default configurations. Close the registry to stop the naming timer thread.
   *
   * @param nameSuggester summarizer used for terminal names
   * @return new registry
   */
  public static DetectorRegistry createDefault(final NameSuggester nameSuggester) {
    Validate.notNull(nameSuggester, "nameSuggester must not be null");
    DetectorRegistry registry = new DetectorRegistry();
    registry.register(new ServerDetector());
    registry.register(new ReviewDetector());
    registry.register(new AutoNamingDetector(nameSuggester));
    registry.register(new ClaudeStreamDetector());
    registry.register(new CodexStreamDetector());
    return registry;
  }
}
