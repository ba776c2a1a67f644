package com.consullo.agentstream.detect.naming;

import java.util.concurrent.CompletableFuture;

/**
 * Summarizes terminal output into a short human-readable name.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface NameSuggester {

  /**
   * Asks for a short name describing the given output.
   *
   * @param text recent ANSI-stripped terminal output
   * @return future completing with the name, or with null when no name could be produced
   */
  CompletableFuture<String> generateShortName(final String text);
}
