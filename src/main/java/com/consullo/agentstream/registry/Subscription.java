package com.consullo.agentstream.registry;

/**
 * Handle for cancelling a subscription made with {@link DetectorRegistry#subscribe}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface Subscription {

  /**
   * Stops delivery to the subscriber. Idempotent.
   */
  void unsubscribe();
}
