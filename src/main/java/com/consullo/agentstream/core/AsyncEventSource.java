package com.consullo.agentstream.core;

import java.util.function.Consumer;

/**
 * Implemented by detectors that emit events after the originating call has returned.
 *
 * <p>The registry wires its dispatch path into the source when the detector is registered.
 *
 * @since 1.0
 */
public interface AsyncEventSource {

  /**
   * Sets the channel used for asynchronously produced events. Replaces any previous channel;
   * {@code null} detaches it.
   *
   * @param sink event consumer
   */
  void onAsyncEvent(final Consumer<AgentEvent> sink);
}
