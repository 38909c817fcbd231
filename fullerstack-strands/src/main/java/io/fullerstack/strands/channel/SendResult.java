package io.fullerstack.strands.channel;

/**
 * Outcome of a non-blocking {@link Channel#trySend}.
 */
public enum SendResult {

  /** The item was enqueued. */
  SENT,

  /** The channel is at capacity; nothing was enqueued. */
  FULL,

  /** The channel is closed; nothing was enqueued, and nothing ever will be. */
  CLOSED
}
