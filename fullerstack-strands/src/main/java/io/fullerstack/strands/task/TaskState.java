package io.fullerstack.strands.task;

/**
 * Lifecycle state of a {@link Task}.
 */
public enum TaskState {

  /** Constructed, never resumed. */
  CREATED,

  /** Resumed at least once and parked at a suspension point. */
  SUSPENDED,

  /** The continuation ran to its end. */
  COMPLETED,

  /** The continuation threw; the cause is available from {@link Task#failure()}. */
  FAILED;

  public boolean isTerminal () {
    return this == COMPLETED || this == FAILED;
  }
}
