package io.fullerstack.strands.scheduler;

/**
 * Order in which a {@link Scheduler}'s workers take ready tasks.
 * <p>
 * The policy is part of the scheduler's contract: callers may rely on it.
 */
public enum QueuePolicy {

  /**
   * Take the oldest ready task; a task that yields goes to the back of the queue.
   * Every ready task is resumed before any task is resumed twice (round robin).
   */
  FIFO,

  /**
   * Take the newest ready task; a task that yields goes back on top.
   * Favors finishing the task in hand. A task that keeps yielding can starve
   * older tasks for as long as it keeps yielding.
   */
  LIFO
}
