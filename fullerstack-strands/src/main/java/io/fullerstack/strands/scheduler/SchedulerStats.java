package io.fullerstack.strands.scheduler;

/**
 * Point-in-time snapshot of a {@link Scheduler}'s counters.
 * <p>
 * Each counter is read atomically, but they are read one after another, so the
 * snapshot as a whole is not consistent while tasks are running.
 *
 * @param active      tasks spawned and not yet terminated or dropped
 * @param created     tasks spawned
 * @param completed   tasks that terminated, successfully or not
 * @param failed      the subset of {@code completed} that failed
 * @param dropped     tasks released unfinished at shutdown
 * @param workerCount worker threads owned by the scheduler
 */
public record SchedulerStats(
  long active,
  long created,
  long completed,
  long failed,
  long dropped,
  int workerCount
) {

  /**
   * @return completed tasks that did not fail
   */
  public long succeeded () {
    return completed - failed;
  }
}
