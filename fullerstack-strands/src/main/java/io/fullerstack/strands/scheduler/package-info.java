/**
 * Worker-pool scheduler for {@link io.fullerstack.strands.task.Task}s.
 * <p>
 * <b>Key Classes:</b>
 * <ul>
 *   <li>{@link io.fullerstack.strands.scheduler.Scheduler} - fixed workers, ready queue, timer queue</li>
 *   <li>{@link io.fullerstack.strands.scheduler.QueuePolicy} - FIFO (round robin) or LIFO take order</li>
 *   <li>{@link io.fullerstack.strands.scheduler.Schedulers} - lazily built process-wide instance</li>
 * </ul>
 * <p>
 * <b>Usage Example:</b>
 * <pre>{@code
 * Channel<Integer> results = new Channel<>(10);
 * try (Scheduler scheduler = Scheduler.builder().name("ingest").workers(4).build()) {
 *   for (int i = 0; i < 100; i++) {
 *     int index = i;
 *     scheduler.spawn("sender-" + i, () ->
 *       results.trySend(index) == SendResult.FULL ? Step.yield() : Step.complete());
 *   }
 *   // drain results on this thread, then
 *   scheduler.awaitAll();
 * }
 * }</pre>
 */
package io.fullerstack.strands.scheduler;
