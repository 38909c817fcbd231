/**
 * Suspendable units of work: {@link io.fullerstack.strands.task.Task},
 * its {@link io.fullerstack.strands.task.Continuation} body and the
 * {@link io.fullerstack.strands.task.Step} it returns at each suspension point.
 */
package io.fullerstack.strands.task;
