package io.fullerstack.strands.task;

/**
 * The body of a {@link Task}, run one slice at a time.
 * <p>
 * Each call to {@link #resume()} runs up to the next suspension point and returns the
 * {@link Step} to take next. Implementations keep whatever state they need between
 * slices in their own fields. Returning {@code null} is treated as {@link Step#complete()}.
 * <p>
 * {@link #close()} is called exactly once when the task is released: after it completes,
 * after it fails, or when a scheduler shuts down while the task is still queued or
 * sleeping. It must therefore be safe to call from any suspension point.
 */
@FunctionalInterface
public interface Continuation extends AutoCloseable {

  Step resume () throws Exception;

  @Override
  default void close () {
  }
}
