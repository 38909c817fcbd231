package io.fullerstack.strands.task;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link Continuation} asks for when it returns from {@link Continuation#resume()}.
 * <p>
 * A step is the suspension point of a task: {@link #yield()} hands the worker back and
 * asks to be queued again, {@link #sleep(Duration)} parks the task off the workers until
 * the delay has elapsed, {@link #complete()} ends it.
 */
public final class Step {

  public enum Kind {
    COMPLETE,
    YIELD,
    SLEEP
  }

  private static final Step COMPLETE = new Step ( Kind.COMPLETE, Duration.ZERO );
  private static final Step YIELD    = new Step ( Kind.YIELD, Duration.ZERO );

  private final Kind     kind;
  private final Duration delay;

  private Step ( Kind kind, Duration delay ) {
    this.kind = kind;
    this.delay = delay;
  }

  public static Step complete () {
    return COMPLETE;
  }

  public static Step yield () {
    return YIELD;
  }

  /**
   * Suspends for at least {@code delay}. A zero delay is the same as {@link #yield()}.
   *
   * @throws IllegalArgumentException if {@code delay} is negative
   */
  public static Step sleep ( Duration delay ) {
    Objects.requireNonNull ( delay, "Delay cannot be null" );
    if ( delay.isNegative () ) {
      throw new IllegalArgumentException ( "Delay cannot be negative: " + delay );
    }
    return delay.isZero () ? YIELD : new Step ( Kind.SLEEP, delay );
  }

  public Kind kind () {
    return kind;
  }

  public Duration delay () {
    return delay;
  }

  public boolean isComplete () {
    return kind == Kind.COMPLETE;
  }

  @Override
  public String toString () {
    return kind == Kind.SLEEP ? "Step[SLEEP " + delay.toMillis () + "ms]" : "Step[" + kind + "]";
  }
}
