package io.fullerstack.strands.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A suspendable unit of work driven by a scheduler.
 * <p>
 * <b>Execution:</b>
 * <ul>
 * <li>{@link #resume()} runs one slice of the {@link Continuation}, up to its next {@link Step}</li>
 * <li>Only one thread may be inside {@link #resume()} at a time; a concurrent call fails fast</li>
 * <li>Anything thrown by the continuation is caught here: the task becomes
 * {@link TaskState#FAILED}, the cause is logged and kept, and nothing propagates
 * (a {@link VirtualMachineError} is recorded and then rethrown)</li>
 * </ul>
 * <p>
 * <b>Release:</b>
 * The continuation is closed exactly once: on completion, on failure, or when the owning
 * scheduler tears the task down while it is still suspended. After release the task is done.
 * <p>
 * A task belongs to at most one scheduler. Once {@linkplain #claim() claimed} it cannot be
 * spawned again.
 */
public final class Task {

  private static final Logger logger = LoggerFactory.getLogger ( Task.class );

  static final String UNNAMED = "unnamed-task";

  private final String         name;
  private final Instant        createdAt;
  private final AtomicBoolean  running    = new AtomicBoolean ();
  private final AtomicBoolean  claimed    = new AtomicBoolean ();
  private final CountDownLatch terminated = new CountDownLatch ( 1 );

  private volatile Continuation continuation;
  private volatile TaskState    state = TaskState.CREATED;
  private volatile Throwable    failure;
  private volatile int          resumeCount;

  public Task ( String name, Continuation continuation ) {
    this.name = Objects.requireNonNull ( name, "Task name cannot be null" );
    this.continuation = Objects.requireNonNull ( continuation, "Continuation cannot be null" );
    this.createdAt = Instant.now ();
  }

  public Task ( Continuation continuation ) {
    this ( UNNAMED, continuation );
  }

  public static Task of ( String name, Continuation continuation ) {
    return new Task ( name, continuation );
  }

  /**
   * A task that runs {@code body} once and completes.
   */
  public static Task of ( String name, Runnable body ) {
    Objects.requireNonNull ( body, "Task body cannot be null" );
    return new Task ( name, () -> {
      body.run ();
      return Step.complete ();
    } );
  }

  /**
   * A task that runs each stage in order, yielding back to the scheduler between stages.
   */
  public static Task sequence ( String name, Runnable... stages ) {
    List < Runnable > steps = List.copyOf ( Arrays.asList ( stages ) );
    return new Task ( name, new Continuation () {
      private int next;

      @Override
      public Step resume () {
        if ( next < steps.size () ) {
          steps.get ( next++ ).run ();
        }
        return next < steps.size () ? Step.yield () : Step.complete ();
      }
    } );
  }

  /**
   * Runs the continuation up to its next suspension point.
   *
   * @return the step the continuation asked for; {@link Step#complete()} once the task is done
   * @throws IllegalStateException if another thread is already resuming this task
   */
  public Step resume () {
    if ( !running.compareAndSet ( false, true ) ) {
      throw new IllegalStateException ( "Task '" + name + "' is already being resumed" );
    }
    try {
      Continuation current = continuation;
      if ( current == null || state.isTerminal () ) {
        return Step.complete ();
      }
      resumeCount++;
      Step step;
      try {
        step = current.resume ();
      } catch ( InterruptedException e ) {
        Thread.currentThread ().interrupt ();
        fail ( e );
        return Step.complete ();
      } catch ( VirtualMachineError e ) {
        fail ( e );
        throw e;
      } catch ( Exception | Error e ) {
        fail ( e );
        return Step.complete ();
      }
      if ( step == null || step.isComplete () ) {
        state = TaskState.COMPLETED;
        release ();
        return Step.complete ();
      }
      state = TaskState.SUSPENDED;
      return step;
    } finally {
      running.set ( false );
    }
  }

  private void fail ( Throwable cause ) {
    failure = cause;
    state = TaskState.FAILED;
    logger.warn ( "Task '{}' failed after {} resume(s)", name, resumeCount, cause );
    release ();
  }

  /**
   * Releases the continuation without running it further. Idempotent.
   * Used by schedulers to tear down tasks that will never be resumed again.
   */
  public void destroy () {
    if ( continuation != null && !state.isTerminal () ) {
      logger.debug ( "Tearing down task '{}' in state {}", name, state );
    }
    release ();
  }

  private void release () {
    Continuation current;
    synchronized ( this ) {
      current = continuation;
      continuation = null;
    }
    if ( current == null ) {
      return;
    }
    try {
      current.close ();
    } catch ( RuntimeException e ) {
      logger.error ( "Error releasing task '{}'", name, e );
    } finally {
      terminated.countDown ();
    }
  }

  /**
   * Marks this task as owned by a scheduler.
   *
   * @return false if it was already claimed
   */
  public boolean claim () {
    return claimed.compareAndSet ( false, true );
  }

  public boolean isDone () {
    return continuation == null || state.isTerminal ();
  }

  /**
   * Blocks until this task is done or released.
   *
   * @return true if the task is done, false if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination ( Duration timeout ) throws InterruptedException {
    return terminated.await ( timeout.toNanos (), TimeUnit.NANOSECONDS );
  }

  public TaskState state () {
    return state;
  }

  public Optional < Throwable > failure () {
    return Optional.ofNullable ( failure );
  }

  public String name () {
    return name;
  }

  public Instant createdAt () {
    return createdAt;
  }

  public int resumeCount () {
    return resumeCount;
  }

  @Override
  public String toString () {
    return "Task[" + name + ", " + state + "]";
  }
}
