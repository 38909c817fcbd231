package io.fullerstack.strands.scheduler;

import io.fullerstack.strands.config.HierarchicalConfig;
import io.fullerstack.strands.task.Continuation;
import io.fullerstack.strands.task.Step;
import io.fullerstack.strands.task.Task;
import io.fullerstack.strands.task.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of worker threads driving {@link Task}s to completion.
 * <p>
 * <b>Queues:</b>
 * <ul>
 * <li><b>Ready queue</b>: tasks waiting for a worker, taken in {@link QueuePolicy} order</li>
 * <li><b>Timer queue</b>: tasks that asked to {@link Step#sleep sleep}, ordered by wake time.
 * A sleeping task holds no worker; it is moved back to the ready queue once due</li>
 * </ul>
 * <p>
 * <b>Per-task cycle:</b> a worker removes a task from the ready queue, resumes it once and then
 * either records its termination, puts it back on the ready queue (yield) or on the timer
 * queue (sleep). A task is in at most one place at a time, so it is never resumed by two
 * workers at once. A yielded task always goes back through the ready queue; it is not
 * resumed again within the same worker iteration.
 * <p>
 * <b>Completion gate:</b> {@link #awaitAll()} blocks on a condition signalled when the
 * number of active tasks drops to zero. No polling.
 * <p>
 * <b>Shutdown:</b> {@link #shutdown()} stops and joins the workers, then releases every task
 * still queued or sleeping without resuming it. Those tasks are counted as dropped.
 * <p>
 * Worker threads are daemon threads, so an abandoned scheduler does not keep the JVM alive.
 */
public class Scheduler implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger ( Scheduler.class );

  static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds ( 5 );

  private final String      name;
  private final QueuePolicy policy;
  private final Duration    shutdownTimeout;

  private final ReentrantLock           lock          = new ReentrantLock ();
  private final Condition               workAvailable = lock.newCondition ();
  private final Condition               idle          = lock.newCondition ();
  private final Deque < Task >          ready         = new ArrayDeque <> ();
  private final PriorityQueue < Sleeper > sleeping    = new PriorityQueue <> ();
  private       long                    sleepSequence;
  private volatile boolean              stopping;

  private final List < Thread > workers;
  private final AtomicBoolean   shutdown = new AtomicBoolean ();

  private final AtomicLong created   = new AtomicLong ();
  private final AtomicLong completed = new AtomicLong ();
  private final AtomicLong failed    = new AtomicLong ();
  private final AtomicLong dropped   = new AtomicLong ();
  private final AtomicLong active    = new AtomicLong ();

  private record Sleeper( Task task, long wakeAt, long sequence ) implements Comparable < Sleeper > {

    @Override
    public int compareTo ( Sleeper other ) {
      int byTime = Long.compare ( wakeAt - other.wakeAt, 0L );
      return byTime != 0 ? byTime : Long.compare ( sequence, other.sequence );
    }
  }

  /**
   * Creates a FIFO scheduler with {@code workerCount} workers and starts them.
   *
   * @param workerCount number of workers; 0 means one per available processor
   */
  public Scheduler ( int workerCount ) {
    this ( "strands", workerCount, QueuePolicy.FIFO, DEFAULT_SHUTDOWN_TIMEOUT );
  }

  /**
   * Creates a scheduler and starts its workers.
   *
   * @param name            used in worker thread names and log messages
   * @param workerCount     number of workers; 0 means one per available processor
   * @param policy          order in which ready tasks are taken
   * @param shutdownTimeout how long {@link #shutdown()} waits for workers before interrupting them
   */
  public Scheduler ( String name, int workerCount, QueuePolicy policy, Duration shutdownTimeout ) {
    this.name = Objects.requireNonNull ( name, "Scheduler name cannot be null" );
    this.policy = Objects.requireNonNull ( policy, "Queue policy cannot be null" );
    this.shutdownTimeout = Objects.requireNonNull ( shutdownTimeout, "Shutdown timeout cannot be null" );
    if ( workerCount < 0 ) {
      throw new IllegalArgumentException ( "Worker count cannot be negative: " + workerCount );
    }
    if ( shutdownTimeout.isNegative () ) {
      throw new IllegalArgumentException ( "Shutdown timeout cannot be negative: " + shutdownTimeout );
    }
    int count = workerCount == 0 ? Runtime.getRuntime ().availableProcessors () : workerCount;

    List < Thread > threads = new ArrayList <> ( count );
    for ( int i = 0; i < count; i++ ) {
      Thread worker = new Thread ( this::runWorker, name + "-worker-" + i );
      worker.setDaemon ( true );
      threads.add ( worker );
    }
    this.workers = List.copyOf ( threads );
    workers.forEach ( Thread::start );

    logger.info ( "Started scheduler '{}' with {} workers ({} queue)", name, count, policy );
  }

  /**
   * Builds a scheduler from the {@code scheduler.*} keys of {@code config}.
   */
  public static Scheduler fromConfig ( HierarchicalConfig config ) {
    Objects.requireNonNull ( config, "Config cannot be null" );
    return builder ()
      .name ( config.getString ( "scheduler.name", "strands" ) )
      .workers ( config.getInt ( "scheduler.worker-count", 0 ) )
      .policy ( config.getEnum ( "scheduler.queue-policy", QueuePolicy.class, QueuePolicy.FIFO ) )
      .shutdownTimeout ( Duration.ofMillis (
        config.getLong ( "scheduler.shutdown-timeout-ms", DEFAULT_SHUTDOWN_TIMEOUT.toMillis () ) ) )
      .build ();
  }

  public static Builder builder () {
    return new Builder ();
  }

  // =========================================================================
  // Spawning
  // =========================================================================

  /**
   * Hands {@code task} to this scheduler and wakes one idle worker.
   * Safe to call from any thread, including from inside a running task.
   *
   * @return the task
   * @throws IllegalArgumentException   if the task was already spawned or is already done
   * @throws RejectedExecutionException if the scheduler has been shut down; the task is released
   */
  public Task spawn ( Task task ) {
    Objects.requireNonNull ( task, "Task cannot be null" );
    if ( !task.claim () ) {
      throw new IllegalArgumentException ( "Task '" + task.name () + "' was already spawned" );
    }
    if ( task.isDone () ) {
      throw new IllegalArgumentException ( "Task '" + task.name () + "' is already done" );
    }

    lock.lock ();
    try {
      if ( !stopping ) {
        ready.addLast ( task );
        created.incrementAndGet ();
        active.incrementAndGet ();
        workAvailable.signal ();
        logger.debug ( "Spawned task '{}' on scheduler '{}'", task.name (), name );
        return task;
      }
    } finally {
      lock.unlock ();
    }

    task.destroy ();
    throw new RejectedExecutionException (
      "Scheduler '" + name + "' is shut down; task '" + task.name () + "' rejected"
    );
  }

  public Task spawn ( String taskName, Runnable body ) {
    return spawn ( Task.of ( taskName, body ) );
  }

  public Task spawn ( String taskName, Continuation continuation ) {
    return spawn ( Task.of ( taskName, continuation ) );
  }

  // =========================================================================
  // Worker loop
  // =========================================================================

  private void runWorker () {
    logger.debug ( "Worker {} started", Thread.currentThread ().getName () );
    Task task;
    while ( ( task = nextTask () ) != null ) {
      Step step = task.resume ();
      // An interrupt raised or restored inside a task belongs to that task
      if ( !stopping && Thread.interrupted () ) {
        logger.debug ( "Cleared interrupt left by task '{}'", task.name () );
      }
      if ( task.isDone () ) {
        terminated ( task );
      } else {
        reschedule ( task, step );
      }
    }
    logger.debug ( "Worker {} stopped", Thread.currentThread ().getName () );
  }

  /**
   * Blocks until a task is ready or the scheduler stops.
   *
   * @return the next task, or null when the worker should exit
   */
  private Task nextTask () {
    lock.lock ();
    try {
      while ( !stopping ) {
        long now = System.nanoTime ();
        promoteDueSleepers ( now );
        Task task = policy == QueuePolicy.FIFO ? ready.pollFirst () : ready.pollLast ();
        if ( task != null ) {
          return task;
        }
        Sleeper earliest = sleeping.peek ();
        try {
          if ( earliest == null ) {
            workAvailable.await ();
          } else {
            workAvailable.awaitNanos ( earliest.wakeAt - now );
          }
        } catch ( InterruptedException e ) {
          // Only shutdown may end a worker; it sets stopping before interrupting
          if ( stopping ) {
            Thread.currentThread ().interrupt ();
            return null;
          }
          logger.debug ( "Worker {} ignored a stray interrupt while idle", Thread.currentThread ().getName () );
        }
      }
      return null;
    } finally {
      lock.unlock ();
    }
  }

  // Caller holds the lock
  private void promoteDueSleepers ( long now ) {
    Sleeper head;
    while ( ( head = sleeping.peek () ) != null && head.wakeAt - now <= 0 ) {
      sleeping.poll ();
      ready.addLast ( head.task );
    }
  }

  private void reschedule ( Task task, Step step ) {
    lock.lock ();
    try {
      if ( !stopping ) {
        if ( step.kind () == Step.Kind.SLEEP ) {
          sleeping.add ( new Sleeper ( task, System.nanoTime () + step.delay ().toNanos (), sleepSequence++ ) );
        } else {
          ready.addLast ( task );
        }
        workAvailable.signal ();
        return;
      }
    } finally {
      lock.unlock ();
    }
    drop ( task );
  }

  private void terminated ( Task task ) {
    completed.incrementAndGet ();
    if ( task.state () == TaskState.FAILED ) {
      failed.incrementAndGet ();
    }
    logger.debug ( "Task '{}' finished as {}", task.name (), task.state () );
    deactivate ();
  }

  private void drop ( Task task ) {
    task.destroy ();
    dropped.incrementAndGet ();
    deactivate ();
  }

  private void deactivate () {
    if ( active.decrementAndGet () == 0 ) {
      lock.lock ();
      try {
        idle.signalAll ();
      } finally {
        lock.unlock ();
      }
    }
  }

  // =========================================================================
  // Waiting and shutdown
  // =========================================================================

  /**
   * Blocks until no spawned task is active.
   *
   * @throws IllegalStateException if called from one of this scheduler's workers,
   *                               or if the calling thread is interrupted
   */
  public void awaitAll () {
    checkNotWorker ( "awaitAll" );
    lock.lock ();
    try {
      while ( active.get () > 0 ) {
        idle.await ();
      }
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      throw new IllegalStateException ( "Scheduler '" + name + "' await interrupted", e );
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Blocks until no spawned task is active or the timeout elapses.
   *
   * @return true if all tasks finished, false on timeout
   */
  public boolean awaitAll ( Duration timeout ) {
    Objects.requireNonNull ( timeout, "Timeout cannot be null" );
    checkNotWorker ( "awaitAll" );
    long remaining = timeout.toNanos ();
    lock.lock ();
    try {
      while ( active.get () > 0 ) {
        if ( remaining <= 0 ) {
          return false;
        }
        remaining = idle.awaitNanos ( remaining );
      }
      return true;
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      throw new IllegalStateException ( "Scheduler '" + name + "' await interrupted", e );
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Stops the workers and releases every task that has not finished.
   * <p>
   * Workers finish the slice they are running, then exit. Each worker is given the
   * configured shutdown timeout to exit before it is interrupted. Tasks still queued or
   * sleeping afterwards are released without being resumed. Idempotent.
   */
  public void shutdown () {
    if ( !shutdown.compareAndSet ( false, true ) ) {
      return;
    }
    logger.info ( "Shutting down scheduler '{}' ({} active tasks)", name, active.get () );

    lock.lock ();
    try {
      stopping = true;
      workAvailable.signalAll ();
    } finally {
      lock.unlock ();
    }

    joinWorkers ();

    List < Task > leftovers = new ArrayList <> ();
    lock.lock ();
    try {
      leftovers.addAll ( ready );
      ready.clear ();
      while ( !sleeping.isEmpty () ) {
        leftovers.add ( sleeping.poll ().task );
      }
    } finally {
      lock.unlock ();
    }
    leftovers.forEach ( this::drop );

    logger.info ( "Scheduler '{}' shut down: {}", name, stats () );
  }

  private void joinWorkers () {
    Thread self = Thread.currentThread ();
    long deadline = System.nanoTime () + shutdownTimeout.toNanos ();
    try {
      for ( Thread worker : workers ) {
        if ( worker == self ) {
          continue;
        }
        long remainingMs = TimeUnit.NANOSECONDS.toMillis ( deadline - System.nanoTime () );
        worker.join ( Math.max ( 1L, remainingMs ) );
        if ( worker.isAlive () ) {
          logger.warn ( "Worker {} still running after {}ms; interrupting", worker.getName (), shutdownTimeout.toMillis () );
          worker.interrupt ();
          worker.join ( Math.max ( 1L, shutdownTimeout.toMillis () ) );
          if ( worker.isAlive () ) {
            logger.error ( "Worker {} did not stop; abandoning it", worker.getName () );
          }
        }
      }
    } catch ( InterruptedException e ) {
      Thread.currentThread ().interrupt ();
      logger.warn ( "Interrupted while joining workers of scheduler '{}'", name );
    }
  }

  @Override
  public void close () {
    shutdown ();
  }

  private void checkNotWorker ( String operation ) {
    if ( workers.contains ( Thread.currentThread () ) ) {
      throw new IllegalStateException (
        "Cannot call Scheduler::" + operation + " from within one of the scheduler's workers"
      );
    }
  }

  // =========================================================================
  // Queries
  // =========================================================================

  public SchedulerStats stats () {
    return new SchedulerStats (
      active.get (),
      created.get (),
      completed.get (),
      failed.get (),
      dropped.get (),
      workers.size ()
    );
  }

  public boolean isShutdown () {
    return shutdown.get ();
  }

  public String name () {
    return name;
  }

  public QueuePolicy policy () {
    return policy;
  }

  public int workerCount () {
    return workers.size ();
  }

  @Override
  public String toString () {
    return "Scheduler[" + name + ", " + stats () + "]";
  }

  /**
   * Builder for Scheduler.
   */
  public static class Builder {
    private String      name            = "strands";
    private int         workers;
    private QueuePolicy policy          = QueuePolicy.FIFO;
    private Duration    shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    public Builder name ( String name ) {
      this.name = name;
      return this;
    }

    public Builder workers ( int workers ) {
      this.workers = workers;
      return this;
    }

    public Builder policy ( QueuePolicy policy ) {
      this.policy = policy;
      return this;
    }

    public Builder shutdownTimeout ( Duration shutdownTimeout ) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public Scheduler build () {
      return new Scheduler ( name, workers, policy, shutdownTimeout );
    }
  }
}
