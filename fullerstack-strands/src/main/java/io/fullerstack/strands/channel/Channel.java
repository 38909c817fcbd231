package io.fullerstack.strands.channel;

import io.fullerstack.strands.config.HierarchicalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO channel for handing values between threads and tasks.
 * <p>
 * <b>Guarantees:</b>
 * <ul>
 * <li>The number of queued items never exceeds {@link #capacity()}</li>
 * <li>Items are received in the order they were sent</li>
 * <li>Once closed, no item is ever enqueued again; items already queued are still delivered</li>
 * <li>After close, once drained, every receive returns empty immediately</li>
 * </ul>
 * <p>
 * <b>Blocking vs. non-blocking:</b>
 * {@link #send} and {@link #receive()} block the calling thread. Code running inside a
 * scheduler task should prefer {@link #trySend} and {@link #tryReceive} and yield when they
 * do not succeed, so that it never holds a worker while waiting on the channel.
 *
 * @param <T> item type; null items are rejected
 */
public class Channel < T > {

  private static final Logger logger = LoggerFactory.getLogger ( Channel.class );

  static final int DEFAULT_CAPACITY = 100;

  private final int               capacity;
  private final ArrayDeque < T >  items;
  private final ReentrantLock     lock     = new ReentrantLock ();
  private final Condition         notEmpty = lock.newCondition ();
  private final Condition         notFull  = lock.newCondition ();
  private       boolean           closed;

  /**
   * Creates a channel with the default capacity of 100.
   */
  public Channel () {
    this ( DEFAULT_CAPACITY );
  }

  /**
   * @param capacity maximum number of queued items
   * @throws IllegalArgumentException if capacity is not positive
   */
  public Channel ( int capacity ) {
    if ( capacity <= 0 ) {
      throw new IllegalArgumentException ( "Channel capacity must be positive: " + capacity );
    }
    this.capacity = capacity;
    this.items = new ArrayDeque <> ( Math.min ( capacity, 1024 ) );
  }

  /**
   * Creates a channel sized by {@code channel.default-capacity}.
   */
  public static < T > Channel < T > fromConfig ( HierarchicalConfig config ) {
    return new Channel <> ( config.getInt ( "channel.default-capacity", DEFAULT_CAPACITY ) );
  }

  /**
   * Enqueues {@code value}, waiting for space if the channel is full.
   *
   * @return true if enqueued; false if the channel was closed before or while waiting
   * @throws InterruptedException if interrupted while waiting for space
   */
  public boolean send ( T value ) throws InterruptedException {
    Objects.requireNonNull ( value, "Channel item cannot be null" );
    lock.lockInterruptibly ();
    try {
      if ( closed ) {
        logger.debug ( "Send rejected: channel closed" );
        return false;
      }
      while ( !closed && items.size () >= capacity ) {
        notFull.await ();
      }
      if ( closed ) {
        return false;
      }
      enqueue ( value );
      return true;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Enqueues {@code value} only if that can be done without waiting.
   */
  public SendResult trySend ( T value ) {
    Objects.requireNonNull ( value, "Channel item cannot be null" );
    lock.lock ();
    try {
      if ( closed ) {
        return SendResult.CLOSED;
      }
      if ( items.size () >= capacity ) {
        return SendResult.FULL;
      }
      enqueue ( value );
      return SendResult.SENT;
    } finally {
      lock.unlock ();
    }
  }

  // Caller holds the lock
  private void enqueue ( T value ) {
    items.addLast ( value );
    notEmpty.signal ();
  }

  /**
   * Takes the oldest item, waiting for one if the channel is empty and open.
   *
   * @return the item, or empty once the channel is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional < T > receive () throws InterruptedException {
    lock.lockInterruptibly ();
    try {
      while ( items.isEmpty () && !closed ) {
        notEmpty.await ();
      }
      return Optional.ofNullable ( dequeue () );
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Like {@link #receive()} but gives up after {@code timeout}.
   *
   * @return the item, or empty if the channel is drained or the timeout elapsed;
   * use {@link #isDrained()} to tell the two apart
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional < T > receive ( Duration timeout ) throws InterruptedException {
    Objects.requireNonNull ( timeout, "Timeout cannot be null" );
    long remaining = timeout.toNanos ();
    lock.lockInterruptibly ();
    try {
      while ( items.isEmpty () && !closed ) {
        if ( remaining <= 0 ) {
          return Optional.empty ();
        }
        remaining = notEmpty.awaitNanos ( remaining );
      }
      return Optional.ofNullable ( dequeue () );
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Takes the oldest item if one is queued.
   */
  public Optional < T > tryReceive () {
    lock.lock ();
    try {
      return Optional.ofNullable ( dequeue () );
    } finally {
      lock.unlock ();
    }
  }

  // Caller holds the lock
  private T dequeue () {
    T value = items.pollFirst ();
    if ( value != null ) {
      notFull.signal ();
    }
    return value;
  }

  /**
   * Closes the channel. Blocked senders return false; blocked receivers drain what is
   * queued and then see the end of the channel. Idempotent.
   */
  public void close () {
    lock.lock ();
    try {
      if ( closed ) {
        return;
      }
      closed = true;
      notEmpty.signalAll ();
      notFull.signalAll ();
      logger.debug ( "Channel closed with {} queued item(s)", items.size () );
    } finally {
      lock.unlock ();
    }
  }

  public int size () {
    lock.lock ();
    try {
      return items.size ();
    } finally {
      lock.unlock ();
    }
  }

  public boolean isClosed () {
    lock.lock ();
    try {
      return closed;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return true once the channel is closed and every queued item has been received
   */
  public boolean isDrained () {
    lock.lock ();
    try {
      return closed && items.isEmpty ();
    } finally {
      lock.unlock ();
    }
  }

  public int capacity () {
    return capacity;
  }

  @Override
  public String toString () {
    return "Channel[size=" + size () + ", capacity=" + capacity + ", closed=" + isClosed () + "]";
  }
}
