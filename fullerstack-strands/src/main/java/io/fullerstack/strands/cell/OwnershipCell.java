package io.fullerstack.strands.cell;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Single-owner container with guarded access and one-way transfer.
 * <p>
 * <b>Ownership model:</b>
 * <ul>
 * <li>The cell starts out holding a value and an owner label</li>
 * <li>{@link #borrowShared} and {@link #borrowExclusive} lend the value to a callback
 * for the duration of the call</li>
 * <li>{@link #transfer} moves the value out and relabels the owner; the cell is empty
 * from then on and every further borrow or transfer fails with
 * {@link UseAfterTransferException}</li>
 * </ul>
 * <p>
 * <b>Locking:</b>
 * Shared borrows hold the read lock and may overlap each other. Exclusive borrows and
 * transfer hold the write lock, so a transfer never races a borrow in progress and every
 * borrow completed before the transfer is visible to the transferring thread.
 * <p>
 * Java cannot forbid use of a moved-from handle at compile time, so emptiness is a runtime
 * tag checked on every access.
 *
 * @param <T> the value type
 */
public final class OwnershipCell < T > {

  private static final Logger logger = LoggerFactory.getLogger ( OwnershipCell.class );

  static final String ANONYMOUS = "anonymous";

  private final ReadWriteLock lock = new ReentrantReadWriteLock ();

  private T       value;
  private String  owner;
  private boolean transferred;

  /**
   * Write access to a cell's value, valid only inside {@link #borrowExclusive}.
   *
   * @param <T> the value type
   */
  public interface Access < T > {

    T get ();

    void set ( T value );

  }

  public OwnershipCell ( T value ) {
    this ( value, ANONYMOUS );
  }

  public OwnershipCell ( T value, String owner ) {
    this.value = Objects.requireNonNull ( value, "Cell value cannot be null" );
    this.owner = Objects.requireNonNull ( owner, "Owner cannot be null" );
  }

  public static < T > OwnershipCell < T > of ( T value, String owner ) {
    return new OwnershipCell <> ( value, owner );
  }

  /**
   * Lends the value to {@code fn} for reading.
   *
   * @return whatever {@code fn} returns
   * @throws UseAfterTransferException if the value has been transferred out
   */
  public < R > R borrowShared ( Function < ? super T, ? extends R > fn ) {
    Objects.requireNonNull ( fn, "Borrow function cannot be null" );
    lock.readLock ().lock ();
    try {
      ensureAvailable ();
      return fn.apply ( value );
    } finally {
      lock.readLock ().unlock ();
    }
  }

  /**
   * Lends the value to {@code fn} with write access. The {@link Access} handle
   * must not escape the call; it is invalidated as soon as {@code fn} returns.
   *
   * @return whatever {@code fn} returns
   * @throws UseAfterTransferException if the value has been transferred out
   */
  public < R > R borrowExclusive ( Function < ? super Access < T >, ? extends R > fn ) {
    Objects.requireNonNull ( fn, "Borrow function cannot be null" );
    lock.writeLock ().lock ();
    try {
      ensureAvailable ();
      ScopedAccess access = new ScopedAccess ();
      try {
        return fn.apply ( access );
      } finally {
        access.valid = false;
      }
    } finally {
      lock.writeLock ().unlock ();
    }
  }

  /**
   * Moves the value out of the cell and hands it to {@code newOwner}.
   *
   * @return the value previously held
   * @throws UseAfterTransferException if the value has already been transferred out
   */
  public T transfer ( String newOwner ) {
    Objects.requireNonNull ( newOwner, "New owner cannot be null" );
    lock.writeLock ().lock ();
    try {
      ensureAvailable ();
      T moved = value;
      logger.debug ( "Ownership transferred from '{}' to '{}'", owner, newOwner );
      value = null;
      owner = newOwner;
      transferred = true;
      return moved;
    } finally {
      lock.writeLock ().unlock ();
    }
  }

  public boolean isAvailable () {
    lock.readLock ().lock ();
    try {
      return !transferred;
    } finally {
      lock.readLock ().unlock ();
    }
  }

  public String currentOwner () {
    lock.readLock ().lock ();
    try {
      return owner;
    } finally {
      lock.readLock ().unlock ();
    }
  }

  private void ensureAvailable () {
    if ( transferred ) {
      throw new UseAfterTransferException ( owner );
    }
  }

  @Override
  public String toString () {
    return "OwnershipCell[owner=" + currentOwner () + ", available=" + isAvailable () + "]";
  }

  // Only touched while the write lock is held by the borrowing thread
  private final class ScopedAccess implements Access < T > {

    private volatile boolean valid = true;

    @Override
    public T get () {
      check ();
      return value;
    }

    @Override
    public void set ( T replacement ) {
      check ();
      value = Objects.requireNonNull ( replacement, "Cell value cannot be null" );
    }

    private void check () {
      if ( !valid ) {
        throw new IllegalStateException ( "Access used outside of its borrowExclusive call" );
      }
    }
  }
}
