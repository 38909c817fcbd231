package io.fullerstack.strands.cell;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion lock that records a label for whoever currently holds it.
 * <p>
 * The holder label is set for exactly as long as the guarded action runs and is
 * cleared whether the action returns or throws. Exceptions from the action propagate.
 */
public final class HolderLock {

  private final    ReentrantLock lock = new ReentrantLock ();
  private volatile String        holder;

  public < R > R withLock ( Supplier < ? extends R > action, String holderName ) {
    Objects.requireNonNull ( action, "Action cannot be null" );
    Objects.requireNonNull ( holderName, "Holder name cannot be null" );
    lock.lock ();
    String previous = holder;
    try {
      holder = holderName;
      return action.get ();
    } finally {
      // re-entrant acquisition restores the outer holder
      holder = previous;
      lock.unlock ();
    }
  }

  public void withLock ( Runnable action, String holderName ) {
    Objects.requireNonNull ( action, "Action cannot be null" );
    withLock ( () -> {
      action.run ();
      return null;
    }, holderName );
  }

  public Optional < String > currentHolder () {
    return Optional.ofNullable ( holder );
  }

  public boolean isLocked () {
    return lock.isLocked ();
  }
}
