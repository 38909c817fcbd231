package io.fullerstack.strands.memory;

/**
 * Thrown by {@link MemoryPool#allocate()} when every block is in use and the pool
 * already holds its maximum number of slabs.
 */
public class PoolExhaustedException extends RuntimeException {

  public PoolExhaustedException(String message) {
    super(message);
  }
}
