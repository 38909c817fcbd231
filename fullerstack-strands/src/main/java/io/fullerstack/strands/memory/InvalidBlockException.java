package io.fullerstack.strands.memory;

/**
 * Thrown when a {@link Block} is freed or accessed while it is not a live allocation
 * of the pool it is handed to: a block from another pool, a double free, or a stale
 * handle to a block that has since been freed.
 */
public class InvalidBlockException extends IllegalArgumentException {

  public InvalidBlockException(String message) {
    super(message);
  }
}
