package io.fullerstack.strands.memory;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Opaque handle to one fixed-size block of a {@link MemoryPool}.
 * <p>
 * A handle is tagged with the pool that issued it, the slab and slot it occupies and
 * the slot's generation at allocation time. The generation advances every time the slot
 * is freed, so a handle kept after {@link MemoryPool#deallocate} no longer matches and
 * is rejected instead of aliasing whoever reuses the slot.
 */
public final class Block {

  private final MemoryPool pool;
  private final int slab;
  private final int index;
  private final int generation;

  Block(MemoryPool pool, int slab, int index, int generation) {
    this.pool = pool;
    this.slab = slab;
    this.index = index;
    this.generation = generation;
  }

  /**
   * A view of exactly {@link #size()} bytes of this block's memory.
   * Position 0 of the view is the first byte of the block.
   *
   * <p>Only this call is checked against the block's generation. A view obtained
   * while the block was live stays usable after {@link MemoryPool#deallocate(Block)},
   * and writes through it land in whichever block reuses the slot. Callers must drop
   * their views before freeing the block.
   *
   * @throws InvalidBlockException if the block has been freed
   */
  public ByteBuffer buffer() {
    return pool.view(this);
  }

  /**
   * @return true while this handle refers to a live allocation
   */
  public boolean isLive() {
    return pool.isLive(this);
  }

  public int size() {
    return pool.blockSize();
  }

  MemoryPool pool() {
    return pool;
  }

  int slab() {
    return slab;
  }

  int index() {
    return index;
  }

  int generation() {
    return generation;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Block)) {
      return false;
    }
    Block other = (Block) o;
    return pool == other.pool && slab == other.slab && index == other.index && generation == other.generation;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(pool), slab, index, generation);
  }

  @Override
  public String toString() {
    return "Block[pool=" + pool.id() + ", slab=" + slab + ", index=" + index + ", gen=" + generation + "]";
  }
}
