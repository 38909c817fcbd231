package io.fullerstack.strands.memory;

/**
 * Snapshot of a {@link MemoryPool}, taken under the pool's lock.
 *
 * @param slabs         slabs allocated so far
 * @param blockSize     bytes per block
 * @param blocksPerSlab blocks carved from each slab
 * @param allocated     blocks currently handed out
 * @param free          blocks on the free list
 */
public record PoolStats(
  int slabs,
  int blockSize,
  int blocksPerSlab,
  int allocated,
  int free
) {

  /**
   * @return total blocks across all slabs
   */
  public int capacity() {
    return slabs * blocksPerSlab;
  }
}
