package io.fullerstack.strands.memory;

import io.fullerstack.strands.config.HierarchicalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-block allocator backed by slabs that are allocated on demand.
 *
 * <p><strong>Layout:</strong>
 * <ul>
 *   <li>Each slab is one buffer of {@code blockSize * blocksPerSlab} bytes</li>
 *   <li>The first slab is allocated at construction</li>
 *   <li>When no block is free a new slab is appended, up to {@code maxSlabs}</li>
 *   <li>Slabs are never released</li>
 * </ul>
 *
 * <p><strong>Safety:</strong>
 * Allocation hands out {@link Block} handles, not addresses. {@link #deallocate} rejects
 * a block issued by another pool, a block freed twice, and a stale handle to a slot that
 * has been freed and reused; none of these touch the free list.
 *
 * <p>The free list is a stack: a freed block is usually the next one handed out,
 * but callers must not rely on that.
 */
public class MemoryPool {

  private static final Logger logger = LoggerFactory.getLogger(MemoryPool.class);

  private static final AtomicInteger POOL_IDS = new AtomicInteger();

  static final int DEFAULT_BLOCKS_PER_SLAB = 1024;
  static final int DEFAULT_MAX_SLABS = 64;

  private final int id = POOL_IDS.incrementAndGet();
  private final int blockSize;
  private final int blocksPerSlab;
  private final int maxSlabs;
  private final boolean direct;

  private final ReentrantLock lock = new ReentrantLock();
  private final List<Slab> slabs = new ArrayList<>();
  private int[] freeList = new int[0];
  private int freeCount;
  private int allocated;

  private static final class Slab {
    final ByteBuffer memory;
    final int[] generations;
    final BitSet live;

    Slab(ByteBuffer memory, int blocks) {
      this.memory = memory;
      this.generations = new int[blocks];
      this.live = new BitSet(blocks);
    }
  }

  public MemoryPool(int blockSize) {
    this(blockSize, DEFAULT_BLOCKS_PER_SLAB, DEFAULT_MAX_SLABS, false);
  }

  /**
   * @param blockSize     bytes per block
   * @param blocksPerSlab blocks carved from each slab
   * @param maxSlabs      upper bound on slabs; allocation fails once all are full
   * @param direct        back slabs with direct (off-heap) buffers
   */
  public MemoryPool(int blockSize, int blocksPerSlab, int maxSlabs, boolean direct) {
    if (blockSize <= 0) {
      throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
    }
    if (blocksPerSlab <= 0) {
      throw new IllegalArgumentException("blocksPerSlab must be positive: " + blocksPerSlab);
    }
    if (maxSlabs <= 0) {
      throw new IllegalArgumentException("maxSlabs must be positive: " + maxSlabs);
    }
    if ((long) blockSize * blocksPerSlab > Integer.MAX_VALUE
        || (long) blocksPerSlab * maxSlabs > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
        "Pool geometry too large: " + blockSize + " x " + blocksPerSlab + " x " + maxSlabs
      );
    }
    this.blockSize = blockSize;
    this.blocksPerSlab = blocksPerSlab;
    this.maxSlabs = maxSlabs;
    this.direct = direct;

    lock.lock();
    try {
      addSlab();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Builds a pool from the {@code pool.*} keys of {@code config}.
   */
  public static MemoryPool fromConfig(HierarchicalConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    return new MemoryPool(
      config.getInt("pool.block-size"),
      config.getInt("pool.blocks-per-slab", DEFAULT_BLOCKS_PER_SLAB),
      config.getInt("pool.max-slabs", DEFAULT_MAX_SLABS),
      config.getBoolean("pool.direct", false)
    );
  }

  /**
   * Hands out a block that no other live allocation shares.
   *
   * @throws PoolExhaustedException if every slot is taken and no more slabs may be added
   */
  public Block allocate() {
    lock.lock();
    try {
      if (freeCount == 0) {
        if (slabs.size() >= maxSlabs) {
          throw new PoolExhaustedException(
            "Memory pool " + id + " exhausted: " + allocated + " blocks of "
              + blockSize + " bytes in use across " + slabs.size() + " slabs"
          );
        }
        addSlab();
      }
      int address = freeList[--freeCount];
      int slabIndex = address / blocksPerSlab;
      int slot = address % blocksPerSlab;
      Slab slab = slabs.get(slabIndex);
      slab.live.set(slot);
      allocated++;
      return new Block(this, slabIndex, slot, slab.generations[slot]);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Like {@link #allocate()} but reports exhaustion as an empty result.
   */
  public Optional<Block> tryAllocate() {
    try {
      return Optional.of(allocate());
    } catch (PoolExhaustedException e) {
      logger.debug("tryAllocate: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Returns {@code block} to the free list.
   *
   * @throws InvalidBlockException if the block was not issued by this pool or is not live
   */
  public void deallocate(Block block) {
    Objects.requireNonNull(block, "block cannot be null");
    if (block.pool() != this) {
      throw new InvalidBlockException(block + " was not allocated by memory pool " + id);
    }
    lock.lock();
    try {
      Slab slab = liveSlab(block);
      slab.live.clear(block.index());
      slab.generations[block.index()]++;
      allocated--;
      freeList[freeCount++] = block.slab() * blocksPerSlab + block.index();
    } finally {
      lock.unlock();
    }
  }

  ByteBuffer view(Block block) {
    lock.lock();
    try {
      Slab slab = liveSlab(block);
      return slab.memory.slice(block.index() * blockSize, blockSize);
    } finally {
      lock.unlock();
    }
  }

  boolean isLive(Block block) {
    if (block.pool() != this) {
      return false;
    }
    lock.lock();
    try {
      Slab slab = slabs.get(block.slab());
      return slab.live.get(block.index()) && slab.generations[block.index()] == block.generation();
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock
  private Slab liveSlab(Block block) {
    Slab slab = slabs.get(block.slab());
    if (!slab.live.get(block.index()) || slab.generations[block.index()] != block.generation()) {
      throw new InvalidBlockException(block + " is not a live allocation (double free or stale handle)");
    }
    return slab;
  }

  // Caller holds the lock
  private void addSlab() {
    int bytes = blockSize * blocksPerSlab;
    ByteBuffer memory = direct ? ByteBuffer.allocateDirect(bytes) : ByteBuffer.allocate(bytes);
    int slabIndex = slabs.size();
    slabs.add(new Slab(memory, blocksPerSlab));

    // every block may end up free at once
    int needed = slabs.size() * blocksPerSlab;
    if (freeList.length < needed) {
      int[] grown = new int[Math.min(Math.max(needed, freeList.length * 2), maxSlabs * blocksPerSlab)];
      System.arraycopy(freeList, 0, grown, 0, freeCount);
      freeList = grown;
    }
    // pushed in reverse so the lowest slot is popped first
    int base = slabIndex * blocksPerSlab;
    for (int i = blocksPerSlab - 1; i >= 0; i--) {
      freeList[freeCount++] = base + i;
    }
    logger.debug("Memory pool {} grew to {} slab(s) of {} x {} bytes", id, slabs.size(), blocksPerSlab, blockSize);
  }

  public PoolStats stats() {
    lock.lock();
    try {
      return new PoolStats(slabs.size(), blockSize, blocksPerSlab, allocated, freeCount);
    } finally {
      lock.unlock();
    }
  }

  public int blockSize() {
    return blockSize;
  }

  public int maxSlabs() {
    return maxSlabs;
  }

  int id() {
    return id;
  }

  @Override
  public String toString() {
    return "MemoryPool[id=" + id + ", " + stats() + "]";
  }
}
