package io.fullerstack.strands.memory;

import io.fullerstack.strands.config.HierarchicalConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryPoolTest {

    @Nested
    @DisplayName("Allocation")
    class Allocation {

        @Test
        void shouldHandOutDistinctBlocks() {
            MemoryPool pool = new MemoryPool(16, 8, 4, false);
            Set<Block> live = new HashSet<>();

            for (int i = 0; i < 20; i++) {
                assertThat(live.add(pool.allocate())).isTrue();
            }

            assertThat(pool.stats().allocated()).isEqualTo(20);
        }

        @Test
        void shouldPreallocateFirstSlab() {
            MemoryPool pool = new MemoryPool(32, 16, 2, false);

            PoolStats stats = pool.stats();
            assertThat(stats.slabs()).isEqualTo(1);
            assertThat(stats.free()).isEqualTo(16);
            assertThat(stats.capacity()).isEqualTo(16);
        }

        @Test
        void shouldGrowBySlabWhenFreeListRunsOut() {
            MemoryPool pool = new MemoryPool(8, 4, 3, false);

            for (int i = 0; i < 5; i++) {
                pool.allocate();
            }

            PoolStats stats = pool.stats();
            assertThat(stats.slabs()).isEqualTo(2);
            assertThat(stats.allocated()).isEqualTo(5);
            assertThat(stats.free()).isEqualTo(3);
        }

        @Test
        void shouldReportExhaustion() {
            MemoryPool pool = new MemoryPool(8, 2, 2, false);
            for (int i = 0; i < 4; i++) {
                pool.allocate();
            }

            assertThatThrownBy(pool::allocate)
                .isInstanceOf(PoolExhaustedException.class)
                .hasMessageContaining("exhausted");
            assertThat(pool.tryAllocate()).isEmpty();
            assertThat(pool.stats().slabs()).isEqualTo(2);
        }

        @Test
        void shouldReuseFreedBlockAfterExhaustion() {
            MemoryPool pool = new MemoryPool(8, 2, 1, false);
            Block first = pool.allocate();
            pool.allocate();

            pool.deallocate(first);

            assertThat(pool.tryAllocate()).isPresent();
            assertThat(pool.tryAllocate()).isEmpty();
        }

        @Test
        void shouldAllowEveryBlockToBeFreedAcrossSlabs() {
            MemoryPool pool = new MemoryPool(8, 4, 3, false);
            List<Block> blocks = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                blocks.add(pool.allocate());
            }

            blocks.forEach(pool::deallocate);

            PoolStats stats = pool.stats();
            assertThat(stats.allocated()).isZero();
            assertThat(stats.free()).isEqualTo(12);
        }
    }

    @Nested
    @DisplayName("Deallocation checks")
    class DeallocationChecks {

        @Test
        void shouldDetectDoubleFree() {
            MemoryPool pool = new MemoryPool(16);
            Block block = pool.allocate();
            pool.deallocate(block);

            assertThatThrownBy(() -> pool.deallocate(block))
                .isInstanceOf(InvalidBlockException.class)
                .hasMessageContaining("double free");
            assertThat(pool.stats().free()).isEqualTo(1024);
        }

        @Test
        void shouldRejectBlockFromAnotherPool() {
            MemoryPool pool = new MemoryPool(16);
            MemoryPool other = new MemoryPool(16);
            Block foreign = other.allocate();

            assertThatThrownBy(() -> pool.deallocate(foreign))
                .isInstanceOf(InvalidBlockException.class)
                .hasMessageContaining("not allocated by memory pool");
            assertThat(foreign.isLive()).isTrue();
        }

        @Test
        void shouldRejectStaleHandleAfterSlotReuse() {
            MemoryPool pool = new MemoryPool(16, 1, 1, false);
            Block stale = pool.allocate();
            pool.deallocate(stale);
            Block reused = pool.allocate();

            assertThat(reused).isNotEqualTo(stale);
            assertThat(stale.isLive()).isFalse();
            assertThatThrownBy(() -> pool.deallocate(stale)).isInstanceOf(InvalidBlockException.class);
            assertThatThrownBy(stale::buffer).isInstanceOf(InvalidBlockException.class);
            assertThat(reused.isLive()).isTrue();
        }
    }

    @Nested
    @DisplayName("Block memory")
    class BlockMemory {

        @Test
        void shouldExposeExactlyOneBlock() {
            MemoryPool pool = new MemoryPool(32, 4, 1, false);
            Block block = pool.allocate();

            ByteBuffer buffer = block.buffer();

            assertThat(buffer.capacity()).isEqualTo(32);
            assertThat(block.size()).isEqualTo(32);
        }

        @Test
        void shouldKeepNeighbouringBlocksApart() {
            MemoryPool pool = new MemoryPool(8, 4, 1, true);
            Block a = pool.allocate();
            Block b = pool.allocate();

            ByteBuffer first = a.buffer();
            while (first.hasRemaining()) {
                first.put((byte) 0x7f);
            }

            ByteBuffer second = b.buffer();
            while (second.hasRemaining()) {
                assertThat(second.get()).isZero();
            }
            assertThat(a.buffer().get(7)).isEqualTo((byte) 0x7f);
        }
    }

    @Test
    void shouldBuildFromConfig() {
        MemoryPool pool = MemoryPool.fromConfig(HierarchicalConfig.forComponent("ingest"));

        assertThat(pool.blockSize()).isEqualTo(128);
        assertThat(pool.maxSlabs()).isEqualTo(64);
        assertThat(pool.stats().blocksPerSlab()).isEqualTo(1024);
    }

    @Test
    void shouldRejectInvalidGeometry() {
        assertThatThrownBy(() -> new MemoryPool(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MemoryPool(8, 0, 1, false)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MemoryPool(8, 1, 0, false)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MemoryPool(Integer.MAX_VALUE, 2, 1, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldHandOutDistinctBlocksUnderConcurrency() throws Exception {
        MemoryPool pool = new MemoryPool(8, 64, 32, false);
        int threadCount = 8;
        int allocationsPerThread = 200;
        Set<Block> all = Collections.synchronizedSet(new HashSet<>());
        CountDownLatch done = new CountDownLatch(threadCount);

        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < allocationsPerThread; i++) {
                    all.add(pool.allocate());
                }
                done.countDown();
            }).start();
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(all).hasSize(threadCount * allocationsPerThread);
        assertThat(pool.stats().allocated()).isEqualTo(threadCount * allocationsPerThread);
    }
}
