package cn.edu.bit.vaultsync.transfer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import cn.edu.bit.vaultsync.entity.ChunkLedgerEntity;

public class ChunkStateTest {

    @Test
    public void testLifecycle() {
        var chunk = new ChunkState(0, 0, 100);
        assertTrue(chunk.tryClaim());
        assertFalse(chunk.tryClaim());
        assertEquals(ChunkStatus.IN_FLIGHT, chunk.getStatus());

        assertTrue(chunk.markFailed());
        assertEquals(1, chunk.getRetryCount());
        assertFalse(chunk.markDone("x"));

        assertTrue(chunk.retry());
        assertTrue(chunk.markDone("token-0"));
        assertEquals(ChunkStatus.DONE, chunk.getStatus());
        assertEquals("token-0", chunk.getToken());
        assertEquals(0, chunk.getRetryCount());

        // 完成的分块不会回退
        assertFalse(chunk.revert());
        assertEquals(ChunkStatus.DONE, chunk.getStatus());
        assertEquals(1, chunk.getMaxConcurrentOwners());
    }

    @Test
    public void testRevertFromInFlightAndFailed() {
        var chunk = new ChunkState(1, 100, 100);
        assertFalse(chunk.revert());

        chunk.tryClaim();
        assertTrue(chunk.revert());
        assertEquals(ChunkStatus.PENDING, chunk.getStatus());

        chunk.tryClaim();
        chunk.markFailed();
        assertTrue(chunk.revert());
        assertEquals(ChunkStatus.PENDING, chunk.getStatus());
        assertEquals(2, chunk.getClaimCount());
    }

    @Test
    public void testConcurrentClaimHasSingleWinner() throws InterruptedException {
        var chunk = new ChunkState(0, 0, 10);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var winners = new AtomicInteger();
        for (int i = 0; i < threads; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (chunk.tryClaim()) {
                    winners.incrementAndGet();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(1, winners.get());
        assertEquals(1, chunk.getClaimCount());
    }

    @Test
    public void testRestoreKeepsOnlyDoneChunks() {
        List<ChunkState> chunks = ChunkLedger.restoreChunks(List.of(
                new ChunkLedgerEntity("t", 0, 0, 10, ChunkStatus.DONE.name(), 0, "a"),
                new ChunkLedgerEntity("t", 1, 10, 10, ChunkStatus.FAILED.name(), 3, null),
                new ChunkLedgerEntity("t", 2, 20, 5, ChunkStatus.PENDING.name(), 0, null)));
        assertEquals(3, chunks.size());
        assertEquals(ChunkStatus.DONE, chunks.get(0).getStatus());
        assertEquals("a", chunks.get(0).getToken());
        assertEquals(ChunkStatus.PENDING, chunks.get(1).getStatus());
        assertEquals(0, chunks.get(1).getRetryCount());
        assertEquals(ChunkStatus.PENDING, chunks.get(2).getStatus());
        assertEquals(25, chunks.get(2).getEnd());
    }
}
