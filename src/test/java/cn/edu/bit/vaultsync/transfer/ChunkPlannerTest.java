package cn.edu.bit.vaultsync.transfer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ChunkPlannerTest {

    @Test
    public void testPlanCoversWholeRange() {
        List<ChunkState> chunks = ChunkPlanner.plan(10_000, 4096);
        assertEquals(3, chunks.size());
        assertEquals(0, chunks.get(0).getOffset());
        assertEquals(4096, chunks.get(1).getOffset());
        assertEquals(8192, chunks.get(2).getOffset());
        assertEquals(10_000 - 8192, chunks.get(2).getSize());
        assertEquals(10_000, chunks.get(2).getEnd());
        for (int i = 0; i < chunks.size(); i++) {
            assertEquals(i, chunks.get(i).getIndex());
            assertEquals(ChunkStatus.PENDING, chunks.get(i).getStatus());
        }
    }

    @Test
    public void testExactMultiple() {
        List<ChunkState> chunks = ChunkPlanner.plan(8192, 4096);
        assertEquals(2, chunks.size());
        assertEquals(4096, chunks.get(1).getSize());
    }

    @Test
    public void testEmptyFileHasSingleEmptyChunk() {
        List<ChunkState> chunks = ChunkPlanner.plan(0, 4096);
        assertEquals(1, chunks.size());
        assertEquals(0, chunks.get(0).getSize());
    }

    @Test
    public void testNegativeSizeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChunkPlanner.plan(-1, 4096));
    }

    @Test
    public void testEffectiveChunkSize() {
        // 远端上限更小时取上限
        assertEquals(1000, ChunkPlanner.effectiveChunkSize(4096, 1000, 1));
        // 没有上限
        assertEquals(4096, ChunkPlanner.effectiveChunkSize(4096, 0, 1));
        // 向下对齐到 64 字节
        assertEquals(960, ChunkPlanner.effectiveChunkSize(4096, 1000, 64));
        // 至少一个对齐单位
        assertEquals(16, ChunkPlanner.effectiveChunkSize(10, 0, 16));
    }

    @Test
    public void testAlignedPlanOffsets() {
        List<ChunkState> chunks = ChunkPlanner.plan(1000, 100, 0, 64);
        for (var chunk : chunks) {
            assertEquals(0, chunk.getOffset() % 64);
        }
        assertEquals(1000, chunks.get(chunks.size() - 1).getEnd());
    }
}
