package cn.edu.bit.vaultsync.transfer;

import java.util.ArrayList;
import java.util.List;

/**
 * 把一段字节切分为固定大小的分块，最后一块可以更短
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    /**
     * 实际分块大小: min(期望大小, 远端上限)，向下取整到对齐单位，且至少为一个对齐单位
     */
    public static int effectiveChunkSize(long chunkSize, long maxChunkSize, int alignment) {
        long size = maxChunkSize > 0 ? Math.min(chunkSize, maxChunkSize) : chunkSize;
        size = Math.min(size, Integer.MAX_VALUE - alignment);
        size -= size % alignment;
        return (int) Math.max(size, alignment);
    }

    public static List<ChunkState> plan(long totalSize, long chunkSize, long maxChunkSize, int alignment) {
        return plan(totalSize, effectiveChunkSize(chunkSize, maxChunkSize, alignment));
    }

    /**
     * 按已确定的分块大小切分，长度为0时返回一个空分块
     */
    public static List<ChunkState> plan(long totalSize, int effectiveChunkSize) {
        if (totalSize < 0) {
            throw new IllegalArgumentException("Negative size: " + totalSize);
        }
        var chunks = new ArrayList<ChunkState>();
        if (totalSize == 0) {
            chunks.add(new ChunkState(0, 0, 0));
            return chunks;
        }
        long offset = 0;
        int index = 0;
        while (offset < totalSize) {
            int size = (int) Math.min(effectiveChunkSize, totalSize - offset);
            chunks.add(new ChunkState(index++, offset, size));
            offset += size;
        }
        return chunks;
    }
}
