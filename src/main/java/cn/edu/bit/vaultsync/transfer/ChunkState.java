package cn.edu.bit.vaultsync.transfer;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一个分块的状态机
 *
 * <pre>
 * PENDING   -> IN_FLIGHT  tryClaim()
 * IN_FLIGHT -> DONE       markDone()
 * IN_FLIGHT -> FAILED     markFailed()，连续失败次数 +1
 * FAILED    -> IN_FLIGHT  retry()，由持有者在退避后调用
 * IN_FLIGHT / FAILED -> PENDING  revert()，暂停、恢复或重启时
 * </pre>
 *
 * 所有转换都是 CAS，同一时刻只有一个工作线程持有 IN_FLIGHT 状态。
 */
public final class ChunkState {
    private final int index;
    private final long offset;
    private final int size;
    private final AtomicReference<ChunkStatus> status = new AtomicReference<>(ChunkStatus.PENDING);

    private volatile int retryCount = 0;
    private volatile String token;

    private final AtomicInteger claimCount = new AtomicInteger();
    private final AtomicInteger owners = new AtomicInteger();
    private final AtomicInteger maxOwners = new AtomicInteger();

    public ChunkState(int index, long offset, int size) {
        this.index = index;
        this.offset = offset;
        this.size = size;
    }

    public int getIndex() {
        return index;
    }

    public long getOffset() {
        return offset;
    }

    public int getSize() {
        return size;
    }

    public long getEnd() {
        return offset + size;
    }

    public ChunkStatus getStatus() {
        return status.get();
    }

    public int getRetryCount() {
        return retryCount;
    }

    /**
     * 上传分块的远端凭证
     */
    public String getToken() {
        return token;
    }

    public boolean tryClaim() {
        if (status.compareAndSet(ChunkStatus.PENDING, ChunkStatus.IN_FLIGHT)) {
            claimCount.incrementAndGet();
            acquire();
            return true;
        }
        return false;
    }

    public boolean markDone(String chunkToken) {
        if (status.compareAndSet(ChunkStatus.IN_FLIGHT, ChunkStatus.DONE)) {
            token = chunkToken;
            retryCount = 0;
            owners.decrementAndGet();
            return true;
        }
        return false;
    }

    public boolean markFailed() {
        if (status.compareAndSet(ChunkStatus.IN_FLIGHT, ChunkStatus.FAILED)) {
            retryCount++;
            owners.decrementAndGet();
            return true;
        }
        return false;
    }

    public boolean retry() {
        if (status.compareAndSet(ChunkStatus.FAILED, ChunkStatus.IN_FLIGHT)) {
            acquire();
            return true;
        }
        return false;
    }

    /**
     * 回到 PENDING，未完成的分块不会被当作完成
     */
    public boolean revert() {
        if (status.compareAndSet(ChunkStatus.IN_FLIGHT, ChunkStatus.PENDING)) {
            owners.decrementAndGet();
            return true;
        }
        return status.compareAndSet(ChunkStatus.FAILED, ChunkStatus.PENDING);
    }

    /**
     * 从账本恢复，只在任务开始前调用
     */
    void restore(ChunkStatus restoredStatus, int restoredRetryCount, String restoredToken) {
        status.set(restoredStatus);
        retryCount = restoredRetryCount;
        token = restoredToken;
    }

    /**
     * 成功认领的次数
     */
    public int getClaimCount() {
        return claimCount.get();
    }

    /**
     * 同时持有该分块的工作线程数的历史最大值，正常情况下不超过1
     */
    public int getMaxConcurrentOwners() {
        return maxOwners.get();
    }

    private void acquire() {
        int current = owners.incrementAndGet();
        maxOwners.accumulateAndGet(current, Math::max);
    }

    @Override
    public String toString() {
        return "ChunkState{index=" + index + ", offset=" + offset + ", size=" + size + ", status=" + status.get()
                + ", retryCount=" + retryCount + '}';
    }
}
