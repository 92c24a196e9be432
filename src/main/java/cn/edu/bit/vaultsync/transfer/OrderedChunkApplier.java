package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import cn.edu.bit.vaultsync.crypto.PayloadCipher;

/**
 * 顺序解密：分块可以并行下载，但解密和写入严格按分块顺序进行
 * <p>
 * 下载好的分块先放入缓冲区，提交了下一个待写分块的线程负责把连续就绪的分块依次解密写入。
 * 工作线程最多领先 window 个分块，避免缓冲区无限增长。
 */
class OrderedChunkApplier {
    private static final long WAIT_MILLIS = 100;

    private final List<ChunkState> chunks;
    private final PayloadCipher cipher;
    private final FileChannel channel;
    private final int window;
    private final BooleanSupplier stopped;
    private final Consumer<ChunkState> onApplied;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition advanced = lock.newCondition();
    private final Map<Integer, byte[]> ready = new HashMap<>();
    private int nextIndex;
    private long writePosition;

    /**
     * @param firstIndex 第一个未完成的分块，之前的分块都已写入
     * @param cipher     已经定位到 firstIndex 分块起点的解密器
     */
    OrderedChunkApplier(List<ChunkState> chunks, int firstIndex, PayloadCipher cipher, FileChannel channel,
            int window, BooleanSupplier stopped, Consumer<ChunkState> onApplied) {
        this.chunks = chunks;
        this.cipher = cipher;
        this.channel = channel;
        this.window = window;
        this.stopped = stopped;
        this.onApplied = onApplied;
        this.nextIndex = firstIndex;
        this.writePosition = firstIndex < chunks.size() ? chunks.get(firstIndex).getOffset() : 0;
    }

    /**
     * 等待分块进入窗口
     *
     * @return false 表示任务已停止，不应再下载
     */
    boolean awaitSlot(int index) throws InterruptedException {
        lock.lock();
        try {
            while (index >= nextIndex + window) {
                if (stopped.getAsBoolean()) {
                    return false;
                }
                advanced.await(WAIT_MILLIS, TimeUnit.MILLISECONDS);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 提交下载好的密文，并写入所有已经连续就绪的分块
     *
     * @throws UncheckedIOException 本地写入失败，任务无法继续
     */
    void submit(ChunkState chunk, byte[] ciphertext) {
        lock.lock();
        try {
            ready.put(chunk.getIndex(), ciphertext);
            while (nextIndex < chunks.size() && ready.containsKey(nextIndex)) {
                ChunkState current = chunks.get(nextIndex);
                byte[] plain = cipher.update(ready.remove(nextIndex));
                write(plain);
                if (nextIndex == chunks.size() - 1) {
                    write(cipher.doFinal());
                }
                nextIndex++;
                onApplied.accept(current);
                advanced.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    int getNextIndex() {
        lock.lock();
        try {
            return nextIndex;
        } finally {
            lock.unlock();
        }
    }

    private void write(byte[] data) {
        var buffer = ByteBuffer.wrap(data);
        try {
            while (buffer.hasRemaining()) {
                writePosition += channel.write(buffer, writePosition);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write decrypted chunk", e);
        }
    }
}
