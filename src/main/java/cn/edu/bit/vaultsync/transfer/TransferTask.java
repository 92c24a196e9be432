package cn.edu.bit.vaultsync.transfer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import cn.edu.bit.vaultsync.session.AccountContext;
import cn.edu.bit.vaultsync.utils.HexUtils;

/**
 * 一个上传或下载任务
 * 生命周期内只由 {@link TransferScheduler} 修改
 */
public final class TransferTask {
    private final String taskId;
    private final TransferDirection direction;
    private final Path localPath;
    private final String remotePath;
    private final AccountContext context;
    private volatile int concurrency;

    private final AtomicReference<TaskStatus> status = new AtomicReference<>(TaskStatus.PENDING);
    private final AtomicBoolean pauseRequested = new AtomicBoolean();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicLong bytesDone = new AtomicLong();

    private volatile long totalSize = -1;
    private volatile List<ChunkState> chunks = List.of();

    private TransferTask(TransferDirection direction, Path localPath, String remotePath, AccountContext context) {
        this.direction = direction;
        this.localPath = localPath.toAbsolutePath().normalize();
        this.remotePath = context.resolve(remotePath);
        this.context = context;
        this.taskId = taskId(direction, this.localPath, this.remotePath, context.userId());
    }

    public static TransferTask upload(AccountContext context, Path localPath, String remotePath) {
        return new TransferTask(TransferDirection.UPLOAD, localPath, remotePath, context);
    }

    public static TransferTask download(AccountContext context, String remotePath, Path localPath) {
        return new TransferTask(TransferDirection.DOWNLOAD, localPath, remotePath, context);
    }

    /**
     * 任务ID: SHA-1(direction|local|remote|user)，同一文件的任务重启后ID不变
     */
    public static String taskId(TransferDirection direction, Path localPath, String remotePath, long userId) {
        String key = direction + "|" + localPath + "|" + remotePath + "|" + userId;
        try {
            return HexUtils.bytesToHex(MessageDigest.getInstance("SHA-1").digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not found", e);
        }
    }

    public String getTaskId() {
        return taskId;
    }

    public TransferDirection getDirection() {
        return direction;
    }

    public Path getLocalPath() {
        return localPath;
    }

    public String getRemotePath() {
        return remotePath;
    }

    public AccountContext getContext() {
        return context;
    }

    /**
     * 0 表示使用调度器配置的并发数
     */
    public int getConcurrency() {
        return concurrency;
    }

    public TransferTask withConcurrency(int newConcurrency) {
        this.concurrency = newConcurrency;
        return this;
    }

    public TaskStatus getStatus() {
        return status.get();
    }

    void setStatus(TaskStatus newStatus) {
        status.set(newStatus);
    }

    boolean compareAndSetStatus(TaskStatus expected, TaskStatus newStatus) {
        return status.compareAndSet(expected, newStatus);
    }

    AtomicBoolean pauseFlag() {
        return pauseRequested;
    }

    AtomicBoolean cancelFlag() {
        return cancelRequested;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isPauseRequested() {
        return pauseRequested.get();
    }

    public long getBytesDone() {
        return bytesDone.get();
    }

    AtomicLong bytesDoneCounter() {
        return bytesDone;
    }

    /**
     * 分块覆盖的总字节数，开始传输前为 -1
     */
    public long getTotalSize() {
        return totalSize;
    }

    void setTotalSize(long size) {
        this.totalSize = size;
    }

    public List<ChunkState> getChunks() {
        return chunks;
    }

    void setChunks(List<ChunkState> plannedChunks) {
        this.chunks = List.copyOf(plannedChunks);
    }

    @Override
    public String toString() {
        return "TransferTask{" + direction + ' ' + localPath + " <-> " + remotePath + ", id=" + taskId + ", status="
                + status.get() + '}';
    }
}
