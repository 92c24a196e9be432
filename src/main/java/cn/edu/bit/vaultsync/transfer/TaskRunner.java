package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.exception.ChunkExhaustedException;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.exception.TransferException;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;

/**
 * 单个任务的执行器
 * <p>
 * 任务以"轮"为单位运行：每轮启动若干工作线程，它们在分块边界检查暂停/取消标志，
 * 依次认领 PENDING 分块。最后一个工作线程退出时结束本轮，根据失败、取消、完成、暂停
 * 决定任务状态；仍有未完成分块时开始新的一轮。
 */
abstract class TaskRunner {
    private static final Logger logger = LoggerFactory.getLogger(TaskRunner.class);

    protected final TransferTask task;
    protected final RemoteEndpoint endpoint;
    protected final CipherSuite cipherSuite;
    protected final ChunkLedger ledger;
    protected final TransferSettings settings;
    private final ProgressListener listener;
    private final Executor executor;
    private final int concurrency;

    private final CompletableFuture<TransferResult> future = new CompletableFuture<>();
    private final AtomicReference<TransferException> failure = new AtomicReference<>();
    private final AtomicInteger chunksTransferred = new AtomicInteger();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final Object lifecycleLock = new Object();
    private boolean roundActive = false; // guarded by lifecycleLock
    private volatile Runnable onFinish = () -> {
    };

    TaskRunner(TransferTask task, RemoteEndpoint endpoint, CipherSuite cipherSuite, ChunkLedger ledger,
            TransferSettings settings, ProgressListener listener, Executor executor, int concurrency) {
        this.task = task;
        this.endpoint = endpoint;
        this.cipherSuite = cipherSuite;
        this.ledger = ledger;
        this.settings = settings;
        this.listener = listener;
        this.executor = executor;
        this.concurrency = concurrency;
    }

    /**
     * 准备任务：规划或恢复分块
     *
     * @return false 表示任务已经在准备阶段完成（例如秒传），不需要传输分块
     */
    protected abstract boolean prepare() throws TransferException;

    /**
     * 每轮开始前调用
     */
    protected void beforeRound() throws TransferException {
    }

    /**
     * 传输一个已认领的分块；成功时负责把分块标记为 DONE（可以交给其他组件稍后完成）
     */
    protected abstract void transferChunk(ChunkState chunk) throws IOException, RemoteException,
            InterruptedException;

    /**
     * 所有分块完成后调用，完成合并/改名等收尾工作
     *
     * @return false 表示分块已被重新规划，需要再传输一轮
     */
    protected abstract boolean finish() throws TransferException;

    /**
     * 释放资源；cancelled 为 true 时同时删除未完成的数据
     */
    protected abstract void cleanup(boolean cancelled);

    protected boolean isRapidUploaded() {
        return false;
    }

    CompletableFuture<TransferResult> future() {
        return future;
    }

    void onFinish(Runnable callback) {
        this.onFinish = callback;
    }

    void start() {
        task.setStatus(TaskStatus.RUNNING);
        executor.execute(() -> {
            try {
                if (prepare()) {
                    startRound();
                } else {
                    complete();
                }
            } catch (TransferException e) {
                finishFailure(e);
            } catch (RuntimeException e) {
                finishFailure(new TransferException(task.getTaskId(), TransferException.NO_CHUNK,
                        task.getRemotePath(), "Failed to prepare transfer", e));
            }
        });
    }

    void pause() {
        synchronized (lifecycleLock) {
            if (task.getStatus() == TaskStatus.RUNNING) {
                task.pauseFlag().set(true);
                logger.info("Pause requested for task {}", task.getTaskId());
            }
        }
    }

    void resume() {
        synchronized (lifecycleLock) {
            task.pauseFlag().set(false);
            if (task.getStatus() != TaskStatus.PAUSED || roundActive) {
                return;
            }
            revertUnfinished();
            task.setStatus(TaskStatus.RUNNING);
            logger.info("Resuming task {}", task.getTaskId());
        }
        executor.execute(this::startRound);
    }

    void cancel() {
        synchronized (lifecycleLock) {
            task.cancelFlag().set(true);
            logger.info("Cancel requested for task {}", task.getTaskId());
            if (task.getStatus() == TaskStatus.PAUSED && !roundActive) {
                finishCancel();
            }
        }
    }

    private void startRound() {
        synchronized (lifecycleLock) {
            if (task.isCancelRequested()) {
                finishCancel();
                return;
            }
            if (task.isPauseRequested()) {
                revertUnfinished();
                task.setStatus(TaskStatus.PAUSED);
                return;
            }
            roundActive = true;
        }
        try {
            beforeRound();
        } catch (TransferException e) {
            failure.compareAndSet(null, e);
            roundEnded();
            return;
        }

        long unfinished = task.getChunks().stream().filter(chunk -> chunk.getStatus() != ChunkStatus.DONE).count();
        int workers = (int) Math.min(concurrency, unfinished);
        if (workers == 0) {
            roundEnded();
            return;
        }
        logger.debug("Task {} starting round with {} workers for {} chunks", task.getTaskId(), workers, unfinished);
        var remaining = new AtomicInteger(workers);
        for (int i = 0; i < workers; i++) {
            executor.execute(() -> {
                try {
                    workerLoop();
                } finally {
                    if (remaining.decrementAndGet() == 0) {
                        roundEnded();
                    }
                }
            });
        }
    }

    private void workerLoop() {
        while (!shouldStop()) {
            ChunkState chunk = claimNext();
            if (chunk == null) {
                return;
            }
            processWithRetry(chunk);
        }
    }

    /**
     * 在分块边界检查的停止条件
     */
    protected boolean shouldStop() {
        return task.isCancelRequested() || task.isPauseRequested() || failure.get() != null
                || Thread.currentThread().isInterrupted();
    }

    private ChunkState claimNext() {
        for (var chunk : task.getChunks()) {
            if (chunk.tryClaim()) {
                return chunk;
            }
        }
        return null;
    }

    private void processWithRetry(ChunkState chunk) {
        while (true) {
            try {
                transferChunk(chunk);
                return;
            } catch (RemoteException e) {
                chunk.revert();
                fail(new TransferException(task.getTaskId(), chunk.getIndex(), task.getRemotePath(),
                        "Remote rejected chunk: " + e.getMessage(), e));
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (IOException e) {
                if (!chunk.markFailed()) {
                    return;
                }
                int attempts = chunk.getRetryCount();
                try {
                    ledger.recordFailed(task.getTaskId(), chunk);
                } catch (RuntimeException ledgerError) {
                    fail(new TransferException(task.getTaskId(), chunk.getIndex(), task.getRemotePath(),
                            "Failed to record chunk failure", ledgerError));
                    return;
                }
                if (attempts >= settings.maxRetries()) {
                    fail(new ChunkExhaustedException(task.getTaskId(), chunk.getIndex(), task.getRemotePath(),
                            attempts, e));
                    return;
                }
                Duration delay = settings.backoff(attempts);
                logger.warn("Chunk {} of task {} failed (attempt {}/{}), retrying in {} ms: {}", chunk.getIndex(),
                        task.getTaskId(), attempts, settings.maxRetries(), delay.toMillis(), e.getMessage());
                if (!sleep(delay) || shouldStop() || !chunk.retry()) {
                    return;
                }
            } catch (RuntimeException e) {
                chunk.revert();
                fail(new TransferException(task.getTaskId(), chunk.getIndex(), task.getRemotePath(),
                        "Chunk transfer failed: " + e.getMessage(), e));
                return;
            }
        }
    }

    /**
     * 分块传输成功后调用：标记 DONE、写账本、报告进度
     */
    protected void markDone(ChunkState chunk, String token) {
        if (!chunk.markDone(token)) {
            throw new IllegalStateException("Chunk " + chunk.getIndex() + " was not in flight");
        }
        ledger.recordDone(task.getTaskId(), chunk);
        chunksTransferred.incrementAndGet();
        long done = task.bytesDoneCounter().addAndGet(progressBytes(chunk));
        report(new ProgressEvent(task.getTaskId(), done, task.getTotalSize(), chunk.getIndex()));
    }

    protected void report(ProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            logger.warn("Progress listener failed for task {}", task.getTaskId(), e);
        }
    }

    protected void fail(TransferException error) {
        if (failure.compareAndSet(null, error)) {
            logger.error("Task {} failed: {}", task.getTaskId(), error.getMessage());
        }
    }

    private void roundEnded() {
        boolean completed;
        synchronized (lifecycleLock) {
            roundActive = false;
            TransferException error = failure.get();
            if (error != null) {
                finishFailure(error);
                return;
            }
            if (task.isCancelRequested()) {
                finishCancel();
                return;
            }
            completed = allDone();
            if (!completed && task.isPauseRequested()) {
                revertUnfinished();
                task.setStatus(TaskStatus.PAUSED);
                logger.info("Task {} paused at {}/{} bytes", task.getTaskId(), task.getBytesDone(),
                        task.getTotalSize());
                return;
            }
            if (!completed) {
                revertUnfinished();
            }
        }
        if (completed) {
            try {
                if (finish()) {
                    complete();
                } else {
                    executor.execute(this::startRound);
                }
            } catch (TransferException e) {
                finishFailure(e);
            } catch (RuntimeException e) {
                finishFailure(new TransferException(task.getTaskId(), TransferException.NO_CHUNK,
                        task.getRemotePath(), "Failed to finish transfer", e));
            }
        } else {
            executor.execute(this::startRound);
        }
    }

    private boolean allDone() {
        return task.getChunks().stream().allMatch(chunk -> chunk.getStatus() == ChunkStatus.DONE);
    }

    private void revertUnfinished() {
        for (var chunk : task.getChunks()) {
            chunk.revert();
        }
    }

    private void complete() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        task.setStatus(TaskStatus.COMPLETED);
        cleanup(false);
        try {
            ledger.remove(task.getTaskId());
        } catch (RuntimeException e) {
            logger.warn("Failed to remove ledger of completed task {}", task.getTaskId(), e);
        }
        logger.info("Task {} completed: {} -> {}", task.getTaskId(), task.getLocalPath(), task.getRemotePath());
        onFinish.run();
        future.complete(result(TaskStatus.COMPLETED));
    }

    private void finishCancel() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        task.setStatus(TaskStatus.CANCELLED);
        cleanup(true);
        try {
            ledger.remove(task.getTaskId());
        } catch (RuntimeException e) {
            logger.warn("Failed to remove ledger of cancelled task {}", task.getTaskId(), e);
        }
        logger.info("Task {} cancelled", task.getTaskId());
        onFinish.run();
        future.complete(result(TaskStatus.CANCELLED));
    }

    private void finishFailure(TransferException error) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        task.setStatus(TaskStatus.FAILED);
        revertUnfinished();
        cleanup(false);
        onFinish.run();
        future.completeExceptionally(error);
    }

    private TransferResult result(TaskStatus status) {
        return new TransferResult(task.getTaskId(), task.getDirection(), task.getLocalPath(), task.getRemotePath(),
                status, task.getTotalSize(), chunksTransferred.get(), isRapidUploaded());
    }

    /**
     * 对非分块的远端调用做同样的退避重试
     */
    protected <T> T withRetries(String action, RemoteCall<T> call) throws TransferException {
        int attempts = 0;
        while (true) {
            try {
                return call.call();
            } catch (RemoteException e) {
                throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, task.getRemotePath(),
                        action + " rejected: " + e.getMessage(), e);
            } catch (IOException e) {
                attempts++;
                if (attempts >= settings.maxRetries()) {
                    throw new ChunkExhaustedException(task.getTaskId(), TransferException.NO_CHUNK,
                            task.getRemotePath(), attempts, e);
                }
                logger.warn("{} failed for task {} (attempt {}/{}): {}", action, task.getTaskId(), attempts,
                        settings.maxRetries(), e.getMessage());
                if (!sleep(settings.backoff(attempts))) {
                    throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, task.getRemotePath(),
                            action + " interrupted", e);
                }
            }
        }
    }

    @FunctionalInterface
    protected interface RemoteCall<T> {
        T call() throws IOException, RemoteException;
    }

    protected long sumDone(List<ChunkState> chunks) {
        return chunks.stream().filter(chunk -> chunk.getStatus() == ChunkStatus.DONE)
                .mapToLong(this::progressBytes).sum();
    }

    /**
     * 分块完成时计入进度的字节数
     */
    protected long progressBytes(ChunkState chunk) {
        return chunk.getSize();
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
