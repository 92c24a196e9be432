package cn.edu.bit.vaultsync.transfer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 调用方持有的任务句柄
 * 任务完成或取消时 future 正常结束，失败时以 {@link cn.edu.bit.vaultsync.exception.TransferException} 异常结束；
 * 暂停不会结束 future
 */
public final class TransferHandle {
    private final TransferTask task;
    private final CompletableFuture<TransferResult> future;

    TransferHandle(TransferTask task, CompletableFuture<TransferResult> future) {
        this.task = task;
        this.future = future;
    }

    public TransferTask task() {
        return task;
    }

    public String taskId() {
        return task.getTaskId();
    }

    public TaskStatus status() {
        return task.getStatus();
    }

    public CompletableFuture<TransferResult> future() {
        return future;
    }

    /**
     * 等待任务结束
     *
     * @throws ExecutionException 任务失败，cause 为 TransferException
     */
    public TransferResult await() throws InterruptedException, ExecutionException {
        return future.get();
    }
}
