package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.fingerprint.FingerprintCache;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.remote.RemoteFileInfo;
import cn.edu.bit.vaultsync.session.AccountContext;
import io.netty.util.concurrent.DefaultThreadFactory;

/**
 * 传输调度器
 * <p>
 * 每个任务由一个 {@link TaskRunner} 执行，所有任务共享同一个线程池。
 * 同一个任务ID同时只能有一个活动任务，重复启动返回已有的句柄。
 */
public class TransferScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TransferScheduler.class);

    private final RemoteEndpoint endpoint;
    private final CipherSuite cipherSuite;
    private final ChunkLedger ledger;
    private final FingerprintCache fingerprintCache;
    private final TransferSettings settings;
    private final ExecutorService executor;

    private final Map<String, Active> active = new ConcurrentHashMap<>();

    private record Active(TransferHandle handle, TaskRunner runner) {
    }

    /**
     * @param fingerprintCache 可以为 null，此时每次上传都重新计算指纹
     */
    public TransferScheduler(RemoteEndpoint endpoint, CipherSuite cipherSuite, ChunkLedger ledger,
            FingerprintCache fingerprintCache, TransferSettings settings) {
        this.endpoint = endpoint;
        this.cipherSuite = cipherSuite;
        this.ledger = ledger;
        this.fingerprintCache = fingerprintCache;
        this.settings = settings;
        this.executor = Executors.newCachedThreadPool(new DefaultThreadFactory("vaultsync-transfer", true));
    }

    public TransferSettings getSettings() {
        return settings;
    }

    public TransferHandle start(TransferTask task) {
        return start(task, ProgressListener.NONE);
    }

    public TransferHandle start(TransferTask task, ProgressListener listener) {
        synchronized (active) {
            Active existing = active.get(task.getTaskId());
            if (existing != null) {
                logger.info("Task {} is already active", task.getTaskId());
                return existing.handle();
            }
            TaskRunner runner = newRunner(task, listener);
            var handle = new TransferHandle(task, runner.future());
            active.put(task.getTaskId(), new Active(handle, runner));
            runner.onFinish(() -> active.remove(task.getTaskId()));
            logger.info("Starting {} task {}: {} <-> {}", task.getDirection(), task.getTaskId(), task.getLocalPath(),
                    task.getRemotePath());
            runner.start();
            return handle;
        }
    }

    public void pause(TransferHandle handle) {
        runnerOf(handle).ifPresent(TaskRunner::pause);
    }

    public void resume(TransferHandle handle) {
        runnerOf(handle).ifPresent(TaskRunner::resume);
    }

    public void cancel(TransferHandle handle) {
        runnerOf(handle).ifPresent(TaskRunner::cancel);
    }

    /**
     * 当前活动（运行中或暂停）的任务
     */
    public List<TransferHandle> activeTasks() {
        List<TransferHandle> handles = new ArrayList<>();
        for (var entry : active.values()) {
            handles.add(entry.handle());
        }
        return Collections.unmodifiableList(handles);
    }

    /**
     * 依次上传多个文件，每个文件内部按配置的并发数传输分块；单个文件失败不影响其他文件
     */
    public CompletableFuture<BatchResult> uploadAll(AccountContext context, List<TransferRequest> requests,
            ProgressListener listener) {
        return CompletableFuture.supplyAsync(() -> {
            var collector = new BatchCollector();
            for (var request : requests) {
                TransferTask task = TransferTask.upload(context, request.localPath(), request.remotePath());
                collector.await(request.remotePath(), start(task, listener));
            }
            return collector.result();
        }, executor);
    }

    /**
     * 下载多个文件，根据文件数量和大小选择按分块并发还是按文件并发
     */
    public CompletableFuture<BatchResult> downloadAll(AccountContext context, List<TransferRequest> requests,
            ProgressListener listener) {
        return CompletableFuture.supplyAsync(() -> {
            long totalBytes = 0;
            for (var request : requests) {
                totalBytes += statSize(context.resolve(request.remotePath()));
            }
            DownloadStrategy strategy = DownloadStrategy.select(requests.size(), totalBytes,
                    settings.downloadConcurrency(), settings.chunkSize());
            logger.info("Downloading {} files ({} bytes) with strategy {}", requests.size(), totalBytes, strategy);

            var collector = new BatchCollector();
            if (strategy == DownloadStrategy.MULTI_CONNECTION) {
                for (var request : requests) {
                    TransferTask task = TransferTask.download(context, request.remotePath(), request.localPath());
                    collector.await(request.remotePath(), start(task, listener));
                }
                return collector.result();
            }

            var permits = new Semaphore(settings.downloadConcurrency());
            Map<String, TransferHandle> started = new LinkedHashMap<>();
            for (var request : requests) {
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CompletionException(e);
                }
                TransferTask task = TransferTask.download(context, request.remotePath(), request.localPath())
                        .withConcurrency(1);
                TransferHandle handle = start(task, listener);
                handle.future().whenComplete((result, error) -> permits.release());
                started.put(request.remotePath(), handle);
            }
            started.forEach(collector::await);
            return collector.result();
        }, executor);
    }

    public TransferHandle upload(AccountContext context, Path localPath, String remotePath, ProgressListener listener) {
        return start(TransferTask.upload(context, localPath, remotePath), listener);
    }

    public TransferHandle download(AccountContext context, String remotePath, Path localPath,
            ProgressListener listener) {
        return start(TransferTask.download(context, remotePath, localPath), listener);
    }

    @Override
    public void close() {
        for (var entry : active.values()) {
            entry.runner().pause();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Transfer workers did not stop in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private TaskRunner newRunner(TransferTask task, ProgressListener listener) {
        if (task.getDirection() == TransferDirection.UPLOAD) {
            int concurrency = task.getConcurrency() > 0 ? task.getConcurrency() : settings.uploadConcurrency();
            return new UploadRunner(task, endpoint, cipherSuite, ledger, fingerprintCache, settings, listener,
                    executor, concurrency);
        }
        int concurrency = task.getConcurrency() > 0 ? task.getConcurrency() : settings.downloadConcurrency();
        return new DownloadRunner(task, endpoint, cipherSuite, ledger, settings, listener, executor, concurrency);
    }

    private Optional<TaskRunner> runnerOf(TransferHandle handle) {
        Active entry = active.get(handle.taskId());
        if (entry == null) {
            logger.debug("Task {} is not active", handle.taskId());
            return Optional.empty();
        }
        return Optional.of(entry.runner());
    }

    private long statSize(String remotePath) {
        try {
            return endpoint.stat(remotePath).map(RemoteFileInfo::size).orElse(0L);
        } catch (IOException | RemoteException e) {
            logger.debug("Failed to stat {} while selecting strategy: {}", remotePath, e.getMessage());
            return 0;
        }
    }

    /**
     * 收集批量任务结果
     */
    private static final class BatchCollector {
        private final List<TransferResult> completed = new ArrayList<>();
        private final Map<String, Throwable> failures = new LinkedHashMap<>();

        void await(String remotePath, TransferHandle handle) {
            try {
                completed.add(handle.await());
            } catch (ExecutionException e) {
                failures.put(remotePath, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.put(remotePath, e);
            }
        }

        BatchResult result() {
            return new BatchResult(List.copyOf(completed), Collections.unmodifiableMap(failures));
        }
    }
}
