package cn.edu.bit.vaultsync.transfer;

import java.time.Duration;

/**
 * 传输参数
 *
 * @param chunkSize           期望的分块大小，实际大小还受远端上限和加密对齐约束
 * @param uploadConcurrency   上传时每个任务的并发分块数
 * @param downloadConcurrency 下载时的并发连接数（或并发文件数）
 * @param maxRetries          单个分块连续失败的上限
 * @param initialBackoff      第一次重试前的等待时间
 * @param maxBackoff          重试等待时间上限
 * @param rapidUpload         是否先尝试秒传
 * @param verifyChecksum      传输完成后是否校验 MD5
 * @param applierWindow       顺序解密时允许提前下载的分块数
 */
public record TransferSettings(long chunkSize, int uploadConcurrency, int downloadConcurrency, int maxRetries,
        Duration initialBackoff, Duration maxBackoff, boolean rapidUpload, boolean verifyChecksum,
        int applierWindow) {

    public TransferSettings {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (uploadConcurrency <= 0 || downloadConcurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        if (applierWindow <= 0) {
            throw new IllegalArgumentException("applierWindow must be positive");
        }
    }

    public static TransferSettings defaults() {
        return new TransferSettings(4L * 1024 * 1024, 4, 4, 5, Duration.ofMillis(500), Duration.ofSeconds(30), true,
                false, 8);
    }

    /**
     * 第 attempt 次失败后的等待时间: min(initial * 2^(attempt-1), max)
     */
    public Duration backoff(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        long initialMillis = initialBackoff.toMillis();
        long maxMillis = maxBackoff.toMillis();
        int shift = Math.min(attempt - 1, 30);
        long delay = initialMillis > (maxMillis >> shift) ? maxMillis : initialMillis << shift;
        return Duration.ofMillis(Math.min(delay, maxMillis));
    }

    public TransferSettings withChunkSize(long newChunkSize) {
        return new TransferSettings(newChunkSize, uploadConcurrency, downloadConcurrency, maxRetries,
                initialBackoff, maxBackoff, rapidUpload, verifyChecksum, applierWindow);
    }

    public TransferSettings withConcurrency(int upload, int download) {
        return new TransferSettings(chunkSize, upload, download, maxRetries, initialBackoff, maxBackoff,
                rapidUpload, verifyChecksum, applierWindow);
    }

    public TransferSettings withRapidUpload(boolean enabled) {
        return new TransferSettings(chunkSize, uploadConcurrency, downloadConcurrency, maxRetries, initialBackoff,
                maxBackoff, enabled, verifyChecksum, applierWindow);
    }

    public TransferSettings withVerifyChecksum(boolean enabled) {
        return new TransferSettings(chunkSize, uploadConcurrency, downloadConcurrency, maxRetries, initialBackoff,
                maxBackoff, rapidUpload, enabled, applierWindow);
    }

    public TransferSettings withRetries(int retries, Duration initial, Duration max) {
        return new TransferSettings(chunkSize, uploadConcurrency, downloadConcurrency, retries, initial, max,
                rapidUpload, verifyChecksum, applierWindow);
    }
}
