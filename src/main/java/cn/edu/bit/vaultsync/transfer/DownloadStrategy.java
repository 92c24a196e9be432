package cn.edu.bit.vaultsync.transfer;

/**
 * 下载并发策略
 */
public enum DownloadStrategy {
    /** 一个文件的多个分块并行下载，适合少量大文件 */
    MULTI_CONNECTION,
    /** 多个文件并行下载，每个文件一个连接，适合大量小文件 */
    MULTI_FILE;

    /**
     * 文件数多于并发数且平均大小不超过一个分块时按文件并发
     */
    public static DownloadStrategy select(int fileCount, long totalBytes, int workers, long chunkSize) {
        if (fileCount <= workers || fileCount == 0) {
            return MULTI_CONNECTION;
        }
        long averageSize = totalBytes / fileCount;
        return averageSize <= chunkSize ? MULTI_FILE : MULTI_CONNECTION;
    }
}
