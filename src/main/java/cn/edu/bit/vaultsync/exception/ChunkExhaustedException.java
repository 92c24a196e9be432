package cn.edu.bit.vaultsync.exception;

/**
 * 分块连续失败次数达到上限
 */
public class ChunkExhaustedException extends TransferException {
    private static final long serialVersionUID = 1L;

    private final int attempts;

    public ChunkExhaustedException(String taskId, int chunkIndex, String remotePath, int attempts, Throwable cause) {
        super(taskId, chunkIndex, remotePath, "Chunk failed " + attempts + " consecutive times", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
