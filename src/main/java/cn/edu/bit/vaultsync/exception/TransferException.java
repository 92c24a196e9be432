package cn.edu.bit.vaultsync.exception;

/**
 * 传输任务失败
 * 携带任务ID、分块序号和远端路径，便于调用方恢复或重新发起
 */
public class TransferException extends Exception {
    private static final long serialVersionUID = 1L;

    public static final int NO_CHUNK = -1;

    private final String taskId;
    private final int chunkIndex;
    private final String remotePath;

    public TransferException(String taskId, int chunkIndex, String remotePath, String message) {
        super(message);
        this.taskId = taskId;
        this.chunkIndex = chunkIndex;
        this.remotePath = remotePath;
    }

    public TransferException(String taskId, int chunkIndex, String remotePath, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.chunkIndex = chunkIndex;
        this.remotePath = remotePath;
    }

    public String getTaskId() {
        return taskId;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public String getRemotePath() {
        return remotePath;
    }

    @Override
    public String getMessage() {
        var builder = new StringBuilder(super.getMessage());
        builder.append(" [task=").append(taskId);
        if (chunkIndex != NO_CHUNK) {
            builder.append(", chunk=").append(chunkIndex);
        }
        builder.append(", remote=").append(remotePath).append(']');
        return builder.toString();
    }
}
