package cn.edu.bit.vaultsync.transfer;

/**
 * @param taskId     任务ID
 * @param bytesDone  已完成字节数
 * @param bytesTotal 总字节数
 * @param chunkIndex 刚完成的分块序号，秒传时为 -1
 */
public record ProgressEvent(String taskId, long bytesDone, long bytesTotal, int chunkIndex) {
}
