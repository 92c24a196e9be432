package cn.edu.bit.vaultsync.transfer;

import java.nio.file.Path;

/**
 * @param taskId            任务ID
 * @param direction         方向
 * @param localPath         本地路径
 * @param remotePath        远端路径
 * @param status            COMPLETED 或 CANCELLED
 * @param totalBytes        总字节数：上传为写入远端的字节数（加密时为密文），下载为落盘的明文字节数
 * @param chunksTransferred 本次运行实际传输的分块数，秒传为0
 * @param rapidUploaded     是否走了秒传
 */
public record TransferResult(String taskId, TransferDirection direction, Path localPath, String remotePath,
        TaskStatus status, long totalBytes, int chunksTransferred, boolean rapidUploaded) {
}
