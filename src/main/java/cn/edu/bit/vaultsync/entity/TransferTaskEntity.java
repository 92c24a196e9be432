package cn.edu.bit.vaultsync.entity;

/**
 * 断点续传任务记录
 * 对应数据库表: transfer_task
 *
 * @param taskId      任务ID
 * @param direction   UPLOAD / DOWNLOAD
 * @param localPath   本地路径
 * @param remotePath  远端路径
 * @param totalSize   源文件大小（上传为本地文件，下载为远端文件）
 * @param chunkSize   分块大小
 * @param envelope    上传时使用的信封头，未加密为空数组
 * @param sourceMtime 源文件修改时间，秒
 */
public record TransferTaskEntity(String taskId, String direction, String localPath, String remotePath,
        long totalSize, long chunkSize, byte[] envelope, long sourceMtime) {
}
