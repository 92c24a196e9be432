package cn.edu.bit.vaultsync.remote;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.fingerprint.FileFingerprint;

/**
 * 传输引擎使用的远端存储接口
 * <p>
 * 网络/传输层的临时错误抛出 {@link IOException}，会被重试；
 * 远端明确拒绝的请求（配额、权限、不存在）抛出 {@link RemoteException}，不会重试。
 * 实现必须是线程安全的，同一个任务的多个分块会并发调用。
 */
public interface RemoteEndpoint {

    Optional<RemoteFileInfo> stat(String path) throws IOException, RemoteException;

    /**
     * 列出目录的直接子节点
     */
    List<RemoteFileInfo> list(String directory) throws IOException, RemoteException;

    /**
     * 服务端允许的单个分块最大字节数
     */
    long maxChunkSize();

    /**
     * 上传一个分块
     *
     * @return 分块凭证，合并时按顺序传回
     */
    String uploadChunk(String remotePath, int chunkIndex, byte[] data) throws IOException, RemoteException;

    /**
     * 按顺序合并分块，创建或覆盖远端文件，缺失的父目录自动创建
     */
    RemoteFileInfo combineChunks(String remotePath, List<String> tokens, long mtimeSeconds)
            throws IOException, RemoteException;

    /**
     * 秒传：远端已有相同内容时直接登记文件
     *
     * @return 远端不认识该内容时返回空
     */
    Optional<RemoteFileInfo> rapidUpload(String remotePath, FileFingerprint fingerprint, long mtimeSeconds)
            throws IOException, RemoteException;

    /**
     * 读取远端文件的一段字节，超出文件末尾的部分不返回
     */
    byte[] readRange(String path, long offset, int length) throws IOException, RemoteException;

    /**
     * 删除文件或目录（递归）
     */
    void delete(String path) throws IOException, RemoteException;
}
