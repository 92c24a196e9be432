package cn.edu.bit.vaultsync.sync;

/**
 * 目录树中的一个文件
 *
 * @param relativePath 相对同步根目录的路径，使用 '/' 分隔
 * @param size         字节数（加密上传时为密文长度）
 * @param mtimeSeconds 修改时间，秒
 */
public record TreeEntry(String relativePath, long size, long mtimeSeconds) {
}
