package cn.edu.bit.vaultsync.remote;

/**
 * 远端文件元数据
 *
 * @param path         远端绝对路径
 * @param size         远端存储的字节数（加密文件为密文长度）
 * @param mtimeSeconds 修改时间，秒
 * @param directory    是否为目录
 * @param md5          远端记录的内容 MD5，未知时为 null
 */
public record RemoteFileInfo(String path, long size, long mtimeSeconds, boolean directory, String md5) {

    public String name() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
