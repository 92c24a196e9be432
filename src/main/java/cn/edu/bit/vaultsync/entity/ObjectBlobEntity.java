package cn.edu.bit.vaultsync.entity;

/**
 * 按内容去重的数据块
 * 对应数据库表: object_blob
 *
 * @param hash           内容 MD5，同时是数据文件名
 * @param sliceMd5       前 256 KiB 的 MD5，秒传时用于排除碰撞
 * @param size           字节数
 * @param referenceCount 引用该内容的文件节点数
 */
public record ObjectBlobEntity(String hash, String sliceMd5, long size, int referenceCount) {
}
