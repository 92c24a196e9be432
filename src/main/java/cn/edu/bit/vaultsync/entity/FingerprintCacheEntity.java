package cn.edu.bit.vaultsync.entity;

import cn.edu.bit.vaultsync.fingerprint.FileFingerprint;

/**
 * 秒传信息缓存记录
 * 对应数据库表: fingerprint_cache
 *
 * @param id          记录ID，未入库时为0
 * @param localPath   本地路径
 * @param remotePath  远端路径
 * @param userId      用户ID
 * @param userName    用户名
 * @param fingerprint 上传字节流（加密时为密文）的指纹
 * @param algorithm   上传时使用的加密算法名
 * @param localMtime  记录时本地文件的修改时间，秒
 * @param remoteMtime 远端文件的修改时间，秒
 * @param recordTime  记录时间，由数据库生成
 */
public record FingerprintCacheEntity(long id, String localPath, String remotePath, long userId, String userName,
        FileFingerprint fingerprint, String algorithm, long localMtime, long remoteMtime, String recordTime) {
}
