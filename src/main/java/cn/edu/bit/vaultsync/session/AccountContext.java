package cn.edu.bit.vaultsync.session;

import cn.edu.bit.vaultsync.crypto.CipherAlgorithm;

/**
 * 一个账户的操作上下文，显式传给每个操作，不在账户之间共享
 *
 * @param userId        用户ID
 * @param userName      用户名
 * @param workingDir    远端当前目录
 * @param secret        加密口令，null 表示不加密
 * @param algorithm     上传使用的加密算法
 * @param formatVersion 新建信封的格式版本
 */
public record AccountContext(long userId, String userName, String workingDir, String secret,
        CipherAlgorithm algorithm, int formatVersion) {

    public static AccountContext plain(long userId, String userName) {
        return new AccountContext(userId, userName, "/", null, CipherAlgorithm.NONE, 0);
    }

    public boolean encrypts() {
        return secret != null && algorithm.isEncrypted();
    }

    public AccountContext withWorkingDir(String newWorkingDir) {
        return new AccountContext(userId, userName, newWorkingDir, secret, algorithm, formatVersion);
    }

    /**
     * 把相对路径解析为远端绝对路径
     */
    public String resolve(String path) {
        if (path.startsWith("/")) {
            return path;
        }
        String base = workingDir.endsWith("/") ? workingDir : workingDir + "/";
        return base + path;
    }

    @Override
    public String toString() {
        return "AccountContext{userId=" + userId + ", userName='" + userName + "', workingDir='" + workingDir
                + "', secret=" + (secret == null ? "none" : "******") + ", algorithm=" + algorithm
                + ", formatVersion=" + formatVersion + '}';
    }
}
