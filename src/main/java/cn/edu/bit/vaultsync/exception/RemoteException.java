package cn.edu.bit.vaultsync.exception;

/**
 * 远端拒绝请求（配额、权限、路径不存在等）
 * 与网络层的 IOException 不同，这类错误不会重试
 */
public class RemoteException extends Exception {
    private static final long serialVersionUID = 1L;

    public static final int NOT_FOUND = 31066;
    public static final int QUOTA_EXCEEDED = 31112;
    public static final int PERMISSION_DENIED = 31062;
    public static final int ALREADY_EXISTS = 31061;
    public static final int INVALID_ARGUMENT = 31023;

    private final int errorCode;
    private final String remoteMessage;

    public RemoteException(int errorCode, String message) {
        super("[" + errorCode + "] " + message);
        this.errorCode = errorCode;
        this.remoteMessage = message;
    }

    public int getErrorCode() {
        return errorCode;
    }

    /**
     * 远端给出的原始说明，不带错误码前缀
     */
    public String getRemoteMessage() {
        return remoteMessage;
    }
}
