package cn.edu.bit.vaultsync.exception;

import java.io.IOException;

/**
 * 加密信封相关错误的基类
 * 属于致命错误，不重试
 */
public class EnvelopeException extends IOException {
    private static final long serialVersionUID = 1L;

    public EnvelopeException(String message) {
        super(message);
    }

    public EnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
