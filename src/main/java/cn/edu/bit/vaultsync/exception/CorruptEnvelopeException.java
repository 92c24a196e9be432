package cn.edu.bit.vaultsync.exception;

/**
 * 信封头被截断或格式错误
 */
public class CorruptEnvelopeException extends EnvelopeException {
    private static final long serialVersionUID = 1L;

    public CorruptEnvelopeException(String message) {
        super(message);
    }
}
