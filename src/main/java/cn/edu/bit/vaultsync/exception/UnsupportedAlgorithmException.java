package cn.edu.bit.vaultsync.exception;

/**
 * 信封中的算法ID无法识别
 */
public class UnsupportedAlgorithmException extends EnvelopeException {
    private static final long serialVersionUID = 1L;

    private final int algorithmId;

    public UnsupportedAlgorithmException(int algorithmId) {
        super(String.format("Unsupported encryption algorithm id: 0x%02x", algorithmId));
        this.algorithmId = algorithmId;
    }

    public int getAlgorithmId() {
        return algorithmId;
    }
}
