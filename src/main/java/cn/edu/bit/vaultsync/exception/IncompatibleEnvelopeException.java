package cn.edu.bit.vaultsync.exception;

/**
 * 读取端版本不接受该信封版本（例如版本3读取端遇到版本2信封）
 */
public class IncompatibleEnvelopeException extends EnvelopeException {
    private static final long serialVersionUID = 1L;

    private final int envelopeVersion;
    private final int readerVersion;

    public IncompatibleEnvelopeException(int envelopeVersion, int readerVersion) {
        super("Envelope format version " + envelopeVersion + " cannot be read by a version " + readerVersion
                + " reader");
        this.envelopeVersion = envelopeVersion;
        this.readerVersion = readerVersion;
    }

    public int getEnvelopeVersion() {
        return envelopeVersion;
    }

    public int getReaderVersion() {
        return readerVersion;
    }
}
