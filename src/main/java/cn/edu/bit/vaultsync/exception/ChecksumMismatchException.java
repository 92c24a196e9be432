package cn.edu.bit.vaultsync.exception;

/**
 * 传输完成后的校验不一致
 * 不会自动重传，由调用方决定是否重新上传/下载
 */
public class ChecksumMismatchException extends TransferException {
    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String actual;

    public ChecksumMismatchException(String taskId, String remotePath, String expected, String actual) {
        super(taskId, NO_CHUNK, remotePath, "Checksum mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
