package cn.edu.bit.vaultsync.crypto;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * 先输出前缀（例如信封头），再输出经过 {@link PayloadCipher} 变换的源数据
 */
public class TransformingInputStream extends InputStream {
    private static final int READ_SIZE = 64 * 1024;

    private final InputStream source;
    private final PayloadCipher cipher;
    private final byte[] readBuffer = new byte[READ_SIZE];

    private byte[] pending;
    private int pendingOffset = 0;
    private boolean finished = false;

    public TransformingInputStream(InputStream source, byte[] prefix, PayloadCipher cipher) {
        this.source = source;
        this.cipher = cipher;
        this.pending = prefix == null ? new byte[0] : prefix.clone();
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int count = read(single, 0, 1);
        return count == -1 ? -1 : single[0] & 0xFF;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (length == 0) {
            return 0;
        }
        while (pendingOffset == pending.length) {
            if (finished) {
                return -1;
            }
            fill();
        }
        int count = Math.min(length, pending.length - pendingOffset);
        System.arraycopy(pending, pendingOffset, buffer, offset, count);
        pendingOffset += count;
        return count;
    }

    private void fill() throws IOException {
        int count = source.read(readBuffer, 0, readBuffer.length);
        if (count == -1) {
            pending = cipher.doFinal();
            finished = true;
        } else {
            pending = cipher.update(Arrays.copyOf(readBuffer, count));
        }
        pendingOffset = 0;
    }

    @Override
    public void close() throws IOException {
        source.close();
    }
}
