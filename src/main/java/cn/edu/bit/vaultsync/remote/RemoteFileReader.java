package cn.edu.bit.vaultsync.remote;

import java.io.IOException;
import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.crypto.EncryptionEnvelope;
import cn.edu.bit.vaultsync.crypto.EnvelopeCodec;
import cn.edu.bit.vaultsync.crypto.PayloadCipher;
import cn.edu.bit.vaultsync.crypto.RandomAccessMode;
import cn.edu.bit.vaultsync.exception.RemoteException;

/**
 * 按明文偏移读取远端文件，加密文件边读边解密
 */
public class RemoteFileReader {
    private static final Logger logger = LoggerFactory.getLogger(RemoteFileReader.class);
    static final int BLOCK_SIZE = 64 * 1024;

    private final RemoteEndpoint endpoint;
    private final CipherSuite cipherSuite;
    private final RemoteFileInfo info;
    private final EncryptionEnvelope envelope;
    private final String secret;
    private final boolean decrypting;

    private RemoteFileReader(RemoteEndpoint endpoint, CipherSuite cipherSuite, RemoteFileInfo info,
            EncryptionEnvelope envelope, String secret) {
        this.endpoint = endpoint;
        this.cipherSuite = cipherSuite;
        this.info = info;
        this.envelope = envelope;
        this.secret = secret;
        this.decrypting = envelope.isEncrypted() && secret != null;
    }

    /**
     * 读取文件元数据和信封头
     *
     * @param secret 解密口令，null 时按原始字节读取
     * @throws RemoteException 文件不存在或是目录
     */
    public static RemoteFileReader open(RemoteEndpoint endpoint, CipherSuite cipherSuite, String path, String secret)
            throws IOException, RemoteException {
        RemoteFileInfo info = endpoint.stat(path)
                .orElseThrow(() -> new RemoteException(RemoteException.NOT_FOUND, "No such file: " + path));
        if (info.directory()) {
            throw new RemoteException(RemoteException.INVALID_ARGUMENT, "Not a file: " + path);
        }
        int headLength = (int) Math.min(EnvelopeCodec.MAX_HEADER_LENGTH, info.size());
        EncryptionEnvelope envelope = cipherSuite.readEnvelope(endpoint.readRange(path, 0, headLength));
        return new RemoteFileReader(endpoint, cipherSuite, info, envelope, secret);
    }

    public RemoteFileInfo info() {
        return info;
    }

    public EncryptionEnvelope envelope() {
        return envelope;
    }

    public boolean isDecrypting() {
        return decrypting;
    }

    /**
     * 读取得到的明文长度
     */
    public long plainLength() {
        return decrypting ? envelope.originalLength() : info.size();
    }

    /**
     * 顺序解密的文件只能从头读取
     */
    public boolean supportsRanges() {
        return !decrypting || envelope.algorithm().getRandomAccessMode() != RandomAccessMode.SEQUENTIAL;
    }

    /**
     * 打开一段明文
     *
     * @throws IllegalArgumentException 区间越界，或者对只支持顺序解密的文件指定了非零偏移
     */
    public InputStream openStream(long plainOffset, long length) {
        if (plainOffset < 0 || length < 0 || plainOffset + length > plainLength()) {
            throw new IllegalArgumentException(
                    "Range " + plainOffset + "+" + length + " outside of " + plainLength() + " bytes");
        }
        if (!supportsRanges() && plainOffset != 0) {
            throw new IllegalArgumentException(envelope.algorithm() + " files can only be read from the start");
        }
        if (!decrypting) {
            return new RangeStream(0, plainOffset, info.size(), 0, length, null);
        }
        long payloadStart = envelope.headerLength();
        long payloadLength = info.size() - payloadStart;
        PayloadCipher cipher = cipherSuite.openDecryptor(secret, envelope);
        long start = 0;
        if (envelope.algorithm().getRandomAccessMode() != RandomAccessMode.SEQUENTIAL) {
            int alignment = envelope.algorithm().getAlignment();
            start = plainOffset - plainOffset % alignment;
            cipher.seek(start);
        }
        logger.debug("Reading {} bytes of {} from plain offset {}", length, info.path(), plainOffset);
        return new RangeStream(payloadStart, start, payloadLength, plainOffset - start, length, cipher);
    }

    public InputStream openStream() {
        return openStream(0, plainLength());
    }

    private final class RangeStream extends InputStream {
        private final long payloadStart;
        private final long payloadEnd;
        private final PayloadCipher cipher;
        private long position;
        private long skip;
        private long remaining;
        private boolean finalized;
        private byte[] buffer = new byte[0];
        private int bufferPosition;

        RangeStream(long payloadStart, long position, long payloadEnd, long skip, long length, PayloadCipher cipher) {
            this.payloadStart = payloadStart;
            this.position = position;
            this.payloadEnd = payloadEnd;
            this.skip = skip;
            this.remaining = length;
            this.cipher = cipher;
            this.finalized = cipher == null;
        }

        @Override
        public int read() throws IOException {
            byte[] single = new byte[1];
            int n = read(single, 0, 1);
            return n < 0 ? -1 : single[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (remaining <= 0 || !fill()) {
                return -1;
            }
            int n = (int) Math.min(Math.min(len, buffer.length - bufferPosition), remaining);
            System.arraycopy(buffer, bufferPosition, b, off, n);
            bufferPosition += n;
            remaining -= n;
            return n;
        }

        private boolean fill() throws IOException {
            while (bufferPosition >= buffer.length) {
                byte[] output;
                if (position < payloadEnd) {
                    int size = (int) Math.min(BLOCK_SIZE, payloadEnd - position);
                    byte[] data;
                    try {
                        data = endpoint.readRange(info.path(), payloadStart + position, size);
                    } catch (RemoteException e) {
                        throw new IOException(e.getMessage(), e);
                    }
                    if (data.length == 0) {
                        throw new IOException("Unexpected end of " + info.path() + " at " + position);
                    }
                    position += data.length;
                    output = cipher == null ? data : cipher.update(data);
                } else if (!finalized) {
                    finalized = true;
                    output = cipher.doFinal();
                } else {
                    return false;
                }
                int dropped = (int) Math.min(skip, output.length);
                skip -= dropped;
                buffer = output;
                bufferPosition = dropped;
            }
            return true;
        }
    }
}
