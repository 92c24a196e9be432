package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.crypto.EncryptionEnvelope;
import cn.edu.bit.vaultsync.crypto.KeyMaterial;
import cn.edu.bit.vaultsync.crypto.PayloadCipher;
import cn.edu.bit.vaultsync.crypto.TransformingInputStream;

/**
 * 支持随机访问的算法逐块加密上传
 * <p>
 * 每个分块独立创建加密器并 seek 到所在位置；对齐要求大于1时从对齐位置开始加密并丢弃前导字节。
 * 信封头按普通字节处理，可能落在第一个分块内。
 */
class EncryptedUploadSource implements UploadSource {
    private final Path path;
    private final FileChannel channel;
    private final CipherSuite cipherSuite;
    private final EncryptionEnvelope envelope;
    private final KeyMaterial keys;
    private final byte[] header;
    private final long payloadLength;
    private final int alignment;

    EncryptedUploadSource(Path path, CipherSuite cipherSuite, EncryptionEnvelope envelope, KeyMaterial keys)
            throws IOException {
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
        this.cipherSuite = cipherSuite;
        this.envelope = envelope;
        this.keys = keys;
        this.header = envelope.toBytes();
        this.payloadLength = channel.size();
        this.alignment = envelope.algorithm().getAlignment();
    }

    @Override
    public long length() {
        return header.length + payloadLength;
    }

    @Override
    public byte[] read(long offset, int size) throws IOException {
        byte[] output = new byte[size];
        int written = 0;
        long position = offset;
        if (position < header.length) {
            int headerBytes = (int) Math.min(size, header.length - position);
            System.arraycopy(header, (int) position, output, 0, headerBytes);
            written += headerBytes;
            position += headerBytes;
        }
        if (written == size) {
            return output;
        }
        long payloadStart = position - header.length;
        long alignedStart = payloadStart - payloadStart % alignment;
        int lead = (int) (payloadStart - alignedStart);
        byte[] plain = PlainUploadSource.readFully(channel, alignedStart, lead + size - written);

        PayloadCipher cipher = cipherSuite.newEncryptor(envelope, keys);
        cipher.seek(alignedStart);
        byte[] encrypted = cipher.update(plain);
        System.arraycopy(encrypted, lead, output, written, size - written);
        return output;
    }

    @Override
    public InputStream openStream() throws IOException {
        PayloadCipher cipher = cipherSuite.newEncryptor(envelope, keys);
        return new TransformingInputStream(Files.newInputStream(path), Arrays.copyOf(header, header.length), cipher);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
