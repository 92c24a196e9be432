package cn.edu.bit.vaultsync.crypto;

import java.nio.ByteBuffer;
import java.util.Arrays;

import cn.edu.bit.vaultsync.exception.CorruptEnvelopeException;
import cn.edu.bit.vaultsync.exception.EnvelopeException;
import cn.edu.bit.vaultsync.exception.IncompatibleEnvelopeException;

/**
 * 信封头的二进制编解码（大端序）
 *
 * <pre>
 * 前缀 6 字节: magic "VSEN" | format_version u8 | algorithm_id u8
 * 版本1: nonce_or_iv[16] | original_length u64   共30字节
 * 版本2: salt[8]         | original_length u64   共22字节
 * 版本3: salt[16]        | original_length u64   共30字节
 * </pre>
 */
public final class EnvelopeCodec {
    public static final byte[] MAGIC = { 0x56, 0x53, 0x45, 0x4E };
    public static final int PREFIX_LENGTH = MAGIC.length + 2;
    public static final int MAX_HEADER_LENGTH = 30;

    public static final int VERSION_1 = 1;
    public static final int VERSION_2 = 2;
    public static final int VERSION_3 = 3;
    public static final int CURRENT_VERSION = VERSION_3;

    public static final int NONCE_LENGTH_V1 = 16;
    public static final int SALT_LENGTH_V2 = 8;
    public static final int SALT_LENGTH_V3 = 16;

    private EnvelopeCodec() {
    }

    public static boolean isKnownVersion(int version) {
        return version == VERSION_1 || version == VERSION_2 || version == VERSION_3;
    }

    public static int headerLength(int version) {
        return switch (version) {
            case VERSION_1 -> PREFIX_LENGTH + NONCE_LENGTH_V1 + Long.BYTES;
            case VERSION_2 -> PREFIX_LENGTH + SALT_LENGTH_V2 + Long.BYTES;
            case VERSION_3 -> PREFIX_LENGTH + SALT_LENGTH_V3 + Long.BYTES;
            default -> throw new IllegalArgumentException("Unknown envelope format version: " + version);
        };
    }

    /**
     * 读取端能否读取某个版本的信封
     * 版本3向后兼容版本1；版本2只兼容版本1，版本3读取端拒绝版本2
     */
    public static boolean isReadable(int envelopeVersion, int readerVersion) {
        if (envelopeVersion == VERSION_1) {
            return true;
        }
        return envelopeVersion == readerVersion;
    }

    public static byte[] encode(EncryptionEnvelope envelope) {
        if (!envelope.isEncrypted()) {
            return new byte[0];
        }
        int version = envelope.formatVersion();
        var buffer = ByteBuffer.allocate(headerLength(version));
        buffer.put(MAGIC);
        buffer.put((byte) version);
        buffer.put((byte) envelope.algorithm().getId());
        switch (version) {
            case VERSION_1 -> buffer.put(requireLength(envelope.nonceOrIv(), NONCE_LENGTH_V1, "nonce_or_iv"));
            case VERSION_2 -> buffer.put(requireLength(envelope.salt(), SALT_LENGTH_V2, "salt"));
            case VERSION_3 -> buffer.put(requireLength(envelope.salt(), SALT_LENGTH_V3, "salt"));
            default -> throw new IllegalArgumentException("Unknown envelope format version: " + version);
        }
        buffer.putLong(envelope.originalLength());
        return buffer.array();
    }

    public static EncryptionEnvelope decode(byte[] data) throws EnvelopeException {
        return decode(data, data.length, CURRENT_VERSION);
    }

    /**
     * 解析信封头
     *
     * @param data          数据开头的字节
     * @param length        data 中有效字节数
     * @param readerVersion 读取端版本
     * @return 信封；数据不以 magic 开头时返回未加密信封
     * @throws EnvelopeException 信封被截断、版本未知、版本不兼容或算法未知
     */
    public static EncryptionEnvelope decode(byte[] data, int length, int readerVersion) throws EnvelopeException {
        if (!startsWithMagic(data, length)) {
            return EncryptionEnvelope.none();
        }
        if (length < PREFIX_LENGTH) {
            throw new CorruptEnvelopeException("Envelope prefix truncated: " + length + " bytes");
        }
        int version = data[MAGIC.length] & 0xFF;
        if (!isKnownVersion(version)) {
            throw new CorruptEnvelopeException("Unknown envelope format version: " + version);
        }
        if (!isReadable(version, readerVersion)) {
            throw new IncompatibleEnvelopeException(version, readerVersion);
        }
        CipherAlgorithm algorithm = CipherAlgorithm.fromId(data[MAGIC.length + 1] & 0xFF);

        int headerLength = headerLength(version);
        if (length < headerLength) {
            throw new CorruptEnvelopeException(
                    "Envelope header truncated: expected " + headerLength + " bytes, got " + length);
        }

        var buffer = ByteBuffer.wrap(data, PREFIX_LENGTH, headerLength - PREFIX_LENGTH);
        byte[] salt = new byte[0];
        byte[] nonceOrIv = new byte[0];
        switch (version) {
            case VERSION_1 -> {
                nonceOrIv = new byte[NONCE_LENGTH_V1];
                buffer.get(nonceOrIv);
            }
            case VERSION_2 -> {
                salt = new byte[SALT_LENGTH_V2];
                buffer.get(salt);
            }
            default -> {
                salt = new byte[SALT_LENGTH_V3];
                buffer.get(salt);
            }
        }
        long originalLength = buffer.getLong();
        if (originalLength < 0) {
            throw new CorruptEnvelopeException("Negative original length in envelope: " + originalLength);
        }
        return new EncryptionEnvelope(algorithm, version, salt, nonceOrIv, originalLength);
    }

    /**
     * 解析本程序自己保存的信封（例如断点续传账本），接受任意已知版本
     */
    public static EncryptionEnvelope decodeStored(byte[] data) throws EnvelopeException {
        if (data.length <= MAGIC.length) {
            return decode(data, data.length, CURRENT_VERSION);
        }
        int version = data[MAGIC.length] & 0xFF;
        return decode(data, data.length, isKnownVersion(version) ? version : CURRENT_VERSION);
    }

    private static boolean startsWithMagic(byte[] data, int length) {
        if (length < MAGIC.length) {
            return false;
        }
        return Arrays.equals(data, 0, MAGIC.length, MAGIC, 0, MAGIC.length);
    }

    private static byte[] requireLength(byte[] bytes, int expected, String name) {
        if (bytes == null || bytes.length != expected) {
            throw new IllegalArgumentException(name + " must be " + expected + " bytes");
        }
        return bytes;
    }
}
