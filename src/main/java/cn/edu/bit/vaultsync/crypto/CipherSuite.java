package cn.edu.bit.vaultsync.crypto;

import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.security.SecureRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.exception.EnvelopeException;

/**
 * 加密套件入口：生成信封、派生密钥、创建加解密器
 * <p>
 * 信封中的盐/随机数在 {@link #openEncryptor} 时生成，每个文件只生成一次。
 * 没有完整性校验，口令错误时解密不会报错而是得到错误的数据。
 */
public class CipherSuite {
    private static final Logger logger = LoggerFactory.getLogger(CipherSuite.class);

    private final int writerVersion;
    private final int readerVersion;
    private final SecureRandom random;

    public CipherSuite() {
        this(EnvelopeCodec.CURRENT_VERSION, EnvelopeCodec.CURRENT_VERSION);
    }

    /**
     * @param writerVersion 新建信封使用的格式版本
     * @param readerVersion 读取信封时的读取端版本
     */
    public CipherSuite(int writerVersion, int readerVersion) {
        if (!EnvelopeCodec.isKnownVersion(writerVersion) || !EnvelopeCodec.isKnownVersion(readerVersion)) {
            throw new IllegalArgumentException("Unknown envelope format version");
        }
        this.writerVersion = writerVersion;
        this.readerVersion = readerVersion;
        this.random = new SecureRandom();
    }

    public int getWriterVersion() {
        return writerVersion;
    }

    public int getReaderVersion() {
        return readerVersion;
    }

    public EncryptorSession openEncryptor(String secret, CipherAlgorithm algorithm, long originalLength) {
        return openEncryptor(secret, algorithm, writerVersion, originalLength);
    }

    public EncryptorSession openEncryptor(String secret, CipherAlgorithm algorithm, int version, long originalLength) {
        EncryptionEnvelope envelope = newEnvelope(algorithm, version, originalLength);
        return new EncryptorSession(envelope, newEncryptor(envelope, deriveKeys(secret, envelope)));
    }

    public PayloadCipher openDecryptor(String secret, EncryptionEnvelope envelope) {
        return newDecryptor(envelope, deriveKeys(secret, envelope));
    }

    /**
     * 生成新信封，盐或 nonce 随机生成
     */
    public EncryptionEnvelope newEnvelope(CipherAlgorithm algorithm, int version, long originalLength) {
        if (!algorithm.isEncrypted()) {
            return EncryptionEnvelope.none(originalLength);
        }
        return switch (version) {
            case EnvelopeCodec.VERSION_1 -> {
                byte[] nonceOrIv = randomBytes(EnvelopeCodec.NONCE_LENGTH_V1);
                yield new EncryptionEnvelope(algorithm, version, new byte[0], nonceOrIv, originalLength);
            }
            case EnvelopeCodec.VERSION_2 -> new EncryptionEnvelope(algorithm, version,
                    randomBytes(EnvelopeCodec.SALT_LENGTH_V2), new byte[0], originalLength);
            case EnvelopeCodec.VERSION_3 -> new EncryptionEnvelope(algorithm, version,
                    randomBytes(EnvelopeCodec.SALT_LENGTH_V3), new byte[0], originalLength);
            default -> throw new IllegalArgumentException("Unknown envelope format version: " + version);
        };
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    /**
     * 派生密钥，调用方可以缓存结果供多个分块复用（版本3的 PBKDF2 较慢）
     */
    public KeyMaterial deriveKeys(String secret, EncryptionEnvelope envelope) {
        if (!envelope.isEncrypted()) {
            return new KeyMaterial(new byte[0], new byte[0]);
        }
        if (secret == null) {
            throw new IllegalArgumentException("A secret is required for " + envelope.algorithm());
        }
        return KeyDerivation.derive(secret, envelope);
    }

    public PayloadCipher newEncryptor(EncryptionEnvelope envelope, KeyMaterial keys) {
        return newCipher(envelope, keys, true);
    }

    public PayloadCipher newDecryptor(EncryptionEnvelope envelope, KeyMaterial keys) {
        return newCipher(envelope, keys, false);
    }

    private PayloadCipher newCipher(EncryptionEnvelope envelope, KeyMaterial keys, boolean encrypt) {
        return switch (envelope.algorithm()) {
            case NONE -> new IdentityCipher();
            case SIMPLE -> new SimpleCipher(keys.key(), encrypt);
            case CHACHA20 -> new ChaCha20Cipher(keys.key(), keys.iv());
            case AES256CBC -> new Aes256CbcCipher(keys.key(), keys.iv(), encrypt, envelope.originalLength());
        };
    }

    /**
     * 解密密文中的一段负载
     *
     * @param payloadOffset 这段数据在负载中的偏移（不含信封头）
     * @throws UnsupportedOperationException 算法只支持顺序解密
     * @throws IllegalArgumentException      偏移不满足算法对齐要求
     */
    public byte[] decryptRange(String secret, EncryptionEnvelope envelope, long payloadOffset, byte[] ciphertext) {
        if (envelope.algorithm().getRandomAccessMode() == RandomAccessMode.SEQUENTIAL) {
            throw new UnsupportedOperationException(envelope.algorithm() + " does not support range decryption");
        }
        PayloadCipher cipher = openDecryptor(secret, envelope);
        cipher.seek(payloadOffset);
        return cipher.update(ciphertext);
    }

    public EncryptionEnvelope readEnvelope(byte[] data) throws EnvelopeException {
        return EnvelopeCodec.decode(data, data.length, readerVersion);
    }

    /**
     * 从流开头读取信封头，流会被消费最多 {@link EnvelopeCodec#MAX_HEADER_LENGTH} 字节
     */
    public EncryptionEnvelope readEnvelope(InputStream input) throws IOException {
        byte[] head = input.readNBytes(EnvelopeCodec.MAX_HEADER_LENGTH);
        return EnvelopeCodec.decode(head, head.length, readerVersion);
    }

    /**
     * 加密后的总长度（含信封头）
     */
    public static long encryptedLength(CipherAlgorithm algorithm, int version, long plainLength) {
        if (!algorithm.isEncrypted()) {
            return plainLength;
        }
        long payload = algorithm == CipherAlgorithm.AES256CBC ? Aes256CbcCipher.encryptedLength(plainLength)
                : plainLength;
        return EnvelopeCodec.headerLength(version) + payload;
    }

    /**
     * 包装明文流，输出信封头 + 密文
     */
    public InputStream encryptingStream(InputStream plain, String secret, CipherAlgorithm algorithm,
            long originalLength) {
        return encryptingStream(plain, secret, algorithm, writerVersion, originalLength);
    }

    public InputStream encryptingStream(InputStream plain, String secret, CipherAlgorithm algorithm, int version,
            long originalLength) {
        EncryptorSession session = openEncryptor(secret, algorithm, version, originalLength);
        logger.debug("Encrypting stream with {}", session.envelope());
        return new TransformingInputStream(plain, session.header(), session.cipher());
    }

    /**
     * 包装密文流，解析信封头并输出明文；不以信封开头的数据原样输出
     */
    public InputStream decryptingStream(InputStream encrypted, String secret) throws IOException {
        var pushback = new PushbackInputStream(encrypted, EnvelopeCodec.MAX_HEADER_LENGTH);
        byte[] head = pushback.readNBytes(EnvelopeCodec.MAX_HEADER_LENGTH);
        EncryptionEnvelope envelope = EnvelopeCodec.decode(head, head.length, readerVersion);
        int headerLength = envelope.headerLength();
        pushback.unread(head, headerLength, head.length - headerLength);
        if (!envelope.isEncrypted() || secret == null) {
            if (envelope.isEncrypted()) {
                pushback.unread(head, 0, headerLength);
            }
            return pushback;
        }
        return new TransformingInputStream(pushback, null, openDecryptor(secret, envelope));
    }
}
