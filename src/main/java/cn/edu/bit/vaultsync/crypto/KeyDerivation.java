package cn.edu.bit.vaultsync.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * 按信封格式版本从口令派生密钥和IV
 */
final class KeyDerivation {
    static final int KEY_LENGTH = 32;
    static final int IV_LENGTH = 16;
    static final int PBKDF2_ITERATIONS = 10_000;

    private static final byte PADDING_BYTE = (byte) 0xFF;

    private KeyDerivation() {
    }

    static KeyMaterial derive(String secret, EncryptionEnvelope envelope) {
        return switch (envelope.formatVersion()) {
            case EnvelopeCodec.VERSION_1 -> new KeyMaterial(paddedKey(secret), envelope.nonceOrIv().clone());
            case EnvelopeCodec.VERSION_2 -> evpBytesToKey(secret.getBytes(StandardCharsets.UTF_8), envelope.salt());
            case EnvelopeCodec.VERSION_3 -> pbkdf2(secret, envelope.salt());
            default -> throw new IllegalArgumentException(
                    "Unknown envelope format version: " + envelope.formatVersion());
        };
    }

    /**
     * 版本1：口令的UTF-8字节用0xFF补齐到32字节
     */
    static byte[] paddedKey(String secret) {
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length > KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Format version 1 supports secrets of at most " + KEY_LENGTH + " bytes");
        }
        byte[] key = Arrays.copyOf(raw, KEY_LENGTH);
        Arrays.fill(key, raw.length, KEY_LENGTH, PADDING_BYTE);
        return key;
    }

    /**
     * 版本2：OpenSSL EVP_BytesToKey (MD5, 1轮)
     */
    static KeyMaterial evpBytesToKey(byte[] password, byte[] salt) {
        MessageDigest md5 = newDigest("MD5");
        byte[] derived = new byte[KEY_LENGTH + IV_LENGTH];
        byte[] previous = new byte[0];
        int filled = 0;
        while (filled < derived.length) {
            md5.update(previous);
            md5.update(password);
            md5.update(salt);
            previous = md5.digest();
            int count = Math.min(previous.length, derived.length - filled);
            System.arraycopy(previous, 0, derived, filled, count);
            filled += count;
        }
        return split(derived);
    }

    /**
     * 版本3：PBKDF2-HMAC-SHA256
     */
    static KeyMaterial pbkdf2(String secret, byte[] salt) {
        var spec = new PBEKeySpec(secret.toCharArray(), salt, PBKDF2_ITERATIONS, (KEY_LENGTH + IV_LENGTH) * 8);
        try {
            var factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            return split(factory.generateSecret(spec).getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 is not available", e);
        } finally {
            spec.clearPassword();
        }
    }

    static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }

    private static KeyMaterial split(byte[] derived) {
        return new KeyMaterial(Arrays.copyOfRange(derived, 0, KEY_LENGTH),
                Arrays.copyOfRange(derived, KEY_LENGTH, KEY_LENGTH + IV_LENGTH));
    }
}
