package cn.edu.bit.vaultsync.crypto;

import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.spec.ChaCha20ParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * ChaCha20 流加密
 * <p>
 * 16字节的 nonce/IV 中，后12字节作为 ChaCha20 的 nonce，初始块计数为0。
 * 解密某个位置的数据需要该位置所在的64字节块计数，所以只支持按64字节对齐 seek。
 * <p>
 * ChaCha20 加解密都是与密钥流异或，这里统一用 DECRYPT_MODE 初始化，
 * 以便同一个 key/nonce 可以在重试或 seek 时重新初始化。
 */
public final class ChaCha20Cipher implements PayloadCipher {
    public static final int BLOCK_SIZE = 64;
    private static final int NONCE_OFFSET = 4;

    private final SecretKeySpec key;
    private final byte[] nonce;
    private Cipher cipher;

    ChaCha20Cipher(byte[] key, byte[] nonceOrIv) {
        if (key.length != KeyDerivation.KEY_LENGTH || nonceOrIv.length != KeyDerivation.IV_LENGTH) {
            throw new IllegalArgumentException("ChaCha20 requires a 32 byte key and a 16 byte nonce");
        }
        this.key = new SecretKeySpec(key, "ChaCha20");
        this.nonce = Arrays.copyOfRange(nonceOrIv, NONCE_OFFSET, nonceOrIv.length);
        init(0);
    }

    @Override
    public CipherAlgorithm algorithm() {
        return CipherAlgorithm.CHACHA20;
    }

    @Override
    public byte[] update(byte[] input, int offset, int length) {
        if (length == 0) {
            return new byte[0];
        }
        byte[] output = cipher.update(input, offset, length);
        return output == null ? new byte[0] : output;
    }

    @Override
    public byte[] doFinal() {
        return new byte[0];
    }

    @Override
    public void seek(long offset) {
        if (offset < 0 || offset % BLOCK_SIZE != 0) {
            throw new IllegalArgumentException("ChaCha20 can only seek to multiples of " + BLOCK_SIZE + ": " + offset);
        }
        init(offset / BLOCK_SIZE);
    }

    private void init(long blockCounter) {
        try {
            cipher = Cipher.getInstance("ChaCha20");
            // 计数器为32位无符号数
            cipher.init(Cipher.DECRYPT_MODE, key, new ChaCha20ParameterSpec(nonce, (int) blockCounter));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize ChaCha20", e);
        }
    }
}
