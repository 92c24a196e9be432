package cn.edu.bit.vaultsync.crypto;

import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256-CBC
 * <p>
 * 只有明文长度不是16的倍数时才做 PKCS#7 填充，密文长度为明文长度向上取整到16。
 * 解密时按信封中的明文长度截断输出，不依赖填充字节。
 * <p>
 * CBC 的每个块依赖前一个密文块，只支持从头解密；
 * 如果调用方能提供前一个密文块，可以用 {@link #resumeAt(long, byte[])} 从对齐位置继续。
 */
public final class Aes256CbcCipher implements PayloadCipher {
    public static final int BLOCK_SIZE = 16;

    private final SecretKeySpec key;
    private final byte[] iv;
    private final boolean encrypt;
    private final long originalLength;

    private Cipher cipher;
    private long consumed = 0; // 加密：已输入明文字节数
    private long emitted = 0; // 解密：已输出明文字节数

    Aes256CbcCipher(byte[] key, byte[] iv, boolean encrypt, long originalLength) {
        if (key.length != KeyDerivation.KEY_LENGTH || iv.length != BLOCK_SIZE) {
            throw new IllegalArgumentException("AES-256-CBC requires a 32 byte key and a 16 byte IV");
        }
        this.key = new SecretKeySpec(key, "AES");
        this.iv = iv.clone();
        this.encrypt = encrypt;
        this.originalLength = originalLength;
        init(this.iv);
    }

    @Override
    public CipherAlgorithm algorithm() {
        return CipherAlgorithm.AES256CBC;
    }

    @Override
    public byte[] update(byte[] input, int offset, int length) {
        if (length == 0) {
            return new byte[0];
        }
        byte[] output = cipher.update(input, offset, length);
        if (encrypt) {
            consumed += length;
            return output == null ? new byte[0] : output;
        }
        return cap(output);
    }

    @Override
    public byte[] doFinal() {
        try {
            if (encrypt) {
                int remainder = (int) (consumed % BLOCK_SIZE);
                if (remainder == 0) {
                    return orEmpty(cipher.doFinal());
                }
                return orEmpty(cipher.doFinal(pkcs7Padding(BLOCK_SIZE - remainder)));
            }
            return cap(cipher.doFinal());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ciphertext is not aligned to the AES block size", e);
        }
    }

    @Override
    public void seek(long offset) {
        if (offset != 0) {
            throw new UnsupportedOperationException("AES-256-CBC can only be processed sequentially from offset 0");
        }
        consumed = 0;
        emitted = 0;
        init(iv);
    }

    /**
     * 从块对齐的负载偏移继续解密
     *
     * @param offset                负载偏移，16的倍数
     * @param previousCipherBlock   offset 之前的一个密文块，offset 为0时忽略
     */
    public void resumeAt(long offset, byte[] previousCipherBlock) {
        if (encrypt) {
            throw new UnsupportedOperationException("Only decryption can be resumed");
        }
        if (offset % BLOCK_SIZE != 0) {
            throw new IllegalArgumentException("AES-256-CBC can only resume at multiples of " + BLOCK_SIZE);
        }
        if (offset == 0) {
            seek(0);
            return;
        }
        if (previousCipherBlock == null || previousCipherBlock.length != BLOCK_SIZE) {
            throw new IllegalArgumentException("Previous cipher block must be " + BLOCK_SIZE + " bytes");
        }
        emitted = offset;
        init(previousCipherBlock);
    }

    /**
     * 加密后的负载长度
     */
    public static long encryptedLength(long plainLength) {
        long remainder = plainLength % BLOCK_SIZE;
        return remainder == 0 ? plainLength : plainLength + BLOCK_SIZE - remainder;
    }

    private byte[] cap(byte[] output) {
        if (output == null || output.length == 0) {
            return new byte[0];
        }
        long allowed = originalLength < 0 ? output.length : Math.max(0, originalLength - emitted);
        int length = (int) Math.min(output.length, allowed);
        emitted += length;
        return length == output.length ? output : Arrays.copyOf(output, length);
    }

    private static byte[] orEmpty(byte[] output) {
        return output == null ? new byte[0] : output;
    }

    private static byte[] pkcs7Padding(int count) {
        byte[] padding = new byte[count];
        Arrays.fill(padding, (byte) count);
        return padding;
    }

    private void init(byte[] initialVector) {
        try {
            cipher = Cipher.getInstance("AES/CBC/NoPadding");
            cipher.init(encrypt ? Cipher.ENCRYPT_MODE : Cipher.DECRYPT_MODE, key, new IvParameterSpec(initialVector));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize AES-256-CBC", e);
        }
    }
}
