package cn.edu.bit.vaultsync.crypto;

import java.nio.ByteBuffer;
import java.security.MessageDigest;

/**
 * 单字节替换加密
 * <p>
 * 由密钥确定性地生成 0~255 的一个置换作为加密表，它的逆置换作为解密表。
 * 每个字节的变换只依赖于字节本身，因此任意区间都可以独立解密，
 * 适合范围下载和拖动播放。
 * <p>
 * <b>该算法不具备密码学安全性</b>：没有扩散，明文字节和密文字节一一对应，
 * 不能用于敏感数据。
 */
public final class SimpleCipher implements PayloadCipher {
    private static final int TABLE_SIZE = 256;

    private final byte[] table;

    SimpleCipher(byte[] key, boolean encrypt) {
        byte[] permutation = permutation(key);
        this.table = encrypt ? permutation : inverse(permutation);
    }

    @Override
    public CipherAlgorithm algorithm() {
        return CipherAlgorithm.SIMPLE;
    }

    @Override
    public byte[] update(byte[] input, int offset, int length) {
        byte[] output = new byte[length];
        for (int i = 0; i < length; i++) {
            output[i] = table[input[offset + i] & 0xFF];
        }
        return output;
    }

    @Override
    public byte[] doFinal() {
        return new byte[0];
    }

    /**
     * 变换任意一段数据，不需要这段数据之外的字节
     */
    public byte[] decryptRange(byte[] range) {
        return update(range, 0, range.length);
    }

    @Override
    public void seek(long offset) {
        // 无状态，任意偏移都可以直接处理
    }

    /**
     * Fisher–Yates 洗牌，随机源为 SHA-256(key || counter) 组成的字节流
     */
    static byte[] permutation(byte[] key) {
        byte[] values = new byte[TABLE_SIZE];
        for (int i = 0; i < TABLE_SIZE; i++) {
            values[i] = (byte) i;
        }
        var stream = new DigestStream(key);
        for (int i = TABLE_SIZE - 1; i > 0; i--) {
            int j = stream.nextUnsignedShort() % (i + 1);
            byte tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
        return values;
    }

    static byte[] inverse(byte[] permutation) {
        byte[] inverse = new byte[TABLE_SIZE];
        for (int i = 0; i < TABLE_SIZE; i++) {
            inverse[permutation[i] & 0xFF] = (byte) i;
        }
        return inverse;
    }

    private static final class DigestStream {
        private final MessageDigest digest = KeyDerivation.newDigest("SHA-256");
        private final byte[] seed;
        private byte[] block = new byte[0];
        private int position = 0;
        private int counter = 0;

        DigestStream(byte[] seed) {
            this.seed = seed.clone();
        }

        int nextUnsignedShort() {
            return (nextByte() << 8) | nextByte();
        }

        private int nextByte() {
            if (position == block.length) {
                digest.update(seed);
                digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(counter++).array());
                block = digest.digest();
                position = 0;
            }
            return block[position++] & 0xFF;
        }
    }
}
