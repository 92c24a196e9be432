package cn.edu.bit.vaultsync.crypto;

import java.util.Arrays;

/**
 * 不加密
 */
final class IdentityCipher implements PayloadCipher {

    @Override
    public CipherAlgorithm algorithm() {
        return CipherAlgorithm.NONE;
    }

    @Override
    public byte[] update(byte[] input, int offset, int length) {
        return Arrays.copyOfRange(input, offset, offset + length);
    }

    @Override
    public byte[] doFinal() {
        return new byte[0];
    }

    @Override
    public void seek(long offset) {
        // 任意偏移都可以
    }
}
