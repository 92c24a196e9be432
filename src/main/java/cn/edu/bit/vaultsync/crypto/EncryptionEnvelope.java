package cn.edu.bit.vaultsync.crypto;

/**
 * 加密信封：算法、格式版本、盐/随机数以及明文长度
 * <p>
 * 版本1使用 nonceOrIv，版本2/3使用 salt（密钥和IV由盐派生）
 *
 * @param algorithm      加密算法
 * @param formatVersion  格式版本 (1/2/3)，未加密时为0
 * @param salt           版本2/3的盐，版本1为空数组
 * @param nonceOrIv      版本1的 nonce 或 IV，版本2/3为空数组
 * @param originalLength 明文长度，未知时为-1
 */
public record EncryptionEnvelope(CipherAlgorithm algorithm, int formatVersion, byte[] salt, byte[] nonceOrIv,
        long originalLength) {

    private static final byte[] EMPTY = new byte[0];

    public static EncryptionEnvelope none() {
        return new EncryptionEnvelope(CipherAlgorithm.NONE, 0, EMPTY, EMPTY, -1);
    }

    public static EncryptionEnvelope none(long originalLength) {
        return new EncryptionEnvelope(CipherAlgorithm.NONE, 0, EMPTY, EMPTY, originalLength);
    }

    public boolean isEncrypted() {
        return algorithm.isEncrypted();
    }

    /**
     * 信封头在密文中占用的字节数
     */
    public int headerLength() {
        return isEncrypted() ? EnvelopeCodec.headerLength(formatVersion) : 0;
    }

    public byte[] toBytes() {
        return EnvelopeCodec.encode(this);
    }

    @Override
    public String toString() {
        return "EncryptionEnvelope{algorithm=" + algorithm + ", formatVersion=" + formatVersion
                + ", originalLength=" + originalLength + '}';
    }
}
