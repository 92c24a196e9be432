package cn.edu.bit.vaultsync.crypto;

/**
 * 一次加密的信封和对应的加密器
 */
public record EncryptorSession(EncryptionEnvelope envelope, PayloadCipher cipher) {

    public byte[] header() {
        return envelope.toBytes();
    }
}
