package cn.edu.bit.vaultsync.crypto;

/**
 * 派生得到的密钥和IV
 */
public record KeyMaterial(byte[] key, byte[] iv) {
}
