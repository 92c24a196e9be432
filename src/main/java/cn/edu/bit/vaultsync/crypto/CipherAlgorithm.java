package cn.edu.bit.vaultsync.crypto;

import java.util.Locale;

import cn.edu.bit.vaultsync.exception.UnsupportedAlgorithmException;

/**
 * 支持的加密算法
 * 新增算法时需要在这里添加一个枚举值，并实现对应的 {@link PayloadCipher}
 */
public enum CipherAlgorithm {
    NONE(-1, RandomAccessMode.ANY_OFFSET, 1),
    /**
     * 单字节替换表，不具备密码学安全性，仅用于需要范围下载/拖动播放的非敏感数据
     */
    SIMPLE(0x00, RandomAccessMode.ANY_OFFSET, 1),
    CHACHA20(0x01, RandomAccessMode.BLOCK_ALIGNED, 64),
    AES256CBC(0x02, RandomAccessMode.SEQUENTIAL, 16);

    private final int id;
    private final RandomAccessMode randomAccessMode;
    private final int alignment;

    CipherAlgorithm(int id, RandomAccessMode randomAccessMode, int alignment) {
        this.id = id;
        this.randomAccessMode = randomAccessMode;
        this.alignment = alignment;
    }

    public int getId() {
        return id;
    }

    public RandomAccessMode getRandomAccessMode() {
        return randomAccessMode;
    }

    /**
     * 分块和 seek 必须满足的字节对齐
     */
    public int getAlignment() {
        return alignment;
    }

    public boolean isEncrypted() {
        return this != NONE;
    }

    public static CipherAlgorithm fromId(int id) throws UnsupportedAlgorithmException {
        for (var algorithm : values()) {
            if (algorithm != NONE && algorithm.id == id) {
                return algorithm;
            }
        }
        throw new UnsupportedAlgorithmException(id);
    }

    /**
     * 按名称解析，忽略大小写，用于配置文件
     */
    public static CipherAlgorithm fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-", "");
        if ("NO".equals(normalized)) {
            return NONE;
        }
        return valueOf(normalized);
    }
}
