package cn.edu.bit.vaultsync.crypto;

/**
 * 加密算法对随机访问（seek）的支持程度
 */
public enum RandomAccessMode {
    /**
     * 任意偏移都可以独立解密
     */
    ANY_OFFSET,
    /**
     * 只能从对齐的块边界开始解密
     */
    BLOCK_ALIGNED,
    /**
     * 必须从头顺序解密
     */
    SEQUENTIAL
}
