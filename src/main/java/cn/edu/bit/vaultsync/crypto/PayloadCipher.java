package cn.edu.bit.vaultsync.crypto;

/**
 * 对信封之后的负载进行加密或解密的流式变换
 * 实例不是线程安全的，每个分块/每条流使用自己的实例
 */
public interface PayloadCipher {

    CipherAlgorithm algorithm();

    /**
     * 变换一段数据，输出长度可能小于输入（块加密会缓存不完整的块）
     */
    byte[] update(byte[] input, int offset, int length);

    default byte[] update(byte[] input) {
        return update(input, 0, input.length);
    }

    /**
     * 结束变换，返回剩余输出（例如 AES 的填充块）
     */
    byte[] doFinal();

    /**
     * 把变换状态定位到负载中的某个偏移
     *
     * @param offset 负载偏移，必须满足算法的对齐要求
     * @throws IllegalArgumentException      偏移未对齐
     * @throws UnsupportedOperationException 算法只支持从头顺序处理
     */
    void seek(long offset);
}
