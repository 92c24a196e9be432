package cn.edu.bit.vaultsync.transfer;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * 上传字节流（加密时为信封头 + 密文）的按位置读取
 * 分块读取会被多个工作线程并发调用
 */
interface UploadSource extends Closeable {

    /**
     * 上传字节流的总长度
     */
    long length();

    byte[] read(long offset, int size) throws IOException;

    /**
     * 从头读取整个上传字节流，用于计算秒传指纹
     */
    InputStream openStream() throws IOException;
}
