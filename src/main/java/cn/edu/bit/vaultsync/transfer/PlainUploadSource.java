package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 未加密上传，直接按位置读取本地文件
 */
class PlainUploadSource implements UploadSource {
    private final Path path;
    private final FileChannel channel;
    private final long length;

    PlainUploadSource(Path path) throws IOException {
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
        this.length = channel.size();
    }

    @Override
    public long length() {
        return length;
    }

    @Override
    public byte[] read(long offset, int size) throws IOException {
        return readFully(channel, offset, size);
    }

    @Override
    public InputStream openStream() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    /**
     * 位置读取，不移动通道的当前位置，可以并发调用
     */
    static byte[] readFully(FileChannel channel, long offset, int size) throws IOException {
        var buffer = ByteBuffer.allocate(size);
        long position = offset;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new IOException("Unexpected end of file at " + position + ", file changed during transfer?");
            }
            position += read;
        }
        return buffer.array();
    }
}
