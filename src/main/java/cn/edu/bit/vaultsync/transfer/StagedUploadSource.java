package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.crypto.EncryptionEnvelope;
import cn.edu.bit.vaultsync.crypto.KeyMaterial;
import cn.edu.bit.vaultsync.crypto.TransformingInputStream;

/**
 * 只能顺序加密的算法：先把整个文件加密到临时文件，再按位置读取
 * 信封（盐/IV）随任务持久化，重新暂存得到的密文与之前完全相同
 */
class StagedUploadSource implements UploadSource {
    private static final Logger logger = LoggerFactory.getLogger(StagedUploadSource.class);

    private final Path stagedFile;
    private final FileChannel channel;
    private final long length;

    StagedUploadSource(Path source, CipherSuite cipherSuite, EncryptionEnvelope envelope, KeyMaterial keys)
            throws IOException {
        this.stagedFile = Files.createTempFile("vaultsync_", ".staged");
        try (InputStream encrypted = new TransformingInputStream(Files.newInputStream(source), envelope.toBytes(),
                cipherSuite.newEncryptor(envelope, keys))) {
            Files.copy(encrypted, stagedFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(stagedFile);
            throw e;
        }
        this.channel = FileChannel.open(stagedFile, StandardOpenOption.READ);
        this.length = channel.size();
        logger.debug("Staged encrypted copy of {} ({} bytes)", source, length);
    }

    @Override
    public long length() {
        return length;
    }

    @Override
    public byte[] read(long offset, int size) throws IOException {
        return PlainUploadSource.readFully(channel, offset, size);
    }

    @Override
    public InputStream openStream() throws IOException {
        return Files.newInputStream(stagedFile);
    }

    @Override
    public void close() throws IOException {
        try {
            channel.close();
        } finally {
            Files.deleteIfExists(stagedFile);
        }
    }
}
