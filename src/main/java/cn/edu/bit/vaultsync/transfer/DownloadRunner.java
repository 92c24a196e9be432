package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.Aes256CbcCipher;
import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.crypto.EncryptionEnvelope;
import cn.edu.bit.vaultsync.crypto.EnvelopeCodec;
import cn.edu.bit.vaultsync.crypto.KeyMaterial;
import cn.edu.bit.vaultsync.crypto.PayloadCipher;
import cn.edu.bit.vaultsync.crypto.RandomAccessMode;
import cn.edu.bit.vaultsync.entity.TransferTaskEntity;
import cn.edu.bit.vaultsync.exception.ChecksumMismatchException;
import cn.edu.bit.vaultsync.exception.EnvelopeException;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.exception.TransferException;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.remote.RemoteFileInfo;
import cn.edu.bit.vaultsync.utils.HexUtils;

/**
 * 下载：分块按位置写入临时文件，完成后截断到明文长度并改名
 */
class DownloadRunner extends TaskRunner {
    private static final Logger logger = LoggerFactory.getLogger(DownloadRunner.class);
    static final String PARTIAL_SUFFIX = ".vstmp";

    private RemoteFileInfo remoteInfo;
    private EncryptionEnvelope envelope;
    private KeyMaterial keys;
    private boolean decrypting;
    private boolean ordered;
    private long payloadOffset;
    private long plainLength;
    private Path partialPath;
    private FileChannel channel;
    private volatile OrderedChunkApplier applier;

    DownloadRunner(TransferTask task, RemoteEndpoint endpoint, CipherSuite cipherSuite, ChunkLedger ledger,
            TransferSettings settings, ProgressListener listener, Executor executor, int concurrency) {
        super(task, endpoint, cipherSuite, ledger, settings, listener, executor, concurrency);
    }

    static Path partialPathOf(Path localPath) {
        return localPath.resolveSibling(localPath.getFileName() + PARTIAL_SUFFIX);
    }

    @Override
    protected boolean prepare() throws TransferException {
        String remotePath = task.getRemotePath();
        Optional<RemoteFileInfo> stat = withRetries("Stat", () -> endpoint.stat(remotePath));
        remoteInfo = stat.orElseThrow(() -> new TransferException(task.getTaskId(), TransferException.NO_CHUNK,
                remotePath, "Remote file not found"));
        if (remoteInfo.directory()) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, remotePath,
                    "Remote path is a directory");
        }
        long remoteSize = remoteInfo.size();

        int headLength = (int) Math.min(EnvelopeCodec.MAX_HEADER_LENGTH, remoteSize);
        byte[] head = withRetries("Read envelope", () -> endpoint.readRange(remotePath, 0, headLength));
        try {
            envelope = cipherSuite.readEnvelope(head);
        } catch (EnvelopeException e) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, remotePath,
                    "Unreadable envelope: " + e.getMessage(), e);
        }
        String secret = task.getContext().secret();
        decrypting = envelope.isEncrypted() && secret != null;
        payloadOffset = decrypting ? envelope.headerLength() : 0;
        long payloadLength = remoteSize - payloadOffset;
        plainLength = decrypting ? envelope.originalLength() : remoteSize;
        if (decrypting) {
            keys = cipherSuite.deriveKeys(secret, envelope);
            ordered = envelope.algorithm().getRandomAccessMode() == RandomAccessMode.SEQUENTIAL;
        } else if (envelope.isEncrypted()) {
            logger.info("No secret for encrypted file {}, downloading raw bytes", remotePath);
        }

        int alignment = decrypting ? envelope.algorithm().getAlignment() : 1;
        int chunkSize = ChunkPlanner.effectiveChunkSize(settings.chunkSize(), endpoint.maxChunkSize(), alignment);
        partialPath = partialPathOf(task.getLocalPath());

        List<ChunkState> chunks = ledger.load(task.getTaskId())
                .filter(saved -> matches(saved.task(), remoteSize, chunkSize))
                .map(saved -> ChunkLedger.restoreChunks(saved.chunks()))
                .filter(restored -> !restored.isEmpty()
                        && restored.get(restored.size() - 1).getEnd() == payloadLength)
                .orElse(null);
        boolean restored = chunks != null;
        try {
            if (!restored) {
                chunks = ChunkPlanner.plan(payloadLength, chunkSize);
                Files.deleteIfExists(partialPath);
                ledger.create(new TransferTaskEntity(task.getTaskId(), TransferDirection.DOWNLOAD.name(),
                        task.getLocalPath().toString(), remotePath, remoteSize, chunkSize, new byte[0],
                        remoteInfo.mtimeSeconds()), chunks);
            }
            Path parent = task.getLocalPath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(partialPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.READ);
        } catch (IOException e) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, remotePath,
                    "Failed to open partial file: " + e.getMessage(), e);
        }
        // 进度按明文计，密文末尾的填充不计入
        task.setTotalSize(plainLength);
        task.setChunks(chunks);
        task.bytesDoneCounter().set(sumDone(chunks));
        if (restored) {
            logger.info("Resuming download {} with {}/{} bytes already done", task.getTaskId(), task.getBytesDone(),
                    plainLength);
        }
        return true;
    }

    @Override
    protected void beforeRound() throws TransferException {
        if (!ordered) {
            return;
        }
        List<ChunkState> chunks = task.getChunks();
        int firstIndex = 0;
        while (firstIndex < chunks.size() && chunks.get(firstIndex).getStatus() == ChunkStatus.DONE) {
            firstIndex++;
        }
        var cipher = (Aes256CbcCipher) cipherSuite.newDecryptor(envelope, keys);
        if (firstIndex > 0 && firstIndex < chunks.size()) {
            long offset = chunks.get(firstIndex).getOffset();
            byte[] previousBlock = withRetries("Read previous cipher block", () -> endpoint.readRange(
                    task.getRemotePath(), payloadOffset + offset - Aes256CbcCipher.BLOCK_SIZE,
                    Aes256CbcCipher.BLOCK_SIZE));
            cipher.resumeAt(offset, previousBlock);
        }
        applier = new OrderedChunkApplier(chunks, firstIndex, cipher, channel, settings.applierWindow(),
                this::shouldStop, chunk -> markDone(chunk, null));
    }

    @Override
    protected void transferChunk(ChunkState chunk) throws IOException, RemoteException, InterruptedException {
        if (ordered && !applier.awaitSlot(chunk.getIndex())) {
            return;
        }
        byte[] data = endpoint.readRange(task.getRemotePath(), payloadOffset + chunk.getOffset(), chunk.getSize());
        if (data.length != chunk.getSize()) {
            throw new IOException("Short read for chunk " + chunk.getIndex() + ": expected " + chunk.getSize()
                    + " bytes, got " + data.length);
        }
        if (ordered) {
            applier.submit(chunk, data);
            return;
        }
        byte[] plain = data;
        if (decrypting) {
            PayloadCipher cipher = cipherSuite.newDecryptor(envelope, keys);
            cipher.seek(chunk.getOffset());
            plain = cipher.update(data);
        }
        writeFully(plain, chunk.getOffset());
        markDone(chunk, null);
    }

    @Override
    protected boolean finish() throws TransferException {
        Path localPath = task.getLocalPath();
        try {
            channel.truncate(plainLength);
            channel.force(false);
            channel.close();

            if (settings.verifyChecksum() && !decrypting && remoteInfo.md5() != null) {
                String actual = md5Of(partialPath);
                if (!actual.equalsIgnoreCase(remoteInfo.md5())) {
                    Files.deleteIfExists(partialPath);
                    throw new ChecksumMismatchException(task.getTaskId(), task.getRemotePath(), remoteInfo.md5(),
                            actual);
                }
            }

            try {
                Files.move(partialPath, localPath, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partialPath, localPath, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.setLastModifiedTime(localPath, FileTime.from(remoteInfo.mtimeSeconds(), TimeUnit.SECONDS));
        } catch (IOException e) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, task.getRemotePath(),
                    "Failed to finalize download: " + e.getMessage(), e);
        }
        return true;
    }

    @Override
    protected long progressBytes(ChunkState chunk) {
        return Math.max(0, Math.min(chunk.getEnd(), plainLength) - chunk.getOffset());
    }

    @Override
    protected void cleanup(boolean cancelled) {
        try {
            if (channel != null && channel.isOpen()) {
                channel.close();
            }
            if (cancelled && partialPath != null) {
                Files.deleteIfExists(partialPath);
            }
        } catch (IOException e) {
            logger.warn("Failed to clean up partial download {}", partialPath, e);
        }
    }

    private boolean matches(TransferTaskEntity saved, long remoteSize, int chunkSize) {
        return TransferDirection.DOWNLOAD.name().equals(saved.direction()) && saved.totalSize() == remoteSize
                && saved.chunkSize() == chunkSize && saved.sourceMtime() == remoteInfo.mtimeSeconds()
                && Files.exists(partialPathOf(task.getLocalPath()));
    }

    private void writeFully(byte[] data, long position) {
        var buffer = ByteBuffer.wrap(data);
        long current = position;
        try {
            while (buffer.hasRemaining()) {
                current += channel.write(buffer, current);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write chunk to " + partialPath, e);
        }
    }

    private static String md5Of(Path path) throws IOException {
        MessageDigest md5;
        try {
            md5 = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
        try (InputStream input = new DigestInputStream(Files.newInputStream(path), md5)) {
            input.transferTo(OutputStream.nullOutputStream());
        }
        return HexUtils.bytesToHex(md5.digest());
    }
}
