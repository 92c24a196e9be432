package cn.edu.bit.vaultsync.transfer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.CipherAlgorithm;
import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.crypto.EncryptionEnvelope;
import cn.edu.bit.vaultsync.crypto.EnvelopeCodec;
import cn.edu.bit.vaultsync.crypto.KeyMaterial;
import cn.edu.bit.vaultsync.crypto.RandomAccessMode;
import cn.edu.bit.vaultsync.entity.FingerprintCacheEntity;
import cn.edu.bit.vaultsync.entity.TransferTaskEntity;
import cn.edu.bit.vaultsync.exception.ChecksumMismatchException;
import cn.edu.bit.vaultsync.exception.EnvelopeException;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.exception.TransferException;
import cn.edu.bit.vaultsync.fingerprint.FileFingerprint;
import cn.edu.bit.vaultsync.fingerprint.FingerprintCache;
import cn.edu.bit.vaultsync.fingerprint.FingerprintCalculator;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.remote.RemoteFileInfo;
import cn.edu.bit.vaultsync.session.AccountContext;

/**
 * 上传：先尝试秒传，否则分块上传后合并
 */
class UploadRunner extends TaskRunner {
    private static final Logger logger = LoggerFactory.getLogger(UploadRunner.class);

    private final FingerprintCache fingerprintCache;
    private final FingerprintCalculator calculator = new FingerprintCalculator();

    private UploadSource source;
    private EncryptionEnvelope envelope;
    private long localMtime;
    private FileFingerprint fingerprint;
    private TransferTaskEntity ledgerEntry;
    private int chunkSize;
    private boolean rapidUploaded = false;
    private boolean replanned = false;

    UploadRunner(TransferTask task, RemoteEndpoint endpoint, CipherSuite cipherSuite, ChunkLedger ledger,
            FingerprintCache fingerprintCache, TransferSettings settings, ProgressListener listener,
            Executor executor, int concurrency) {
        super(task, endpoint, cipherSuite, ledger, settings, listener, executor, concurrency);
        this.fingerprintCache = fingerprintCache;
    }

    @Override
    protected boolean prepare() throws TransferException {
        Path localPath = task.getLocalPath();
        if (!Files.isRegularFile(localPath)) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, task.getRemotePath(),
                    "Local file not found: " + localPath);
        }
        AccountContext context = task.getContext();
        try {
            long localSize = Files.size(localPath);
            localMtime = Files.getLastModifiedTime(localPath).to(TimeUnit.SECONDS);

            Optional<ChunkLedger.Snapshot> snapshot = ledger.load(task.getTaskId())
                    .filter(saved -> matches(saved.task(), localSize));
            envelope = snapshot.map(this::storedEnvelope).orElse(null);
            if (envelope == null || envelope.isEncrypted() != context.encrypts()
                    || (context.encrypts() && envelope.algorithm() != context.algorithm())) {
                snapshot = Optional.empty();
                envelope = newEnvelope(context, localSize);
            }
            KeyMaterial keys = cipherSuite.deriveKeys(context.secret(), envelope);
            source = openSource(localPath, envelope, keys);

            chunkSize = ChunkPlanner.effectiveChunkSize(settings.chunkSize(), endpoint.maxChunkSize(), 1);
            List<ChunkState> chunks = null;
            if (snapshot.isPresent() && snapshot.get().task().chunkSize() == chunkSize) {
                chunks = ChunkLedger.restoreChunks(snapshot.get().chunks());
                if (chunks.isEmpty() || chunks.get(chunks.size() - 1).getEnd() != source.length()) {
                    chunks = null;
                }
            }
            boolean restored = chunks != null;
            if (!restored) {
                chunks = ChunkPlanner.plan(source.length(), chunkSize);
            }
            task.setTotalSize(source.length());
            task.setChunks(chunks);
            task.bytesDoneCounter().set(sumDone(chunks));

            if (settings.rapidUpload() && tryRapidUpload(context)) {
                return false;
            }

            ledgerEntry = new TransferTaskEntity(task.getTaskId(), TransferDirection.UPLOAD.name(),
                    localPath.toString(), task.getRemotePath(), localSize, chunkSize, envelope.toBytes(), localMtime);
            if (restored) {
                logger.info("Resuming upload {} with {}/{} bytes already done", task.getTaskId(),
                        task.getBytesDone(), task.getTotalSize());
            } else {
                ledger.create(ledgerEntry, chunks);
            }
            return true;
        } catch (IOException e) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, task.getRemotePath(),
                    "Failed to prepare upload: " + e.getMessage(), e);
        }
    }

    @Override
    protected void transferChunk(ChunkState chunk) throws IOException, RemoteException {
        byte[] data = source.read(chunk.getOffset(), chunk.getSize());
        String token = endpoint.uploadChunk(task.getRemotePath(), chunk.getIndex(), data);
        markDone(chunk, token);
    }

    @Override
    protected boolean finish() throws TransferException {
        var tokens = new ArrayList<String>(task.getChunks().size());
        for (var chunk : task.getChunks()) {
            tokens.add(chunk.getToken());
        }
        RemoteFileInfo info;
        try {
            info = withRetries("Combine chunks",
                    () -> endpoint.combineChunks(task.getRemotePath(), tokens, localMtime));
        } catch (TransferException e) {
            // 账本里的分块凭证在远端已失效，只重新上传一次
            if (replanned || !isMissingChunk(e)) {
                throw e;
            }
            logger.warn("Remote lost the chunks of task {}, uploading again: {}", task.getTaskId(), e.getMessage());
            replan();
            return false;
        }

        if (settings.verifyChecksum()) {
            FileFingerprint expected = fingerprint();
            if (info.md5() == null || !info.md5().equalsIgnoreCase(expected.contentMd5())) {
                throw new ChecksumMismatchException(task.getTaskId(), task.getRemotePath(), expected.contentMd5(),
                        info.md5());
            }
        }
        if (fingerprint != null) {
            saveFingerprint(info);
        }
        return true;
    }

    private void replan() {
        replanned = true;
        List<ChunkState> chunks = ChunkPlanner.plan(source.length(), chunkSize);
        ledger.create(ledgerEntry, chunks);
        task.setChunks(chunks);
        task.bytesDoneCounter().set(0);
    }

    private static boolean isMissingChunk(TransferException error) {
        return error.getCause() instanceof RemoteException remote
                && remote.getErrorCode() == RemoteException.NOT_FOUND;
    }

    @Override
    protected void cleanup(boolean cancelled) {
        if (source != null) {
            try {
                source.close();
            } catch (IOException e) {
                logger.warn("Failed to close upload source of task {}", task.getTaskId(), e);
            }
        }
    }

    @Override
    protected boolean isRapidUploaded() {
        return rapidUploaded;
    }

    private boolean matches(TransferTaskEntity saved, long localSize) {
        return TransferDirection.UPLOAD.name().equals(saved.direction()) && saved.totalSize() == localSize
                && saved.sourceMtime() == localMtime;
    }

    private EncryptionEnvelope storedEnvelope(ChunkLedger.Snapshot snapshot) {
        try {
            return EnvelopeCodec.decodeStored(snapshot.task().envelope());
        } catch (EnvelopeException e) {
            logger.warn("Discarding ledger of task {}: {}", task.getTaskId(), e.getMessage());
            return null;
        }
    }

    private EncryptionEnvelope newEnvelope(AccountContext context, long localSize) {
        if (!context.encrypts()) {
            return EncryptionEnvelope.none(localSize);
        }
        int version = context.formatVersion() > 0 ? context.formatVersion() : cipherSuite.getWriterVersion();
        return cipherSuite.newEnvelope(context.algorithm(), version, localSize);
    }

    private UploadSource openSource(Path localPath, EncryptionEnvelope uploadEnvelope, KeyMaterial keys)
            throws IOException {
        CipherAlgorithm algorithm = uploadEnvelope.algorithm();
        if (!algorithm.isEncrypted()) {
            return new PlainUploadSource(localPath);
        }
        if (algorithm.getRandomAccessMode() == RandomAccessMode.SEQUENTIAL) {
            return new StagedUploadSource(localPath, cipherSuite, uploadEnvelope, keys);
        }
        return new EncryptedUploadSource(localPath, cipherSuite, uploadEnvelope, keys);
    }

    /**
     * 秒传命中时登记文件并结束任务
     */
    private boolean tryRapidUpload(AccountContext context) throws IOException, TransferException {
        FileFingerprint uploadFingerprint = fingerprint();
        Optional<RemoteFileInfo> hit;
        try {
            hit = endpoint.rapidUpload(task.getRemotePath(), uploadFingerprint, localMtime);
        } catch (RemoteException e) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, task.getRemotePath(),
                    "Rapid upload rejected: " + e.getMessage(), e);
        } catch (IOException e) {
            logger.warn("Rapid upload of {} failed, falling back to chunked upload: {}", task.getRemotePath(),
                    e.getMessage());
            return false;
        }
        if (hit.isEmpty()) {
            return false;
        }
        rapidUploaded = true;
        saveFingerprint(hit.get());
        task.bytesDoneCounter().set(task.getTotalSize());
        report(new ProgressEvent(task.getTaskId(), task.getTotalSize(), task.getTotalSize(), -1));
        logger.info("Rapid upload {} -> {} (user {})", task.getLocalPath(), task.getRemotePath(),
                context.userName());
        return true;
    }

    /**
     * 上传字节流的指纹，未加密时优先使用缓存
     */
    private FileFingerprint fingerprint() throws TransferException {
        if (fingerprint != null) {
            return fingerprint;
        }
        AccountContext context = task.getContext();
        String filename = remoteName();
        if (fingerprintCache != null && !envelope.isEncrypted()) {
            var cached = fingerprintCache.lookup(task.getLocalPath().toString(), task.getRemotePath(),
                    context.userId(), localMtime)
                    .filter(entry -> CipherAlgorithm.NONE.name().equals(entry.algorithm()));
            if (cached.isPresent()) {
                logger.debug("Fingerprint cache hit for {}", task.getLocalPath());
                fingerprint = cached.get().fingerprint().withFilename(filename);
                return fingerprint;
            }
        }
        try (InputStream input = source.openStream()) {
            fingerprint = calculator.compute(input, filename);
            return fingerprint;
        } catch (IOException e) {
            throw new TransferException(task.getTaskId(), TransferException.NO_CHUNK, task.getRemotePath(),
                    "Failed to compute fingerprint: " + e.getMessage(), e);
        }
    }

    private void saveFingerprint(RemoteFileInfo info) {
        if (fingerprintCache == null) {
            return;
        }
        AccountContext context = task.getContext();
        try {
            fingerprintCache.save(new FingerprintCacheEntity(0, task.getLocalPath().toString(), task.getRemotePath(),
                    context.userId(), context.userName(), fingerprint, envelope.algorithm().name(), localMtime,
                    info.mtimeSeconds(), null));
        } catch (RuntimeException e) {
            logger.warn("Failed to save fingerprint of {}", task.getLocalPath(), e);
        }
    }

    private String remoteName() {
        String remotePath = task.getRemotePath();
        return remotePath.substring(remotePath.lastIndexOf('/') + 1);
    }
}
