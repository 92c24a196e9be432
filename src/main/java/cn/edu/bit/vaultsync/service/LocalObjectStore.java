package cn.edu.bit.vaultsync.service;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.config.VaultSyncConfig;
import cn.edu.bit.vaultsync.db.DatabaseFactory;
import cn.edu.bit.vaultsync.db.InsertFileResult;
import cn.edu.bit.vaultsync.entity.ObjectNodeEntity;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.fingerprint.FileFingerprint;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.remote.RemoteFileInfo;
import cn.edu.bit.vaultsync.utils.HexUtils;

/**
 * 本地内容寻址对象存储
 * <p>
 * 数据文件以内容 MD5 命名存放在数据目录，多个路径引用同一内容时只存一份；
 * 分块上传时每个分块以自身 MD5 为凭证暂存在临时目录下按目标路径划分的子目录，合并时按顺序拼接。
 * 不同目标路径的上传即使分块内容相同也互不影响。
 */
public class LocalObjectStore implements RemoteEndpoint {
    private static final Logger logger = LoggerFactory.getLogger(LocalObjectStore.class);

    private final ObjectMetadataService metadataService;
    private final File dataDirectory;
    private final File tmpDirectory;
    private final File chunkDirectory;
    private final long maxChunkSize;
    // 数据文件的落盘、登记和删除串行进行
    private final Object blobLock = new Object();

    public LocalObjectStore(DatabaseFactory databaseFactory, File dataDirectory, File tmpDirectory,
            long maxChunkSize) {
        this.metadataService = new ObjectMetadataService(databaseFactory);
        this.dataDirectory = dataDirectory;
        this.tmpDirectory = tmpDirectory;
        this.chunkDirectory = new File(tmpDirectory, "chunks");
        this.maxChunkSize = maxChunkSize;
        for (var directory : List.of(dataDirectory, tmpDirectory, chunkDirectory)) {
            if (!directory.exists()) {
                directory.mkdirs();
            }
        }
    }

    public static LocalObjectStore fromConfig(VaultSyncConfig config, DatabaseFactory databaseFactory) {
        return new LocalObjectStore(databaseFactory, new File(config.getDataDirectory()),
                new File(config.getTmpDirectory()), config.getStoreMaxChunkSize());
    }

    /**
     * 解析远端路径
     *
     * @return 节点，不存在时返回 null
     */
    public ObjectNodeEntity resolvePath(String path) throws IOException {
        try {
            return metadataService.resolvePath(path);
        } catch (SQLException e) {
            throw new IOException("Failed to resolve path: " + path, e);
        }
    }

    public void createFolder(String path) throws IOException, RemoteException {
        try {
            metadataService.mkdirs(path);
        } catch (IllegalArgumentException e) {
            throw new RemoteException(RemoteException.ALREADY_EXISTS, e.getMessage());
        } catch (SQLException e) {
            throw new IOException("Failed to create folder: " + path, e);
        }
    }

    @Override
    public Optional<RemoteFileInfo> stat(String path) throws IOException {
        ObjectNodeEntity node = resolvePath(path);
        return Optional.ofNullable(node).map(entity -> toInfo(normalize(path), entity));
    }

    @Override
    public List<RemoteFileInfo> list(String directory) throws IOException, RemoteException {
        ObjectNodeEntity node = requireNode(directory);
        if (!node.folder()) {
            throw new RemoteException(RemoteException.INVALID_ARGUMENT, "Not a directory: " + directory);
        }
        String base = normalize(directory);
        String prefix = base.equals("/") ? "/" : base + "/";
        try {
            var result = new ArrayList<RemoteFileInfo>();
            for (var child : metadataService.getList(node.id())) {
                result.add(toInfo(prefix + child.name(), child));
            }
            return result;
        } catch (SQLException e) {
            throw new IOException("Failed to list directory: " + directory, e);
        }
    }

    @Override
    public long maxChunkSize() {
        return maxChunkSize;
    }

    @Override
    public String uploadChunk(String remotePath, int chunkIndex, byte[] data) throws IOException, RemoteException {
        if (data.length > maxChunkSize) {
            throw new RemoteException(RemoteException.INVALID_ARGUMENT,
                    "Chunk " + chunkIndex + " exceeds the maximum size of " + maxChunkSize + " bytes");
        }
        String token = md5Hex(data);
        File uploadDirectory = uploadDirectoryOf(remotePath);
        uploadDirectory.mkdirs();
        File target = new File(uploadDirectory, token);
        if (!target.exists()) {
            // 先写临时文件再原子改名，同内容的分块可能被并发上传
            File temporary = File.createTempFile("chunk_", ".tmp", uploadDirectory);
            try {
                Files.write(temporary.toPath(), data);
                Files.move(temporary.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temporary.toPath());
            }
        }
        logger.debug("Stored chunk {} of {} as {}", chunkIndex, remotePath, token);
        return token;
    }

    @Override
    public RemoteFileInfo combineChunks(String remotePath, List<String> tokens, long mtimeSeconds)
            throws IOException, RemoteException {
        File uploadDirectory = uploadDirectoryOf(remotePath);
        var stagedObject = new StagedObject(tmpDirectory);
        try {
            for (String token : tokens) {
                File chunk = new File(uploadDirectory, token);
                if (!HexUtils.isHex(token, 32) || !chunk.exists()) {
                    throw new RemoteException(RemoteException.NOT_FOUND, "Unknown chunk token: " + token);
                }
                stagedObject.write(Files.readAllBytes(chunk.toPath()));
            }
            StagedObject.Digests digests = stagedObject.finish();
            File targetFile = new File(dataDirectory, digests.contentMd5());

            synchronized (blobLock) {
                // 先落盘再登记，落盘失败时路径仍指向原有内容
                boolean placed = false;
                if (targetFile.exists()) {
                    stagedObject.delete();
                } else {
                    moveIntoPlace(stagedObject, targetFile);
                    placed = true;
                }
                InsertFileResult result;
                try {
                    result = register(remotePath, digests.contentMd5(), digests.sliceMd5(),
                            stagedObject.getSize(), mtimeSeconds);
                } catch (IOException | RemoteException e) {
                    if (placed) {
                        Files.deleteIfExists(targetFile.toPath());
                    }
                    throw e;
                }
                removeBlobs(result.deletedHashes());
            }
            removeChunks(uploadDirectory, tokens);
            logger.info("Combined {} chunks into {} ({} bytes)", tokens.size(), remotePath, stagedObject.getSize());
            return new RemoteFileInfo(normalize(remotePath), stagedObject.getSize(), mtimeSeconds, false,
                    digests.contentMd5());
        } catch (IOException | RemoteException | RuntimeException e) {
            stagedObject.abort();
            throw e;
        }
    }

    @Override
    public Optional<RemoteFileInfo> rapidUpload(String remotePath, FileFingerprint fingerprint, long mtimeSeconds)
            throws IOException, RemoteException {
        synchronized (blobLock) {
            try {
                if (!metadataService.existsByHash(fingerprint.contentMd5(), fingerprint.sliceMd5(),
                        fingerprint.length())) {
                    return Optional.empty();
                }
            } catch (IllegalStateException e) {
                // 哈希碰撞时按未命中处理，走正常上传
                logger.warn("Rapid upload rejected for {}: {}", remotePath, e.getMessage());
                return Optional.empty();
            } catch (SQLException e) {
                throw new IOException("Failed to look up content " + fingerprint.contentMd5(), e);
            }
            InsertFileResult result = register(remotePath, fingerprint.contentMd5(), fingerprint.sliceMd5(),
                    fingerprint.length(), mtimeSeconds);
            removeBlobs(result.deletedHashes());
        }
        logger.info("Rapid upload hit for {} ({})", remotePath, fingerprint.contentMd5());
        return Optional.of(new RemoteFileInfo(normalize(remotePath), fingerprint.length(), mtimeSeconds, false,
                fingerprint.contentMd5()));
    }

    @Override
    public byte[] readRange(String path, long offset, int length) throws IOException, RemoteException {
        ObjectNodeEntity node = requireNode(path);
        if (node.folder()) {
            throw new RemoteException(RemoteException.INVALID_ARGUMENT, "Is a directory: " + path);
        }
        File file = new File(dataDirectory, node.hash());
        if (!file.exists()) {
            throw new FileNotFoundException("Physical file missing: " + file.getAbsolutePath());
        }
        try (var channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
            long fileLength = channel.size();
            if (offset >= fileLength || length <= 0) {
                return new byte[0];
            }
            // 修正长度，不超过文件末尾
            int actualLength = (int) Math.min(length, fileLength - offset);
            var buffer = ByteBuffer.allocate(actualLength);
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            return buffer.array();
        }
    }

    @Override
    public void delete(String path) throws IOException, RemoteException {
        ObjectNodeEntity node = requireNode(path);
        if (node.id() == ObjectMetadataService.ROOT_ID) {
            throw new RemoteException(RemoteException.PERMISSION_DENIED, "Cannot delete the root directory");
        }
        try {
            synchronized (blobLock) {
                removeBlobs(metadataService.deleteNode(node.id()));
            }
            logger.info("Deleted {}", path);
        } catch (SQLException e) {
            throw new IOException("Failed to delete " + path, e);
        }
    }

    private InsertFileResult register(String remotePath, String hash, String sliceMd5, long size,
            long mtimeSeconds) throws IOException, RemoteException {
        try {
            return metadataService.insertFile(remotePath, hash, sliceMd5, size, mtimeSeconds);
        } catch (IllegalArgumentException e) {
            throw new RemoteException(RemoteException.ALREADY_EXISTS, e.getMessage());
        } catch (SQLException e) {
            throw new IOException("Failed to register " + remotePath, e);
        }
    }

    /**
     * 把合并好的临时文件移动到数据目录
     */
    void moveIntoPlace(StagedObject stagedObject, File target) throws IOException {
        stagedObject.rename(target);
    }

    private File uploadDirectoryOf(String remotePath) {
        return new File(chunkDirectory, md5Hex(normalize(remotePath).getBytes(StandardCharsets.UTF_8)));
    }

    private void removeChunks(File uploadDirectory, List<String> tokens) throws IOException {
        for (String token : tokens) {
            Files.deleteIfExists(new File(uploadDirectory, token).toPath());
        }
        try {
            Files.deleteIfExists(uploadDirectory.toPath());
        } catch (DirectoryNotEmptyException e) {
            // 同一路径还有别的上传在进行
            logger.debug("Keeping chunk directory {}", uploadDirectory);
        }
    }

    private void removeBlobs(List<String> hashes) throws IOException {
        for (String hash : hashes) {
            Files.deleteIfExists(new File(dataDirectory, hash).toPath());
        }
    }

    private ObjectNodeEntity requireNode(String path) throws IOException, RemoteException {
        ObjectNodeEntity node = resolvePath(path);
        if (node == null) {
            throw new RemoteException(RemoteException.NOT_FOUND, "No such file or directory: " + path);
        }
        return node;
    }

    private static RemoteFileInfo toInfo(String path, ObjectNodeEntity entity) {
        return new RemoteFileInfo(path, entity.size(), entity.mtimeSeconds(), entity.folder(),
                entity.hash());
    }

    private static String normalize(String path) {
        return "/" + String.join("/", ObjectMetadataService.splitPath(path));
    }

    private static String md5Hex(byte[] data) {
        try {
            return HexUtils.bytesToHex(MessageDigest.getInstance("MD5").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }
}
