package cn.edu.bit.vaultsync.service;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import cn.edu.bit.vaultsync.db.DatabaseFactory;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.fingerprint.FileFingerprint;
import cn.edu.bit.vaultsync.fingerprint.FingerprintCalculator;
import cn.edu.bit.vaultsync.remote.RemoteFileInfo;

public class LocalObjectStoreTest {
    @TempDir
    Path tempDir;

    private DatabaseFactory databaseFactory;
    private LocalObjectStore store;
    private File dataDirectory;

    @BeforeEach
    public void setup() {
        databaseFactory = new DatabaseFactory(tempDir.resolve("store.db").toString(), 2);
        dataDirectory = tempDir.resolve("data").toFile();
        store = new LocalObjectStore(databaseFactory, dataDirectory, tempDir.resolve("tmp").toFile(), 1024);
    }

    @AfterEach
    public void teardown() {
        databaseFactory.shutdown();
    }

    private RemoteFileInfo put(String path, String content, long mtime) throws Exception {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        String token = store.uploadChunk(path, 0, bytes);
        return store.combineChunks(path, List.of(token), mtime);
    }

    private int blobCount() {
        return Objects.requireNonNull(dataDirectory.list()).length;
    }

    @Test
    public void testCombineChunksInOrder() throws Exception {
        String first = store.uploadChunk("/docs/a.txt", 0, "hello ".getBytes(StandardCharsets.UTF_8));
        String second = store.uploadChunk("/docs/a.txt", 1, "world".getBytes(StandardCharsets.UTF_8));
        RemoteFileInfo info = store.combineChunks("/docs/a.txt", List.of(first, second), 1234);

        assertEquals("/docs/a.txt", info.path());
        assertEquals(11, info.size());
        assertEquals(1234, info.mtimeSeconds());
        assertEquals("5eb63bbbe01eeed093cb22bb8f5acdc3", info.md5());
        assertEquals("hello world", new String(store.readRange("/docs/a.txt", 0, 100), StandardCharsets.UTF_8));
        assertEquals("world", new String(store.readRange("/docs/a.txt", 6, 5), StandardCharsets.UTF_8));
        assertEquals(0, store.readRange("/docs/a.txt", 11, 5).length);

        RemoteFileInfo folder = store.stat("/docs").orElseThrow();
        assertTrue(folder.directory());
    }

    @Test
    public void testOversizedChunkRejected() {
        var error = assertThrows(RemoteException.class, () -> store.uploadChunk("/big", 0, new byte[1025]));
        assertEquals(RemoteException.INVALID_ARGUMENT, error.getErrorCode());
    }

    @Test
    public void testUnknownTokenRejected() throws Exception {
        var error = assertThrows(RemoteException.class,
                () -> store.combineChunks("/x", List.of("0123456789abcdef0123456789abcdef"), 1));
        assertEquals(RemoteException.NOT_FOUND, error.getErrorCode());
        assertTrue(store.stat("/x").isEmpty());
    }

    @Test
    public void testIdenticalContentStoredOnce() throws Exception {
        put("/a.txt", "same content", 1);
        put("/b/c.txt", "same content", 2);
        assertEquals(1, blobCount());

        store.delete("/a.txt");
        assertEquals(1, blobCount());
        assertEquals("same content", new String(store.readRange("/b/c.txt", 0, 64), StandardCharsets.UTF_8));

        store.delete("/b");
        assertEquals(0, blobCount());
        assertTrue(store.stat("/b/c.txt").isEmpty());
    }

    @Test
    public void testOverwriteReleasesOldContent() throws Exception {
        put("/a.txt", "version one", 1);
        put("/a.txt", "version two!", 2);
        assertEquals(1, blobCount());
        RemoteFileInfo info = store.stat("/a.txt").orElseThrow();
        assertEquals(12, info.size());
        assertEquals(2, info.mtimeSeconds());
    }

    @Test
    public void testSameChunkForDifferentTargets() throws Exception {
        byte[] shared = "shared head ".getBytes(StandardCharsets.UTF_8);
        String firstHead = store.uploadChunk("/a.bin", 0, shared);
        String secondHead = store.uploadChunk("/b.bin", 0, shared);
        assertEquals(firstHead, secondHead);
        String secondTail = store.uploadChunk("/b.bin", 1, "of b".getBytes(StandardCharsets.UTF_8));
        store.combineChunks("/b.bin", List.of(secondHead, secondTail), 1);

        // 另一路径合并后，本路径已上传的分块仍然可用
        String firstTail = store.uploadChunk("/a.bin", 1, "of a".getBytes(StandardCharsets.UTF_8));
        store.combineChunks("/a.bin", List.of(firstHead, firstTail), 2);
        assertEquals("shared head of a", new String(store.readRange("/a.bin", 0, 64), StandardCharsets.UTF_8));
        assertEquals("shared head of b", new String(store.readRange("/b.bin", 0, 64), StandardCharsets.UTF_8));

        // 合并后分块被清理
        var error = assertThrows(RemoteException.class,
                () -> store.combineChunks("/a.bin", List.of(firstHead, firstTail), 3));
        assertEquals(RemoteException.NOT_FOUND, error.getErrorCode());
    }

    @Test
    public void testFailedOverwriteKeepsOldContent() throws Exception {
        put("/a.txt", "version one", 1);
        var failing = new LocalObjectStore(databaseFactory, dataDirectory, tempDir.resolve("tmp").toFile(), 1024) {
            @Override
            void moveIntoPlace(StagedObject stagedObject, File target) throws IOException {
                throw new IOException("disk full");
            }
        };
        String token = failing.uploadChunk("/a.txt", 0, "version two!".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> failing.combineChunks("/a.txt", List.of(token), 2));

        RemoteFileInfo info = store.stat("/a.txt").orElseThrow();
        assertEquals(11, info.size());
        assertEquals(1, info.mtimeSeconds());
        assertEquals("version one", new String(store.readRange("/a.txt", 0, 64), StandardCharsets.UTF_8));
        assertEquals(1, blobCount());
    }

    @Test
    public void testRapidUpload() throws Exception {
        RemoteFileInfo original = put("/a.txt", "rapid", 1);
        FileFingerprint fingerprint = new FingerprintCalculator()
                .compute(new ByteArrayInputStream("rapid".getBytes(StandardCharsets.UTF_8)), "copy.txt");
        assertEquals(original.md5(), fingerprint.contentMd5());

        RemoteFileInfo copy = store.rapidUpload("/copy.txt", fingerprint, 5).orElseThrow();
        assertEquals(5, copy.size());
        assertEquals("rapid", new String(store.readRange("/copy.txt", 0, 5), StandardCharsets.UTF_8));

        var unknown = new FileFingerprint("0123456789abcdef0123456789abcdef", "0123456789abcdef0123456789abcdef", 0,
                5, "x");
        assertTrue(store.rapidUpload("/x.txt", unknown, 1).isEmpty());
        // 大小不一致视为未命中
        assertTrue(store.rapidUpload("/y.txt", new FileFingerprint(fingerprint.contentMd5(), fingerprint.sliceMd5(),
                0, 6, "y"), 1).isEmpty());
    }

    @Test
    public void testListAndErrors() throws Exception {
        put("/dir/one.txt", "1", 1);
        put("/dir/two.txt", "2", 1);
        store.createFolder("/dir/sub");

        var names = store.list("/dir").stream().map(RemoteFileInfo::path).sorted().toList();
        assertEquals(List.of("/dir/one.txt", "/dir/sub", "/dir/two.txt"), names);

        assertEquals(RemoteException.NOT_FOUND,
                assertThrows(RemoteException.class, () -> store.list("/missing")).getErrorCode());
        assertEquals(RemoteException.INVALID_ARGUMENT,
                assertThrows(RemoteException.class, () -> store.list("/dir/one.txt")).getErrorCode());
        assertEquals(RemoteException.INVALID_ARGUMENT,
                assertThrows(RemoteException.class, () -> store.readRange("/dir", 0, 1)).getErrorCode());
        assertEquals(RemoteException.PERMISSION_DENIED,
                assertThrows(RemoteException.class, () -> store.delete("/")).getErrorCode());
        assertEquals(RemoteException.ALREADY_EXISTS,
                assertThrows(RemoteException.class, () -> put("/dir/sub", "x", 1)).getErrorCode());
    }

    @Test
    public void testSplitPath() {
        assertEquals(List.of("a", "b"), ObjectMetadataService.splitPath("/a//b/"));
        assertEquals(List.of(), ObjectMetadataService.splitPath("/"));
    }
}
