package cn.edu.bit.vaultsync.sync;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import cn.edu.bit.vaultsync.crypto.CipherAlgorithm;
import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.db.ChunkLedgerDao;
import cn.edu.bit.vaultsync.db.DatabaseFactory;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.service.LocalObjectStore;
import cn.edu.bit.vaultsync.session.AccountContext;
import cn.edu.bit.vaultsync.transfer.ChunkLedger;
import cn.edu.bit.vaultsync.transfer.TransferScheduler;
import cn.edu.bit.vaultsync.transfer.TransferSettings;

public class SyncServiceTest {
    private static final AccountContext PLAIN = AccountContext.plain(1, "alice");

    @TempDir
    Path tempDir;

    private DatabaseFactory databaseFactory;
    private LocalObjectStore store;
    private TransferScheduler scheduler;
    private SyncService syncService;
    private Path localDir;

    @BeforeEach
    public void setup() throws Exception {
        databaseFactory = new DatabaseFactory(tempDir.resolve("vaultsync.db").toString(), 4);
        store = new LocalObjectStore(databaseFactory, tempDir.resolve("data").toFile(),
                tempDir.resolve("tmp").toFile(), 1024 * 1024);
        scheduler = new TransferScheduler(store, new CipherSuite(3, 3),
                new ChunkLedger(new ChunkLedgerDao(databaseFactory.getDataSource())), null,
                TransferSettings.defaults().withChunkSize(4096));
        syncService = new SyncService(store, scheduler);

        localDir = tempDir.resolve("local");
        Files.createDirectories(localDir.resolve("sub"));
        Files.writeString(localDir.resolve("a.txt"), "alpha");
        Files.writeString(localDir.resolve("sub/b.txt"), "bravo".repeat(2000));
    }

    @AfterEach
    public void teardown() {
        scheduler.close();
        databaseFactory.shutdown();
    }

    private String remoteText(String path) throws Exception {
        long size = store.stat(path).orElseThrow().size();
        return new String(store.readRange(path, 0, (int) size), StandardCharsets.UTF_8);
    }

    @Test
    public void testInitialSyncUploadsEverything() throws Exception {
        SyncReport report = syncService.sync(PLAIN, localDir, "/backup");
        assertTrue(report.isSuccessful());
        assertEquals(2, report.count(SyncAction.CREATE_REMOTE));
        assertEquals(List.of("a.txt", "sub/b.txt"), report.uploaded().stream().sorted().toList());
        assertEquals("alpha", remoteText("/backup/a.txt"));
        assertEquals("bravo".repeat(2000), remoteText("/backup/sub/b.txt"));
    }

    @Test
    public void testSecondSyncSkipsUnchangedFiles() throws Exception {
        syncService.sync(PLAIN, localDir, "/backup");
        SyncReport report = syncService.sync(PLAIN, localDir, "/backup");
        assertEquals(2, report.count(SyncAction.SKIP));
        assertTrue(report.uploaded().isEmpty());
        assertTrue(report.deleted().isEmpty());
    }

    @Test
    public void testSyncUpdatesCreatesAndDeletes() throws Exception {
        syncService.sync(PLAIN, localDir, "/backup");

        Files.writeString(localDir.resolve("a.txt"), "alpha, but longer");
        Files.delete(localDir.resolve("sub/b.txt"));
        Files.writeString(localDir.resolve("c.txt"), "charlie");

        SyncReport report = syncService.sync(PLAIN, localDir, "/backup");
        assertTrue(report.isSuccessful(), () -> report.failures().toString());
        assertEquals(List.of(new SyncDiffEntry("a.txt", SyncAction.UPDATE_REMOTE),
                new SyncDiffEntry("c.txt", SyncAction.CREATE_REMOTE),
                new SyncDiffEntry("sub/b.txt", SyncAction.DELETE_REMOTE)), report.plan());
        assertEquals(List.of("sub/b.txt"), report.deleted());

        assertEquals("alpha, but longer", remoteText("/backup/a.txt"));
        assertEquals("charlie", remoteText("/backup/c.txt"));
        assertTrue(store.stat("/backup/sub/b.txt").isEmpty());
    }

    @Test
    public void testEncryptedSyncComparesCiphertextSizes() throws Exception {
        var context = new AccountContext(1, "alice", "/", "s3cret", CipherAlgorithm.AES256CBC, 3);
        SyncReport first = syncService.sync(context, localDir, "/vault");
        assertTrue(first.isSuccessful());
        assertEquals(CipherSuite.encryptedLength(CipherAlgorithm.AES256CBC, 3, 5),
                store.stat("/vault/a.txt").orElseThrow().size());

        SyncReport second = syncService.sync(context, localDir, "/vault");
        assertEquals(2, second.count(SyncAction.SKIP));
    }

    @Test
    public void testRelativeRemoteDirUsesWorkingDir() throws Exception {
        syncService.sync(PLAIN.withWorkingDir("/home"), localDir, "backup");
        assertTrue(store.stat("/home/backup/a.txt").isPresent());
    }

    @Test
    public void testRemoteFileAsTargetIsRejected() throws Exception {
        syncService.sync(PLAIN, localDir, "/backup");
        var error = assertThrows(RemoteException.class, () -> syncService.sync(PLAIN, localDir, "/backup/a.txt"));
        assertEquals(RemoteException.INVALID_ARGUMENT, error.getErrorCode());
    }

    @Test
    public void testJoin() {
        assertEquals("/a/b.txt", SyncService.join("/a", "b.txt"));
        assertEquals("/b.txt", SyncService.join("/", "b.txt"));
    }
}
