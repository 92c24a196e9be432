package cn.edu.bit.vaultsync;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.io.TempDir;

import cn.edu.bit.vaultsync.crypto.CipherAlgorithm;
import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.db.ChunkLedgerDao;
import cn.edu.bit.vaultsync.db.DatabaseFactory;
import cn.edu.bit.vaultsync.service.LocalObjectStore;
import cn.edu.bit.vaultsync.service.ObjectMetadataService;
import cn.edu.bit.vaultsync.session.AccountContext;
import cn.edu.bit.vaultsync.transfer.ChunkLedger;
import cn.edu.bit.vaultsync.transfer.ProgressListener;
import cn.edu.bit.vaultsync.transfer.TaskStatus;
import cn.edu.bit.vaultsync.transfer.TransferResult;
import cn.edu.bit.vaultsync.transfer.TransferScheduler;
import cn.edu.bit.vaultsync.transfer.TransferSettings;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PerformanceTest {

    @TempDir
    static Path tempDir;

    private DatabaseFactory databaseFactory;
    private ObjectMetadataService metadataService;
    private LocalObjectStore store;
    private final String TEST_ROOT_NAME = "PerfTestRoot";

    @BeforeAll
    public void setup() throws Exception {
        databaseFactory = new DatabaseFactory(tempDir.resolve("perf.db").toString(), 10);
        metadataService = new ObjectMetadataService(databaseFactory);
        store = new LocalObjectStore(databaseFactory, tempDir.resolve("data").toFile(),
                tempDir.resolve("tmp").toFile(), 8 * 1024 * 1024);
        metadataService.mkdirs("/" + TEST_ROOT_NAME);
    }

    @AfterAll
    public void teardown() {
        databaseFactory.shutdown();
    }

    @Test
    public void testDeepPathResolutionPerformance() throws Exception {
        var path = new StringBuilder("/" + TEST_ROOT_NAME);
        for (int level = 0; level < 50; level++) {
            path.append("/level_").append(level);
        }
        metadataService.mkdirs(path.toString());
        timeResolve("depth-50 path", path.toString(), 1000);
    }

    @Test
    public void testWideDirectoryPerformance() throws Exception {
        String wide = "/" + TEST_ROOT_NAME + "/Wide";
        int children = 1000;
        for (int i = 0; i < children; i++) {
            metadataService.mkdirs(wide + "/child_" + i);
        }
        assertEquals(children, store.list(wide).size());
        timeResolve("last child of " + children, wide + "/child_" + (children - 1), 100);
    }

    private void timeResolve(String label, String path, int iterations) throws Exception {
        for (int i = 0; i < 10; i++) {
            metadataService.resolvePath(path);
        }
        long begin = System.nanoTime();
        for (int i = 0; i < iterations; i++) {
            assertNotNull(metadataService.resolvePath(path));
        }
        double elapsedMs = (System.nanoTime() - begin) / 1_000_000.0;
        System.out.printf("Resolved %s %d times in %.2f ms (%.4f ms/op)%n", label, iterations, elapsedMs,
                elapsedMs / iterations);
    }

    @Test
    public void testConcurrentAccess() throws InterruptedException {
        int threads = 20;
        int loops = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        var errors = new AtomicInteger();

        long start = System.currentTimeMillis();
        for (int i = 0; i < threads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    String folder = "/" + TEST_ROOT_NAME + "/Thread_" + threadId;
                    metadataService.mkdirs(folder);
                    for (int j = 0; j < loops; j++) {
                        metadataService.resolvePath(folder);
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                    e.printStackTrace();
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        long end = System.currentTimeMillis();

        assertEquals(0, errors.get());
        System.out.println("Concurrent test finished in " + (end - start) + " ms");
    }

    @Test
    public void testEncryptedUploadThroughput() throws Exception {
        byte[] content = new byte[16 * 1024 * 1024];
        new Random(0).nextBytes(content);
        Path local = Files.write(tempDir.resolve("throughput.bin"), content);

        var context = new AccountContext(1, "perf", "/", "perf-secret", CipherAlgorithm.CHACHA20, 3);
        var settings = TransferSettings.defaults().withChunkSize(1024 * 1024).withConcurrency(8, 8);
        try (var scheduler = new TransferScheduler(store, new CipherSuite(3, 3),
                new ChunkLedger(new ChunkLedgerDao(databaseFactory.getDataSource())), null, settings)) {
            long start = System.nanoTime();
            TransferResult result = scheduler.upload(context, local, "/" + TEST_ROOT_NAME + "/throughput.bin",
                    ProgressListener.NONE).future().get(120, TimeUnit.SECONDS);
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

            assertEquals(TaskStatus.COMPLETED, result.status());
            System.out.printf("Uploaded %d MiB with %s in %.2f s (%.1f MiB/s)%n", content.length >> 20,
                    context.algorithm(), seconds, (content.length >> 20) / seconds);
        }
    }
}
