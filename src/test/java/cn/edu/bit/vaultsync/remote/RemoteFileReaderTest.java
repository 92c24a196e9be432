package cn.edu.bit.vaultsync.remote;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import cn.edu.bit.vaultsync.crypto.CipherAlgorithm;
import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.db.DatabaseFactory;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.service.LocalObjectStore;

public class RemoteFileReaderTest {
    private static final String SECRET = "s3cret";

    @TempDir
    Path tempDir;

    private DatabaseFactory databaseFactory;
    private LocalObjectStore store;
    private final CipherSuite cipherSuite = new CipherSuite(3, 3);
    private byte[] content;

    @BeforeEach
    public void setup() {
        databaseFactory = new DatabaseFactory(tempDir.resolve("store.db").toString(), 2);
        store = new LocalObjectStore(databaseFactory, tempDir.resolve("data").toFile(),
                tempDir.resolve("tmp").toFile(), 4 * 1024 * 1024);
        // 跨越多个读取块
        content = new byte[3 * RemoteFileReader.BLOCK_SIZE + 1234];
        new Random(1).nextBytes(content);
    }

    @AfterEach
    public void teardown() {
        databaseFactory.shutdown();
    }

    private String put(CipherAlgorithm algorithm) throws Exception {
        byte[] stored;
        if (algorithm.isEncrypted()) {
            try (InputStream in = cipherSuite.encryptingStream(new ByteArrayInputStream(content), SECRET, algorithm,
                    content.length)) {
                stored = in.readAllBytes();
            }
        } else {
            stored = content;
        }
        String path = "/" + algorithm + ".bin";
        store.combineChunks(path, List.of(store.uploadChunk(path, 0, stored)), 1);
        return path;
    }

    @ParameterizedTest
    @EnumSource(CipherAlgorithm.class)
    public void testReadWholeFile(CipherAlgorithm algorithm) throws Exception {
        RemoteFileReader reader = RemoteFileReader.open(store, cipherSuite, put(algorithm), SECRET);
        assertEquals(algorithm.isEncrypted(), reader.isDecrypting());
        assertEquals(content.length, reader.plainLength());
        try (InputStream in = reader.openStream()) {
            assertArrayEquals(content, in.readAllBytes());
        }
    }

    @Test
    public void testRangesOnRandomAccessCiphers() throws Exception {
        for (CipherAlgorithm algorithm : List.of(CipherAlgorithm.NONE, CipherAlgorithm.SIMPLE,
                CipherAlgorithm.CHACHA20)) {
            RemoteFileReader reader = RemoteFileReader.open(store, cipherSuite, put(algorithm), SECRET);
            assertTrue(reader.supportsRanges());
            long offset = RemoteFileReader.BLOCK_SIZE - 7;
            int length = RemoteFileReader.BLOCK_SIZE + 100;
            try (InputStream in = reader.openStream(offset, length)) {
                assertArrayEquals(Arrays.copyOfRange(content, (int) offset, (int) offset + length), in.readAllBytes(),
                        algorithm.name());
            }
        }
    }

    @Test
    public void testSequentialCipherOnlyFromStart() throws Exception {
        RemoteFileReader reader = RemoteFileReader.open(store, cipherSuite, put(CipherAlgorithm.AES256CBC), SECRET);
        assertFalse(reader.supportsRanges());
        assertThrows(IllegalArgumentException.class, () -> reader.openStream(16, 16));
        try (InputStream in = reader.openStream(0, 100)) {
            assertArrayEquals(Arrays.copyOf(content, 100), in.readAllBytes());
        }
    }

    @Test
    public void testWithoutSecretReturnsStoredBytes() throws Exception {
        RemoteFileReader reader = RemoteFileReader.open(store, cipherSuite, put(CipherAlgorithm.CHACHA20), null);
        assertFalse(reader.isDecrypting());
        assertTrue(reader.envelope().isEncrypted());
        assertEquals(reader.info().size(), reader.plainLength());
    }

    @Test
    public void testOutOfRange() throws Exception {
        RemoteFileReader reader = RemoteFileReader.open(store, cipherSuite, put(CipherAlgorithm.NONE), null);
        assertThrows(IllegalArgumentException.class, () -> reader.openStream(content.length - 1, 2));
        assertThrows(IllegalArgumentException.class, () -> reader.openStream(-1, 1));
    }

    @Test
    public void testMissingAndDirectory() throws Exception {
        store.createFolder("/folder");
        assertEquals(RemoteException.NOT_FOUND, assertThrows(RemoteException.class,
                () -> RemoteFileReader.open(store, cipherSuite, "/nope", null)).getErrorCode());
        assertEquals(RemoteException.INVALID_ARGUMENT, assertThrows(RemoteException.class,
                () -> RemoteFileReader.open(store, cipherSuite, "/folder", null)).getErrorCode());
    }
}
