package cn.edu.bit.vaultsync.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import cn.edu.bit.vaultsync.exception.IncompatibleEnvelopeException;

public class CipherSuiteTest {
    private static final String SECRET = "correct horse";

    static Stream<Arguments> algorithmsAndVersions() {
        return Stream.of(CipherAlgorithm.SIMPLE, CipherAlgorithm.CHACHA20, CipherAlgorithm.AES256CBC)
                .flatMap(algorithm -> Stream.of(1, 2, 3).map(version -> Arguments.of(algorithm, version)));
    }

    private static byte[] randomBytes(int length, long seed) {
        byte[] data = new byte[length];
        new Random(seed).nextBytes(data);
        return data;
    }

    /** 版本2只能由版本2读取端读取，其余用默认读取端 */
    private static CipherSuite suiteFor(int version) {
        return version == 2 ? new CipherSuite(2, 2) : new CipherSuite(version, 3);
    }

    @ParameterizedTest
    @MethodSource("algorithmsAndVersions")
    public void testStreamRoundTrip(CipherAlgorithm algorithm, int version) throws IOException {
        CipherSuite suite = suiteFor(version);
        byte[] plain = randomBytes(100_003, version * 31L + algorithm.ordinal());

        byte[] encrypted;
        try (InputStream in = suite.encryptingStream(new ByteArrayInputStream(plain), SECRET, algorithm, version,
                plain.length)) {
            encrypted = in.readAllBytes();
        }
        assertEquals(CipherSuite.encryptedLength(algorithm, version, plain.length), encrypted.length);
        assertFalse(Arrays.equals(plain, Arrays.copyOfRange(encrypted, EnvelopeCodec.headerLength(version),
                EnvelopeCodec.headerLength(version) + plain.length)));

        EncryptionEnvelope envelope = suite.readEnvelope(encrypted);
        assertEquals(algorithm, envelope.algorithm());
        assertEquals(version, envelope.formatVersion());
        assertEquals(plain.length, envelope.originalLength());

        byte[] decrypted;
        try (InputStream in = suite.decryptingStream(new ByteArrayInputStream(encrypted), SECRET)) {
            decrypted = in.readAllBytes();
        }
        assertArrayEquals(plain, decrypted);
    }

    @ParameterizedTest
    @EnumSource(value = CipherAlgorithm.class, names = { "SIMPLE", "CHACHA20", "AES256CBC" })
    public void testEmptyInputRoundTrip(CipherAlgorithm algorithm) throws IOException {
        var suite = new CipherSuite();
        byte[] encrypted = suite.encryptingStream(new ByteArrayInputStream(new byte[0]), SECRET, algorithm, 0)
                .readAllBytes();
        assertEquals(CipherSuite.encryptedLength(algorithm, 3, 0), encrypted.length);
        byte[] decrypted = suite.decryptingStream(new ByteArrayInputStream(encrypted), SECRET).readAllBytes();
        assertEquals(0, decrypted.length);
    }

    @Test
    public void testUnencryptedDataPassesThrough() throws IOException {
        var suite = new CipherSuite();
        byte[] plain = "just some text, no envelope".getBytes(StandardCharsets.UTF_8);
        byte[] read = suite.decryptingStream(new ByteArrayInputStream(plain), SECRET).readAllBytes();
        assertArrayEquals(plain, read);
        assertFalse(suite.readEnvelope(plain).isEncrypted());
    }

    @Test
    public void testMissingSecretReturnsRawBytes() throws IOException {
        var suite = new CipherSuite();
        byte[] plain = randomBytes(1000, 7);
        byte[] encrypted = suite.encryptingStream(new ByteArrayInputStream(plain), SECRET, CipherAlgorithm.CHACHA20,
                plain.length).readAllBytes();
        byte[] raw = suite.decryptingStream(new ByteArrayInputStream(encrypted), null).readAllBytes();
        assertArrayEquals(encrypted, raw);
    }

    @Test
    public void testWrongSecretDoesNotRecoverPlaintext() throws IOException {
        var suite = new CipherSuite();
        byte[] plain = randomBytes(4096, 11);
        byte[] encrypted = suite.encryptingStream(new ByteArrayInputStream(plain), SECRET, CipherAlgorithm.CHACHA20,
                plain.length).readAllBytes();
        byte[] decrypted = suite.decryptingStream(new ByteArrayInputStream(encrypted), "wrong").readAllBytes();
        assertFalse(Arrays.equals(plain, decrypted));
    }

    @Test
    public void testVersion2EnvelopeRejectedByVersion3Reader() throws IOException {
        var writer = new CipherSuite(2, 2);
        byte[] encrypted = writer.encryptingStream(new ByteArrayInputStream(new byte[64]), SECRET,
                CipherAlgorithm.SIMPLE, 64).readAllBytes();

        var reader = new CipherSuite(3, 3);
        var error = assertThrows(IncompatibleEnvelopeException.class, () -> reader.readEnvelope(encrypted));
        assertNotNull(error.getMessage());
    }

    @Test
    public void testVersion3EnvelopeRejectedByVersion2Reader() throws IOException {
        var writer = new CipherSuite(3, 3);
        byte[] encrypted = writer.encryptingStream(new ByteArrayInputStream(new byte[64]), SECRET,
                CipherAlgorithm.SIMPLE, 64).readAllBytes();
        var reader = new CipherSuite(2, 2);
        assertThrows(IncompatibleEnvelopeException.class, () -> reader.readEnvelope(encrypted));
    }

    @Test
    public void testVersion1ReadableByAllReaders() throws IOException {
        var writer = new CipherSuite(1, 3);
        byte[] plain = randomBytes(333, 3);
        byte[] encrypted = writer.encryptingStream(new ByteArrayInputStream(plain), SECRET, CipherAlgorithm.AES256CBC,
                plain.length).readAllBytes();
        for (int readerVersion : new int[] { 1, 2, 3 }) {
            var reader = new CipherSuite(readerVersion, readerVersion);
            assertArrayEquals(plain, reader.decryptingStream(new ByteArrayInputStream(encrypted), SECRET)
                    .readAllBytes());
        }
    }

    @Test
    public void testVersion1RejectsLongSecret() {
        var suite = new CipherSuite(1, 3);
        String longSecret = "x".repeat(33);
        assertThrows(IllegalArgumentException.class,
                () -> suite.openEncryptor(longSecret, CipherAlgorithm.SIMPLE, 10));
    }

    @Test
    public void testEncryptedSecretRequired() {
        var suite = new CipherSuite();
        EncryptionEnvelope envelope = suite.newEnvelope(CipherAlgorithm.CHACHA20, 3, 10);
        assertThrows(IllegalArgumentException.class, () -> suite.deriveKeys(null, envelope));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3 })
    public void testFreshSaltPerEnvelope(int version) {
        CipherSuite suite = suiteFor(version);
        EncryptionEnvelope first = suite.newEnvelope(CipherAlgorithm.CHACHA20, version, 10);
        EncryptionEnvelope second = suite.newEnvelope(CipherAlgorithm.CHACHA20, version, 10);
        // 版本1只有 nonce，版本2/3只有盐
        byte[] firstRandom = version == 1 ? first.nonceOrIv() : first.salt();
        byte[] secondRandom = version == 1 ? second.nonceOrIv() : second.salt();
        assertTrue(firstRandom.length > 0);
        assertFalse(Arrays.equals(new byte[firstRandom.length], firstRandom));
        assertFalse(Arrays.equals(firstRandom, secondRandom));
    }

    @Test
    public void testSameSecretEncryptsDifferently() {
        var suite = new CipherSuite();
        byte[] plain = "same secret, same text".getBytes(StandardCharsets.UTF_8);
        EncryptorSession first = suite.openEncryptor(SECRET, CipherAlgorithm.CHACHA20, plain.length);
        EncryptorSession second = suite.openEncryptor(SECRET, CipherAlgorithm.CHACHA20, plain.length);
        assertFalse(Arrays.equals(first.header(), second.header()));
        assertFalse(Arrays.equals(first.cipher().update(plain), second.cipher().update(plain)));
    }

    @Test
    public void testChaChaDecryptRangeAtAlignedOffset() throws IOException {
        var suite = new CipherSuite();
        byte[] plain = randomBytes(10_000, 5);
        EncryptorSession session = suite.openEncryptor(SECRET, CipherAlgorithm.CHACHA20, plain.length);
        byte[] ciphertext = session.cipher().update(plain);

        int offset = 64 * 37;
        byte[] range = Arrays.copyOfRange(ciphertext, offset, offset + 1000);
        byte[] decrypted = suite.decryptRange(SECRET, session.envelope(), offset, range);
        assertArrayEquals(Arrays.copyOfRange(plain, offset, offset + 1000), decrypted);

        assertThrows(IllegalArgumentException.class,
                () -> suite.decryptRange(SECRET, session.envelope(), offset + 3, range));
    }

    @Test
    public void testAesDecryptRangeUnsupported() {
        var suite = new CipherSuite();
        EncryptionEnvelope envelope = suite.newEnvelope(CipherAlgorithm.AES256CBC, 3, 100);
        assertThrows(UnsupportedOperationException.class,
                () -> suite.decryptRange(SECRET, envelope, 16, new byte[16]));
    }

    @Test
    public void testAesResumeFromMiddleBlock() {
        var suite = new CipherSuite();
        byte[] plain = randomBytes(5000, 9);
        EncryptorSession session = suite.openEncryptor(SECRET, CipherAlgorithm.AES256CBC, plain.length);
        byte[] body = session.cipher().update(plain);
        byte[] tail = session.cipher().doFinal();
        byte[] ciphertext = new byte[body.length + tail.length];
        System.arraycopy(body, 0, ciphertext, 0, body.length);
        System.arraycopy(tail, 0, ciphertext, body.length, tail.length);
        assertEquals(Aes256CbcCipher.encryptedLength(plain.length), ciphertext.length);

        int offset = 16 * 100;
        var decryptor = (Aes256CbcCipher) suite.openDecryptor(SECRET, session.envelope());
        decryptor.resumeAt(offset, Arrays.copyOfRange(ciphertext, offset - 16, offset));
        byte[] first = decryptor.update(Arrays.copyOfRange(ciphertext, offset, ciphertext.length));
        byte[] last = decryptor.doFinal();
        byte[] decrypted = new byte[first.length + last.length];
        System.arraycopy(first, 0, decrypted, 0, first.length);
        System.arraycopy(last, 0, decrypted, first.length, last.length);
        assertArrayEquals(Arrays.copyOfRange(plain, offset, plain.length), decrypted);
    }

    @Test
    public void testEncryptedLength() {
        assertEquals(100, CipherSuite.encryptedLength(CipherAlgorithm.NONE, 3, 100));
        assertEquals(130, CipherSuite.encryptedLength(CipherAlgorithm.SIMPLE, 3, 100));
        assertEquals(122, CipherSuite.encryptedLength(CipherAlgorithm.CHACHA20, 2, 100));
        // 只有不足一个块时才填充
        assertEquals(30 + 112, CipherSuite.encryptedLength(CipherAlgorithm.AES256CBC, 3, 100));
        assertEquals(30 + 112, CipherSuite.encryptedLength(CipherAlgorithm.AES256CBC, 1, 112));
    }
}
