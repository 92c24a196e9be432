package cn.edu.bit.vaultsync.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/**
 * 任意区间解密应与完整解密的对应部分一致
 */
public class RangeDecryptionPropertiesTest {
    private static final String SECRET = "range-secret";
    private static final CipherSuite SUITE = new CipherSuite();

    @Property(tries = 200)
    void simpleCipherDecryptsAnyRange(@ForAll @Size(min = 1, max = 2000) byte[] plain,
            @ForAll @IntRange(min = 0, max = 1999) int start, @ForAll @IntRange(min = 0, max = 2000) int length) {
        Assume.that(start < plain.length);
        int end = Math.min(plain.length, start + length);

        EncryptorSession session = SUITE.openEncryptor(SECRET, CipherAlgorithm.SIMPLE, plain.length);
        byte[] ciphertext = session.cipher().update(plain);
        byte[] range = SUITE.decryptRange(SECRET, session.envelope(), start, Arrays.copyOfRange(ciphertext, start, end));

        assertArrayEquals(Arrays.copyOfRange(plain, start, end), range);
    }

    @Property(tries = 50)
    void chachaDecryptsAnyAlignedRange(@ForAll @Size(min = 1, max = 4096) byte[] plain,
            @ForAll @IntRange(min = 0, max = 63) int block) {
        int start = block * ChaCha20Cipher.BLOCK_SIZE;
        Assume.that(start < plain.length);

        EncryptorSession session = SUITE.openEncryptor(SECRET, CipherAlgorithm.CHACHA20, plain.length);
        byte[] ciphertext = session.cipher().update(plain);
        byte[] range = SUITE.decryptRange(SECRET, session.envelope(), start,
                Arrays.copyOfRange(ciphertext, start, plain.length));

        assertArrayEquals(Arrays.copyOfRange(plain, start, plain.length), range);
    }

    @Property(tries = 100)
    void simpleTableIsAPermutation(@ForAll @Size(min = 1, max = 64) byte[] key) {
        byte[] table = SimpleCipher.permutation(key);
        boolean[] seen = new boolean[256];
        for (byte b : table) {
            seen[b & 0xFF] = true;
        }
        for (boolean value : seen) {
            assertTrue(value);
        }
        byte[] inverse = SimpleCipher.inverse(table);
        for (int i = 0; i < 256; i++) {
            assertEquals(i, inverse[table[i] & 0xFF] & 0xFF);
        }
    }
}
