package cn.edu.bit.vaultsync.fingerprint;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import cn.edu.bit.vaultsync.exception.MalformedHashLinkException;

public class HashLinkCodecTest {
    private static final String MD5 = "0123456789abcdef0123456789abcdef";
    private static final String SLICE = "fedcba9876543210fedcba9876543210";

    private final FileFingerprint fingerprint = new FileFingerprint(MD5, SLICE, 123456789L, 1048576L,
            "my movie.mkv");

    @Test
    public void testEncodeCs3l() {
        assertEquals("cs3l://" + MD5 + "#" + SLICE + "#123456789#1048576#my%20movie.mkv",
                HashLinkCodec.encode(fingerprint, HashLinkProtocol.CS3L));
    }

    @Test
    public void testEncodeShort() {
        assertEquals(MD5 + "#" + SLICE + "#1048576#my movie.mkv",
                HashLinkCodec.encode(fingerprint, HashLinkProtocol.SHORT));
    }

    @Test
    public void testEncodeBdpan() {
        String link = HashLinkCodec.encode(fingerprint, HashLinkProtocol.BDPAN);
        assertTrue(link.startsWith("bdpan://"));
        String raw = new String(Base64.getDecoder().decode(link.substring("bdpan://".length())),
                StandardCharsets.UTF_8);
        assertEquals("my movie.mkv|1048576|" + MD5 + "|" + SLICE, raw);
    }

    @ParameterizedTest
    @EnumSource(HashLinkProtocol.class)
    public void testRoundTrip(HashLinkProtocol protocol) throws MalformedHashLinkException {
        String link = HashLinkCodec.encode(fingerprint, protocol);
        assertEquals(protocol, HashLinkCodec.detect(link));
        FileFingerprint decoded = HashLinkCodec.decode(link);
        FileFingerprint expected = protocol == HashLinkProtocol.CS3L ? fingerprint : fingerprint.withoutCrc32();
        assertEquals(expected, decoded);
    }

    @Test
    public void testBdpanFilenameWithSeparator() throws MalformedHashLinkException {
        var tricky = fingerprint.withFilename("a|b|c.txt");
        FileFingerprint decoded = HashLinkCodec.decode(HashLinkCodec.encode(tricky, HashLinkProtocol.BDPAN));
        assertEquals("a|b|c.txt", decoded.filename());
        assertEquals(MD5, decoded.contentMd5());
        assertEquals(1048576L, decoded.length());
    }

    @Test
    public void testUppercaseHashesNormalized() throws MalformedHashLinkException {
        FileFingerprint decoded = HashLinkCodec.decode(MD5.toUpperCase() + "#" + SLICE.toUpperCase() + "#10#a.bin");
        assertEquals(MD5, decoded.contentMd5());
        assertEquals(SLICE, decoded.sliceMd5());
    }

    @Test
    public void testExplicitFilenameWins() throws MalformedHashLinkException {
        String link = HashLinkCodec.encode(fingerprint, HashLinkProtocol.SHORT);
        assertEquals("renamed.mkv", HashLinkCodec.decode(link, "renamed.mkv").filename());
        assertEquals("my movie.mkv", HashLinkCodec.decode(link, "").filename());
    }

    @Test
    public void testCs3lEmptyCrcMeansAbsent() throws MalformedHashLinkException {
        FileFingerprint decoded = HashLinkCodec.decode("cs3l://" + MD5 + "#" + SLICE + "##42#x.bin");
        assertFalse(decoded.hasCrc32());
        assertEquals(42, decoded.length());
    }

    @Test
    public void testShortDecodesEncodedSpaces() throws MalformedHashLinkException {
        assertEquals("a b.txt", HashLinkCodec.decode(MD5 + "#" + SLICE + "#1#a%20b.txt").filename());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "cs3l://0123#abcd#1#2#x",
            "cs3l://0123456789abcdef0123456789abcdef#fedcba9876543210fedcba9876543210#1#2",
            "0123456789abcdef0123456789abcdef#fedcba9876543210fedcba9876543210#-5#x",
            "0123456789abcdef0123456789abcdef#fedcba9876543210fedcba9876543210#ten#x",
            "zz23456789abcdef0123456789abcdef#fedcba9876543210fedcba9876543210#1#x",
            "cs3l://0123456789abcdef0123456789abcdef#fedcba9876543210fedcba9876543210#99999999999#2#x",
            "bdpan://!!!notbase64",
            "bdpan://YWJj" })
    public void testMalformedLinks(String link) {
        assertThrows(MalformedHashLinkException.class, () -> HashLinkCodec.decode(link));
    }
}
