package cn.edu.bit.vaultsync.fingerprint;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.zip.CRC32;

import cn.edu.bit.vaultsync.utils.HexUtils;

/**
 * 一次读完数据，同时计算全文 MD5、CRC32 和前 256 KiB 的 MD5
 */
public class FingerprintCalculator {
    public static final int SLICE_SIZE = 256 * 1024;
    private static final int BUFFER_SIZE = 64 * 1024;

    public FileFingerprint compute(Path path) throws IOException {
        try (var input = Files.newInputStream(path)) {
            var fileName = path.getFileName();
            return compute(input, fileName == null ? "" : fileName.toString());
        }
    }

    public FileFingerprint compute(InputStream input, String filename) throws IOException {
        MessageDigest contentDigest = newMd5();
        MessageDigest sliceDigest = newMd5();
        var crc32 = new CRC32();

        byte[] buffer = new byte[BUFFER_SIZE];
        long length = 0;
        int bytesRead;
        while ((bytesRead = input.read(buffer)) != -1) {
            contentDigest.update(buffer, 0, bytesRead);
            crc32.update(buffer, 0, bytesRead);
            if (length < SLICE_SIZE) {
                int sliceBytes = (int) Math.min(bytesRead, SLICE_SIZE - length);
                sliceDigest.update(buffer, 0, sliceBytes);
            }
            length += bytesRead;
        }

        String contentMd5 = HexUtils.bytesToHex(contentDigest.digest());
        String sliceMd5 = length <= SLICE_SIZE ? contentMd5 : HexUtils.bytesToHex(sliceDigest.digest());
        return new FileFingerprint(contentMd5, sliceMd5, crc32.getValue(), length, filename);
    }

    private static MessageDigest newMd5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }
}
