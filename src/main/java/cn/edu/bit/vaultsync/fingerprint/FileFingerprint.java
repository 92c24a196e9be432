package cn.edu.bit.vaultsync.fingerprint;

import java.util.Locale;

/**
 * 文件内容标识
 *
 * @param contentMd5 全文 MD5，32位小写十六进制
 * @param sliceMd5   前 256 KiB 的 MD5；文件不超过 256 KiB 时等于 contentMd5
 * @param crc32      全文 CRC32，0 表示缺失
 * @param length     内容长度
 * @param filename   文件名
 */
public record FileFingerprint(String contentMd5, String sliceMd5, long crc32, long length, String filename) {

    public FileFingerprint {
        contentMd5 = contentMd5.toLowerCase(Locale.ROOT);
        sliceMd5 = sliceMd5.toLowerCase(Locale.ROOT);
        if (length < 0) {
            throw new IllegalArgumentException("Negative content length: " + length);
        }
        if (crc32 < 0 || crc32 > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("crc32 out of range: " + crc32);
        }
    }

    public boolean hasCrc32() {
        return crc32 != 0;
    }

    public FileFingerprint withFilename(String newFilename) {
        return new FileFingerprint(contentMd5, sliceMd5, crc32, length, newFilename);
    }

    public FileFingerprint withoutCrc32() {
        return new FileFingerprint(contentMd5, sliceMd5, 0, length, filename);
    }
}
