package cn.edu.bit.vaultsync.fingerprint;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import cn.edu.bit.vaultsync.exception.MalformedHashLinkException;
import cn.edu.bit.vaultsync.utils.HexUtils;

/**
 * 秒传链接的编码和解析
 * <p>
 * 链接格式需要与其他客户端逐字节一致：
 * <ul>
 * <li>cs3l 的文件名只把空格编码为 %20</li>
 * <li>bdpan 的字段从右往左切分，文件名本身可以包含 '|'</li>
 * </ul>
 */
public final class HashLinkCodec {
    private static final String CS3L_PREFIX = "cs3l://";
    private static final String BDPAN_PREFIX = "bdpan://";
    private static final int MD5_HEX_LENGTH = 32;

    private HashLinkCodec() {
    }

    public static String encode(FileFingerprint fingerprint, HashLinkProtocol protocol) {
        return switch (protocol) {
            case CS3L -> CS3L_PREFIX + String.join("#",
                    fingerprint.contentMd5(),
                    fingerprint.sliceMd5(),
                    Long.toString(fingerprint.crc32()),
                    Long.toString(fingerprint.length()),
                    fingerprint.filename().replace(" ", "%20"));
            case SHORT -> String.join("#",
                    fingerprint.contentMd5(),
                    fingerprint.sliceMd5(),
                    Long.toString(fingerprint.length()),
                    fingerprint.filename());
            case BDPAN -> {
                String raw = String.join("|",
                        fingerprint.filename(),
                        Long.toString(fingerprint.length()),
                        fingerprint.contentMd5(),
                        fingerprint.sliceMd5());
                yield BDPAN_PREFIX + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
            }
        };
    }

    public static HashLinkProtocol detect(String link) {
        if (link.startsWith(CS3L_PREFIX)) {
            return HashLinkProtocol.CS3L;
        }
        if (link.startsWith(BDPAN_PREFIX)) {
            return HashLinkProtocol.BDPAN;
        }
        return HashLinkProtocol.SHORT;
    }

    public static FileFingerprint decode(String link) throws MalformedHashLinkException {
        return decode(link, null);
    }

    /**
     * 解析链接
     *
     * @param link             秒传链接
     * @param explicitFilename 非空时覆盖链接中的文件名
     * @throws MalformedHashLinkException 分隔符缺失、MD5 不是32位十六进制或数字字段非法
     */
    public static FileFingerprint decode(String link, String explicitFilename) throws MalformedHashLinkException {
        if (link == null || link.isBlank()) {
            throw new MalformedHashLinkException(String.valueOf(link), "empty link");
        }
        String trimmed = link.trim();
        FileFingerprint fingerprint = switch (detect(trimmed)) {
            case CS3L -> decodeCs3l(trimmed);
            case BDPAN -> decodeBdpan(trimmed);
            case SHORT -> decodeShort(trimmed);
        };
        if (explicitFilename != null && !explicitFilename.isEmpty()) {
            return fingerprint.withFilename(explicitFilename);
        }
        return fingerprint;
    }

    private static FileFingerprint decodeCs3l(String link) throws MalformedHashLinkException {
        String[] fields = link.substring(CS3L_PREFIX.length()).split("#", 5);
        if (fields.length != 5) {
            throw new MalformedHashLinkException(link, "expected 5 '#'-separated fields, got " + fields.length);
        }
        long crc32 = fields[2].isEmpty() ? 0 : parseNumber(link, fields[2], "crc32");
        return build(link, fields[0], fields[1], crc32, fields[3], fields[4].replace("%20", " "));
    }

    private static FileFingerprint decodeShort(String link) throws MalformedHashLinkException {
        String[] fields = link.split("#", 4);
        if (fields.length != 4) {
            throw new MalformedHashLinkException(link, "expected 4 '#'-separated fields, got " + fields.length);
        }
        return build(link, fields[0], fields[1], 0, fields[2], fields[3].replace("%20", " "));
    }

    private static FileFingerprint decodeBdpan(String link) throws MalformedHashLinkException {
        String raw;
        try {
            raw = new String(Base64.getDecoder().decode(link.substring(BDPAN_PREFIX.length())),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedHashLinkException(link, "invalid base64 payload", e);
        }
        // 从右往左取出三个字段，剩下的都是文件名
        int sliceSeparator = raw.lastIndexOf('|');
        int md5Separator = sliceSeparator > 0 ? raw.lastIndexOf('|', sliceSeparator - 1) : -1;
        int lengthSeparator = md5Separator > 0 ? raw.lastIndexOf('|', md5Separator - 1) : -1;
        if (lengthSeparator < 0) {
            throw new MalformedHashLinkException(link, "expected 4 '|'-separated fields");
        }
        String filename = raw.substring(0, lengthSeparator);
        String length = raw.substring(lengthSeparator + 1, md5Separator);
        String contentMd5 = raw.substring(md5Separator + 1, sliceSeparator);
        String sliceMd5 = raw.substring(sliceSeparator + 1);
        return build(link, contentMd5, sliceMd5, 0, length, filename);
    }

    private static FileFingerprint build(String link, String contentMd5, String sliceMd5, long crc32,
            String length, String filename) throws MalformedHashLinkException {
        if (!HexUtils.isHex(contentMd5, MD5_HEX_LENGTH)) {
            throw new MalformedHashLinkException(link, "content md5 is not 32 hex characters");
        }
        if (!HexUtils.isHex(sliceMd5, MD5_HEX_LENGTH)) {
            throw new MalformedHashLinkException(link, "slice md5 is not 32 hex characters");
        }
        if (crc32 > 0xFFFFFFFFL) {
            throw new MalformedHashLinkException(link, "crc32 out of range");
        }
        return new FileFingerprint(contentMd5, sliceMd5, crc32, parseNumber(link, length, "length"), filename);
    }

    private static long parseNumber(String link, String value, String field) throws MalformedHashLinkException {
        try {
            long number = Long.parseLong(value);
            if (number < 0) {
                throw new MalformedHashLinkException(link, field + " must not be negative");
            }
            return number;
        } catch (NumberFormatException e) {
            throw new MalformedHashLinkException(link, field + " is not a number: " + value, e);
        }
    }
}
