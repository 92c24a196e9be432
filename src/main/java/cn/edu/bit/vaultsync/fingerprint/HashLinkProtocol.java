package cn.edu.bit.vaultsync.fingerprint;

import java.util.Locale;

/**
 * 秒传链接格式
 */
public enum HashLinkProtocol {
    /** cs3l://content_md5#slice_md5#crc32#length#filename */
    CS3L,
    /** content_md5#slice_md5#length#filename */
    SHORT,
    /** bdpan://base64(filename|length|content_md5|slice_md5) */
    BDPAN;

    public static HashLinkProtocol fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
