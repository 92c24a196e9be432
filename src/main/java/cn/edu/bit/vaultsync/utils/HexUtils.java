package cn.edu.bit.vaultsync.utils;

import java.util.HexFormat;

public class HexUtils {
	private static final HexFormat HEX_FORMAT = HexFormat.of();

	public static String bytesToHex(byte[] bytes) {
		return HEX_FORMAT.formatHex(bytes);
	}

	public static byte[] hexToBytes(String hex) {
		return HEX_FORMAT.parseHex(hex);
	}

	/**
	 * 是否为指定长度的十六进制字符串（大小写均可）
	 */
	public static boolean isHex(String value, int length) {
		if (value == null || value.length() != length) {
			return false;
		}
		for (int i = 0; i < length; i++) {
			if (Character.digit(value.charAt(i), 16) < 0) {
				return false;
			}
		}
		return true;
	}
}
