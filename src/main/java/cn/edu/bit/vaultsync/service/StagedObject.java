package cn.edu.bit.vaultsync.service;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.fingerprint.FingerprintCalculator;
import cn.edu.bit.vaultsync.utils.HexUtils;

/**
 * 正在合并的对象：边写临时文件边计算 MD5 和前 256 KiB 的 MD5
 */
public class StagedObject {
	private static final Logger logger = LoggerFactory.getLogger(StagedObject.class);

	private final Path stagingPath;
	private final FileChannel channel;
	private final MessageDigest wholeDigest = newMd5();
	private final MessageDigest headDigest = newMd5();
	private long written;

	public StagedObject(File tmpDirectory) throws IOException {
		this.stagingPath = Files.createTempFile(tmpDirectory.toPath(), "object_", ".tmp");
		this.channel = FileChannel.open(stagingPath, StandardOpenOption.WRITE);
	}

	public void write(byte[] bytes) throws IOException {
		if (bytes.length == 0) {
			return;
		}
		wholeDigest.update(bytes);
		long headRemaining = FingerprintCalculator.SLICE_SIZE - written;
		if (headRemaining > 0) {
			headDigest.update(bytes, 0, (int) Math.min(bytes.length, headRemaining));
		}
		var buffer = ByteBuffer.wrap(bytes);
		while (buffer.hasRemaining()) {
			written += channel.write(buffer);
		}
	}

	public record Digests(String contentMd5, String sliceMd5) {
	}

	/**
	 * 写完后调用一次
	 */
	public Digests finish() throws IOException {
		close();
		String contentMd5 = HexUtils.bytesToHex(wholeDigest.digest());
		// 不超过一个切片时两者相同
		String sliceMd5 = written <= FingerprintCalculator.SLICE_SIZE ? contentMd5
				: HexUtils.bytesToHex(headDigest.digest());
		return new Digests(contentMd5, sliceMd5);
	}

	/**
	 * 移动到数据目录，已存在的同名文件被替换
	 */
	public void rename(File target) throws IOException {
		close();
		Files.move(stagingPath, target.toPath(), StandardCopyOption.REPLACE_EXISTING);
	}

	public void delete() throws IOException {
		close();
		Files.deleteIfExists(stagingPath);
	}

	public long getSize() {
		return written;
	}

	public void close() throws IOException {
		if (channel.isOpen()) {
			channel.close();
		}
	}

	public void abort() {
		try {
			delete();
		} catch (IOException e) {
			logger.warn("Failed to clean up staged object {}", stagingPath, e);
		}
	}

	private static MessageDigest newMd5() {
		try {
			return MessageDigest.getInstance("MD5");
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 algorithm not found", e);
		}
	}
}
