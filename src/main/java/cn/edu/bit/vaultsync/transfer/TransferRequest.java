package cn.edu.bit.vaultsync.transfer;

import java.nio.file.Path;

/**
 * 批量传输中的一项
 */
public record TransferRequest(Path localPath, String remotePath) {
}
