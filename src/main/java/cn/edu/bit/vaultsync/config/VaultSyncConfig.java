package cn.edu.bit.vaultsync.config;

import java.time.Duration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.CipherAlgorithm;
import cn.edu.bit.vaultsync.session.AccountContext;
import cn.edu.bit.vaultsync.transfer.TransferSettings;

/**
 * 配置包装类，读取 reference.conf / application.conf 中的 vaultsync 块
 */
public class VaultSyncConfig {
    private static final Logger logger = LoggerFactory.getLogger(VaultSyncConfig.class);
    private final Config config;

    public VaultSyncConfig() {
        this(ConfigFactory.load());
    }

    public VaultSyncConfig(Config config) {
        this.config = config.getConfig("vaultsync");
    }

    // Database
    public String getDatabasePath() {
        return config.getString("database.path");
    }

    public int getDatabasePoolSize() {
        return config.getInt("database.pool-size");
    }

    // Local object store
    public String getDataDirectory() {
        return config.getString("store.data-directory");
    }

    public String getTmpDirectory() {
        return config.getString("store.tmp-directory");
    }

    public long getStoreMaxChunkSize() {
        return config.getBytes("store.max-chunk-size");
    }

    // Transfer
    public long getChunkSize() {
        return config.getBytes("transfer.chunk-size");
    }

    public int getUploadConcurrency() {
        return positiveOrProcessors(config.getInt("transfer.upload-concurrency"));
    }

    public int getDownloadConcurrency() {
        return positiveOrProcessors(config.getInt("transfer.download-concurrency"));
    }

    public int getMaxRetries() {
        return config.getInt("transfer.max-retries");
    }

    public Duration getInitialBackoff() {
        return config.getDuration("transfer.backoff.initial");
    }

    public Duration getMaxBackoff() {
        return config.getDuration("transfer.backoff.max");
    }

    public boolean isRapidUpload() {
        return config.getBoolean("transfer.rapid-upload");
    }

    public boolean isVerifyChecksum() {
        return config.getBoolean("transfer.verify-checksum");
    }

    public int getApplierWindow() {
        return config.getInt("transfer.applier-window");
    }

    public TransferSettings getTransferSettings() {
        return new TransferSettings(getChunkSize(), getUploadConcurrency(), getDownloadConcurrency(),
                getMaxRetries(), getInitialBackoff(), getMaxBackoff(), isRapidUpload(), isVerifyChecksum(),
                getApplierWindow());
    }

    // Crypto
    public CipherAlgorithm getDefaultAlgorithm() {
        return CipherAlgorithm.fromName(config.getString("crypto.algorithm"));
    }

    public int getFormatVersion() {
        return config.getInt("crypto.format-version");
    }

    // Account
    public AccountContext getAccount() {
        String secret = config.getString("account.secret");
        var account = new AccountContext(config.getLong("account.user-id"), config.getString("account.user-name"),
                config.getString("account.working-dir"), secret.isEmpty() ? null : secret, getDefaultAlgorithm(),
                getFormatVersion());
        logger.debug("Loaded account {}", account);
        return account;
    }

    // Stream server
    public String getServerHost() {
        return config.getString("server.host");
    }

    public int getServerPort() {
        return config.getInt("server.port");
    }

    public String getServerRoot() {
        return config.getString("server.root");
    }

    private static int positiveOrProcessors(int value) {
        return value <= 0 ? Runtime.getRuntime().availableProcessors() : value;
    }
}
