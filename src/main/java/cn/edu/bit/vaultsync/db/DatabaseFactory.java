package cn.edu.bit.vaultsync.db;

import java.io.File;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import cn.edu.bit.vaultsync.exception.DataAccessException;

/**
 * SQLite 连接池，负责建表
 * 每个数据库文件一个实例，由调用方负责 {@link #shutdown()}
 */
public class DatabaseFactory implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(DatabaseFactory.class);
	private final HikariDataSource dataSource;
	private final String databasePath;

	public DatabaseFactory(String databasePath, int poolSize) {
		this.databasePath = databasePath;
		ensureDatabaseDirectoryExists();

		var config = new HikariConfig();
		config.setJdbcUrl("jdbc:sqlite:" + databasePath);
		config.setPoolName("VaultSyncPool");
		config.setMaximumPoolSize(poolSize);
		config.setConnectionInitSql("PRAGMA journal_mode = WAL;");
		// 多个任务同时写账本时等待写锁，而不是立即报 SQLITE_BUSY
		config.addDataSourceProperty("busy_timeout", "10000");
		config.addDataSourceProperty("foreign_keys", "true");

		dataSource = new HikariDataSource(config);

		initTables();
	}

	public DataSource getDataSource() {
		return dataSource;
	}

	public String getDatabasePath() {
		return databasePath;
	}

	public void shutdown() {
		if (!dataSource.isClosed()) {
			logger.info("Closing database pool {}", databasePath);
			dataSource.close();
		}
	}

	@Override
	public void close() {
		shutdown();
	}

	private void ensureDatabaseDirectoryExists() {
		var databaseFile = new File(databasePath);
		var parentDirectory = databaseFile.getParentFile();
		if (parentDirectory != null && !parentDirectory.exists()) {
			parentDirectory.mkdirs();
		}
	}

	private void initTables() {
		try (var connection = dataSource.getConnection();
				var statement = connection.createStatement()) {

			// 内容寻址存储，按 MD5 去重
			statement.execute("""
						CREATE TABLE IF NOT EXISTS object_blob (
							hash TEXT NOT NULL PRIMARY KEY,
							slice_md5 TEXT NOT NULL,
							size INTEGER NOT NULL,
							ref_count INTEGER NOT NULL DEFAULT 1,
							created_at TEXT DEFAULT CURRENT_TIMESTAMP
						) STRICT;
					""");

			// 目录树，顶层节点的 parent_id 为0
			statement.execute("""
						CREATE TABLE IF NOT EXISTS object_node (
							id INTEGER PRIMARY KEY,
							parent_id INTEGER NOT NULL DEFAULT 0,
							name TEXT NOT NULL,
							folder INTEGER NOT NULL,
							hash TEXT,
							size INTEGER NOT NULL DEFAULT 0,
							mtime INTEGER NOT NULL,
							uploaded_at INTEGER NOT NULL,
							UNIQUE (parent_id, name)
						) STRICT;
					""");

			// 秒传信息缓存
			statement.execute("""
						CREATE TABLE IF NOT EXISTS fingerprint_cache (
							id INTEGER PRIMARY KEY AUTOINCREMENT,
							local_path TEXT NOT NULL,
							remote_path TEXT NOT NULL,
							user_id INTEGER NOT NULL,
							user_name TEXT,
							filename TEXT NOT NULL,
							content_md5 TEXT NOT NULL,
							slice_md5 TEXT NOT NULL,
							content_crc32 INTEGER NOT NULL,
							content_length INTEGER NOT NULL,
							algorithm TEXT NOT NULL,
							local_mtime INTEGER NOT NULL,
							remote_mtime INTEGER NOT NULL,
							record_time TEXT DEFAULT CURRENT_TIMESTAMP,
							UNIQUE (local_path, remote_path, user_id)
						) STRICT;
					""");

			// 断点续传账本
			statement.execute("""
						CREATE TABLE IF NOT EXISTS transfer_task (
							task_id TEXT NOT NULL PRIMARY KEY,
							direction TEXT NOT NULL,
							local_path TEXT NOT NULL,
							remote_path TEXT NOT NULL,
							total_size INTEGER NOT NULL,
							chunk_size INTEGER NOT NULL,
							envelope BLOB,
							source_mtime INTEGER NOT NULL,
							updated_at TEXT DEFAULT CURRENT_TIMESTAMP
						) STRICT;
					""");

			statement.execute("""
						CREATE TABLE IF NOT EXISTS chunk_ledger (
							task_id TEXT NOT NULL REFERENCES transfer_task (task_id) ON DELETE CASCADE,
							chunk_index INTEGER NOT NULL,
							chunk_offset INTEGER NOT NULL,
							chunk_size INTEGER NOT NULL,
							status TEXT NOT NULL,
							retry_count INTEGER NOT NULL DEFAULT 0,
							token TEXT,
							PRIMARY KEY (task_id, chunk_index)
						) STRICT;
					""");

		} catch (SQLException e) {
			throw new DataAccessException("Failed to initialize database: " + e.getMessage(), e);
		}
	}
}
