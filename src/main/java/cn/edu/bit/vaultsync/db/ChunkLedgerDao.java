package cn.edu.bit.vaultsync.db;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import javax.sql.DataSource;

import cn.edu.bit.vaultsync.entity.ChunkLedgerEntity;
import cn.edu.bit.vaultsync.entity.TransferTaskEntity;
import cn.edu.bit.vaultsync.exception.DataAccessException;

public class ChunkLedgerDao {
	private final DataSource dataSource;

	public ChunkLedgerDao(DataSource dataSource) {
		this.dataSource = dataSource;
	}

	public TransferTaskEntity getTask(String taskId) {
		String sql = "SELECT task_id, direction, local_path, remote_path, total_size, chunk_size, envelope, source_mtime FROM transfer_task WHERE task_id = ?";
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql)) {
			statement.setString(1, taskId);
			try (var resultSet = statement.executeQuery()) {
				if (!resultSet.next()) {
					return null;
				}
				byte[] envelope = resultSet.getBytes("envelope");
				return new TransferTaskEntity(
						resultSet.getString("task_id"),
						resultSet.getString("direction"),
						resultSet.getString("local_path"),
						resultSet.getString("remote_path"),
						resultSet.getLong("total_size"),
						resultSet.getLong("chunk_size"),
						envelope == null ? new byte[0] : envelope,
						resultSet.getLong("source_mtime"));
			}
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to get transfer task " + taskId, exception);
		}
	}

	public List<ChunkLedgerEntity> getChunks(String taskId) {
		String sql = "SELECT chunk_index, chunk_offset, chunk_size, status, retry_count, token FROM chunk_ledger WHERE task_id = ? ORDER BY chunk_index";
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql)) {
			statement.setString(1, taskId);
			try (var resultSet = statement.executeQuery()) {
				var chunks = new ArrayList<ChunkLedgerEntity>();
				while (resultSet.next()) {
					chunks.add(new ChunkLedgerEntity(
							taskId,
							resultSet.getInt("chunk_index"),
							resultSet.getLong("chunk_offset"),
							resultSet.getInt("chunk_size"),
							resultSet.getString("status"),
							resultSet.getInt("retry_count"),
							resultSet.getString("token")));
				}
				return chunks;
			}
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to get chunks of task " + taskId, exception);
		}
	}

	/**
	 * 写入任务和全部分块，已有的同ID记录先删除
	 */
	public void replaceTask(TransferTaskEntity task, List<ChunkLedgerEntity> chunks) {
		try (var connection = dataSource.getConnection()) {
			connection.setAutoCommit(false);
			try {
				try (var delete = connection.prepareStatement("DELETE FROM chunk_ledger WHERE task_id = ?")) {
					delete.setString(1, task.taskId());
					delete.executeUpdate();
				}
				try (var delete = connection.prepareStatement("DELETE FROM transfer_task WHERE task_id = ?")) {
					delete.setString(1, task.taskId());
					delete.executeUpdate();
				}
				String taskSql = "INSERT INTO transfer_task (task_id, direction, local_path, remote_path, total_size, chunk_size, envelope, source_mtime) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
				try (var insert = connection.prepareStatement(taskSql)) {
					insert.setString(1, task.taskId());
					insert.setString(2, task.direction());
					insert.setString(3, task.localPath());
					insert.setString(4, task.remotePath());
					insert.setLong(5, task.totalSize());
					insert.setLong(6, task.chunkSize());
					insert.setBytes(7, task.envelope());
					insert.setLong(8, task.sourceMtime());
					insert.executeUpdate();
				}
				String chunkSql = "INSERT INTO chunk_ledger (task_id, chunk_index, chunk_offset, chunk_size, status, retry_count, token) VALUES (?, ?, ?, ?, ?, ?, ?)";
				try (var insert = connection.prepareStatement(chunkSql)) {
					for (var chunk : chunks) {
						insert.setString(1, task.taskId());
						insert.setInt(2, chunk.chunkIndex());
						insert.setLong(3, chunk.chunkOffset());
						insert.setInt(4, chunk.chunkSize());
						insert.setString(5, chunk.status());
						insert.setInt(6, chunk.retryCount());
						insert.setString(7, chunk.token());
						insert.addBatch();
					}
					insert.executeBatch();
				}
				connection.commit();
			} catch (SQLException e) {
				connection.rollback();
				throw e;
			}
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to save transfer task " + task.taskId(), exception);
		}
	}

	public void updateChunk(String taskId, int chunkIndex, String status, int retryCount, String token) {
		String sql = "UPDATE chunk_ledger SET status = ?, retry_count = ?, token = ? WHERE task_id = ? AND chunk_index = ?";
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql)) {
			statement.setString(1, status);
			statement.setInt(2, retryCount);
			statement.setString(3, token);
			statement.setString(4, taskId);
			statement.setInt(5, chunkIndex);
			if (statement.executeUpdate() != 1) {
				throw new DataAccessException("Chunk " + chunkIndex + " of task " + taskId + " is not in the ledger");
			}
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to update chunk " + chunkIndex + " of task " + taskId, exception);
		}
	}

	public void deleteTask(String taskId) {
		try (var connection = dataSource.getConnection()) {
			connection.setAutoCommit(false);
			try {
				try (var delete = connection.prepareStatement("DELETE FROM chunk_ledger WHERE task_id = ?")) {
					delete.setString(1, taskId);
					delete.executeUpdate();
				}
				try (var delete = connection.prepareStatement("DELETE FROM transfer_task WHERE task_id = ?")) {
					delete.setString(1, taskId);
					delete.executeUpdate();
				}
				connection.commit();
			} catch (SQLException e) {
				connection.rollback();
				throw e;
			}
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to delete transfer task " + taskId, exception);
		}
	}
}
