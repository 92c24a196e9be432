package cn.edu.bit.vaultsync.db;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import javax.sql.DataSource;

import cn.edu.bit.vaultsync.entity.FingerprintCacheEntity;
import cn.edu.bit.vaultsync.exception.DataAccessException;
import cn.edu.bit.vaultsync.fingerprint.FileFingerprint;

public class FingerprintCacheDao {
	private static final String COLUMNS = "id, local_path, remote_path, user_id, user_name, filename, content_md5, "
			+ "slice_md5, content_crc32, content_length, algorithm, local_mtime, remote_mtime, record_time";

	/**
	 * 列表排序字段
	 */
	public enum Order {
		FILENAME("filename"),
		TIME("record_time"),
		SIZE("content_length"),
		LOCAL_PATH("local_path"),
		REMOTE_PATH("remote_path"),
		USER_ID("user_id"),
		USER_NAME("user_name");

		private final String column;

		Order(String column) {
			this.column = column;
		}
	}

	/**
	 * 搜索字段
	 */
	public enum SearchField {
		FILENAME("filename"),
		LOCAL_PATH("local_path"),
		REMOTE_PATH("remote_path"),
		USER_NAME("user_name"),
		MD5("content_md5");

		private final String column;

		SearchField(String column) {
			this.column = column;
		}
	}

	private final DataSource dataSource;

	public FingerprintCacheDao(DataSource dataSource) {
		this.dataSource = dataSource;
	}

	public FingerprintCacheEntity getByKey(String localPath, String remotePath, long userId) {
		String sql = "SELECT " + COLUMNS + " FROM fingerprint_cache WHERE local_path = ? AND remote_path = ? AND user_id = ?";
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql)) {
			statement.setString(1, localPath);
			statement.setString(2, remotePath);
			statement.setLong(3, userId);
			try (var resultSet = statement.executeQuery()) {
				return resultSet.next() ? toEntity(resultSet) : null;
			}
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to get fingerprint cache entry", exception);
		}
	}

	/**
	 * 插入或覆盖 (local_path, remote_path, user_id) 对应的记录
	 */
	public void upsert(FingerprintCacheEntity entity) {
		String sql = """
				INSERT INTO fingerprint_cache (local_path, remote_path, user_id, user_name, filename, content_md5,
					slice_md5, content_crc32, content_length, algorithm, local_mtime, remote_mtime)
				VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
				ON CONFLICT (local_path, remote_path, user_id) DO UPDATE SET
					user_name = excluded.user_name,
					filename = excluded.filename,
					content_md5 = excluded.content_md5,
					slice_md5 = excluded.slice_md5,
					content_crc32 = excluded.content_crc32,
					content_length = excluded.content_length,
					algorithm = excluded.algorithm,
					local_mtime = excluded.local_mtime,
					remote_mtime = excluded.remote_mtime,
					record_time = CURRENT_TIMESTAMP
				""";
		FileFingerprint fingerprint = entity.fingerprint();
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql)) {
			statement.setString(1, entity.localPath());
			statement.setString(2, entity.remotePath());
			statement.setLong(3, entity.userId());
			statement.setString(4, entity.userName());
			statement.setString(5, fingerprint.filename());
			statement.setString(6, fingerprint.contentMd5());
			statement.setString(7, fingerprint.sliceMd5());
			statement.setLong(8, fingerprint.crc32());
			statement.setLong(9, fingerprint.length());
			statement.setString(10, entity.algorithm());
			statement.setLong(11, entity.localMtime());
			statement.setLong(12, entity.remoteMtime());
			statement.executeUpdate();
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to save fingerprint cache entry", exception);
		}
	}

	/**
	 * @param limit  小于等于0表示不限
	 * @param offset 小于等于0表示从头开始
	 */
	public List<FingerprintCacheEntity> list(Order order, boolean descending, int limit, int offset) {
		var sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM fingerprint_cache ORDER BY ")
				.append(order.column);
		if (descending) {
			sql.append(" DESC");
		}
		sql.append(", id LIMIT ? OFFSET ?");
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql.toString())) {
			statement.setInt(1, limit > 0 ? limit : -1);
			statement.setInt(2, Math.max(offset, 0));
			return collect(statement.executeQuery());
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to list fingerprint cache entries", exception);
		}
	}

	public List<FingerprintCacheEntity> listByIds(List<Long> ids) {
		var result = new ArrayList<FingerprintCacheEntity>();
		for (long id : ids) {
			FingerprintCacheEntity entity = getById(id);
			if (entity != null) {
				result.add(entity);
			}
		}
		return result;
	}

	public FingerprintCacheEntity getById(long id) {
		String sql = "SELECT " + COLUMNS + " FROM fingerprint_cache WHERE id = ?";
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql)) {
			statement.setLong(1, id);
			try (var resultSet = statement.executeQuery()) {
				return resultSet.next() ? toEntity(resultSet) : null;
			}
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to get fingerprint cache entry by ID", exception);
		}
	}

	/**
	 * 按关键字模糊搜索，fields 为空时搜索全部字段；关键字为空时返回全部记录
	 */
	public List<FingerprintCacheEntity> search(String keyword, Set<SearchField> fields) {
		Set<SearchField> searchFields = fields == null || fields.isEmpty() ? EnumSet.allOf(SearchField.class) : fields;
		var sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM fingerprint_cache");
		boolean filtered = keyword != null && !keyword.isEmpty();
		if (filtered) {
			var conditions = new ArrayList<String>();
			for (var field : searchFields) {
				conditions.add(field.column + " LIKE ? ESCAPE '\\'");
			}
			sql.append(" WHERE ").append(String.join(" OR ", conditions));
		}
		sql.append(" ORDER BY id");
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql.toString())) {
			if (filtered) {
				String pattern = "%" + escapeLike(keyword) + "%";
				for (int i = 1; i <= searchFields.size(); i++) {
					statement.setString(i, pattern);
				}
			}
			return collect(statement.executeQuery());
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to search fingerprint cache entries", exception);
		}
	}

	public boolean deleteById(long id) {
		String sql = "DELETE FROM fingerprint_cache WHERE id = ?";
		try (var connection = dataSource.getConnection();
				var statement = connection.prepareStatement(sql)) {
			statement.setLong(1, id);
			return statement.executeUpdate() == 1;
		} catch (SQLException exception) {
			throw new DataAccessException("Failed to delete fingerprint cache entry", exception);
		}
	}

	private static List<FingerprintCacheEntity> collect(ResultSet resultSet) throws SQLException {
		try (resultSet) {
			var result = new ArrayList<FingerprintCacheEntity>();
			while (resultSet.next()) {
				result.add(toEntity(resultSet));
			}
			return result;
		}
	}

	private static String escapeLike(String keyword) {
		return keyword.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
	}

	private static FingerprintCacheEntity toEntity(ResultSet resultSet) throws SQLException {
		var fingerprint = new FileFingerprint(
				resultSet.getString("content_md5"),
				resultSet.getString("slice_md5"),
				resultSet.getLong("content_crc32"),
				resultSet.getLong("content_length"),
				resultSet.getString("filename"));
		return new FingerprintCacheEntity(
				resultSet.getLong("id"),
				resultSet.getString("local_path"),
				resultSet.getString("remote_path"),
				resultSet.getLong("user_id"),
				resultSet.getString("user_name"),
				fingerprint,
				resultSet.getString("algorithm"),
				resultSet.getLong("local_mtime"),
				resultSet.getLong("remote_mtime"),
				resultSet.getString("record_time"));
	}
}
