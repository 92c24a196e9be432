package cn.edu.bit.vaultsync.db;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

import cn.edu.bit.vaultsync.entity.ObjectBlobEntity;

/**
 * object_blob 表，调用方提供连接并管理事务
 */
public class ObjectBlobDao {

	/**
	 * 新内容登记，引用计数为1；哈希已存在时抛出 SQLException
	 */
	public void insert(Connection connection, String hash, String sliceMd5, long size) throws SQLException {
		String sql = "INSERT INTO object_blob (hash, slice_md5, size, ref_count) VALUES (?, ?, ?, 1)";
		try (var statement = connection.prepareStatement(sql)) {
			statement.setString(1, hash);
			statement.setString(2, sliceMd5);
			statement.setLong(3, size);
			statement.executeUpdate();
		}
	}

	/**
	 * 调整引用计数
	 *
	 * @return 调整后的引用计数
	 * @throws SQLException 内容不存在
	 */
	public int addReferences(Connection connection, String hash, int delta) throws SQLException {
		try (var statement = connection.prepareStatement(
				"UPDATE object_blob SET ref_count = ref_count + ? WHERE hash = ?")) {
			statement.setInt(1, delta);
			statement.setString(2, hash);
			if (statement.executeUpdate() != 1) {
				throw new SQLException("Unknown blob: " + hash);
			}
		}
		return get(connection, hash).referenceCount();
	}

	public void deleteUnreferenced(Connection connection, String hash) throws SQLException {
		try (var statement = connection.prepareStatement("DELETE FROM object_blob WHERE hash = ? AND ref_count <= 0")) {
			statement.setString(1, hash);
			statement.executeUpdate();
		}
	}

	/**
	 * @return 不存在时返回 null
	 */
	public ObjectBlobEntity get(Connection connection, String hash) throws SQLException {
		String sql = "SELECT hash, slice_md5, size, ref_count FROM object_blob WHERE hash = ?";
		try (var statement = connection.prepareStatement(sql)) {
			statement.setString(1, hash);
			try (var resultSet = statement.executeQuery()) {
				return resultSet.next() ? toEntity(resultSet) : null;
			}
		}
	}

	private static ObjectBlobEntity toEntity(ResultSet resultSet) throws SQLException {
		return new ObjectBlobEntity(resultSet.getString("hash"), resultSet.getString("slice_md5"),
				resultSet.getLong("size"), resultSet.getInt("ref_count"));
	}
}
