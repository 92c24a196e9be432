package cn.edu.bit.vaultsync.db;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import cn.edu.bit.vaultsync.entity.ObjectNodeEntity;

/**
 * object_node 表，调用方提供连接并管理事务
 */
public class ObjectNodeDao {
	private static final String COLUMNS = "id, parent_id, name, folder, hash, size, mtime, uploaded_at";

	public ObjectNodeEntity get(Connection connection, long id) throws SQLException {
		try (var statement = connection.prepareStatement("SELECT " + COLUMNS + " FROM object_node WHERE id = ?")) {
			statement.setLong(1, id);
			return single(statement.executeQuery());
		}
	}

	public ObjectNodeEntity getChild(Connection connection, long parentId, String name) throws SQLException {
		String sql = "SELECT " + COLUMNS + " FROM object_node WHERE parent_id = ? AND name = ?";
		try (var statement = connection.prepareStatement(sql)) {
			statement.setLong(1, parentId);
			statement.setString(2, name);
			return single(statement.executeQuery());
		}
	}

	/**
	 * 直接子节点，按名称排序
	 */
	public List<ObjectNodeEntity> listChildren(Connection connection, long parentId) throws SQLException {
		String sql = "SELECT " + COLUMNS + " FROM object_node WHERE parent_id = ? ORDER BY name";
		try (var statement = connection.prepareStatement(sql)) {
			statement.setLong(1, parentId);
			try (var resultSet = statement.executeQuery()) {
				var children = new ArrayList<ObjectNodeEntity>();
				while (resultSet.next()) {
					children.add(toEntity(resultSet));
				}
				return children;
			}
		}
	}

	/**
	 * @return 新节点ID
	 */
	public long insertFile(Connection connection, long parentId, String name, String hash, long size,
			long mtimeSeconds, long uploadTimeMillis) throws SQLException {
		return insert(connection, parentId, name, false, hash, size, mtimeSeconds, uploadTimeMillis);
	}

	public long insertFolder(Connection connection, long parentId, String name, long nowMillis) throws SQLException {
		return insert(connection, parentId, name, true, null, 0, nowMillis / 1000, nowMillis);
	}

	/**
	 * 覆盖文件内容
	 */
	public void updateContent(Connection connection, long id, String hash, long size, long mtimeSeconds,
			long uploadTimeMillis) throws SQLException {
		String sql = "UPDATE object_node SET hash = ?, size = ?, mtime = ?, uploaded_at = ? WHERE id = ? AND folder = 0";
		try (var statement = connection.prepareStatement(sql)) {
			statement.setString(1, hash);
			statement.setLong(2, size);
			statement.setLong(3, mtimeSeconds);
			statement.setLong(4, uploadTimeMillis);
			statement.setLong(5, id);
			if (statement.executeUpdate() != 1) {
				throw new SQLException("No file node with id " + id);
			}
		}
	}

	public void delete(Connection connection, long id) throws SQLException {
		try (var statement = connection.prepareStatement("DELETE FROM object_node WHERE id = ?")) {
			statement.setLong(1, id);
			statement.executeUpdate();
		}
	}

	private static long insert(Connection connection, long parentId, String name, boolean folder, String hash,
			long size, long mtimeSeconds, long uploadTimeMillis) throws SQLException {
		String sql = "INSERT INTO object_node (parent_id, name, folder, hash, size, mtime, uploaded_at) "
				+ "VALUES (?, ?, ?, ?, ?, ?, ?)";
		try (var statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
			statement.setLong(1, parentId);
			statement.setString(2, name);
			statement.setInt(3, folder ? 1 : 0);
			statement.setString(4, hash);
			statement.setLong(5, size);
			statement.setLong(6, mtimeSeconds);
			statement.setLong(7, uploadTimeMillis);
			statement.executeUpdate();
			try (var keys = statement.getGeneratedKeys()) {
				if (!keys.next()) {
					throw new SQLException("No generated id for " + name);
				}
				return keys.getLong(1);
			}
		}
	}

	private static ObjectNodeEntity single(ResultSet resultSet) throws SQLException {
		try (resultSet) {
			return resultSet.next() ? toEntity(resultSet) : null;
		}
	}

	private static ObjectNodeEntity toEntity(ResultSet resultSet) throws SQLException {
		return new ObjectNodeEntity(resultSet.getLong("id"), resultSet.getLong("parent_id"),
				resultSet.getString("name"), resultSet.getInt("folder") == 1, resultSet.getString("hash"),
				resultSet.getLong("size"), resultSet.getLong("mtime"), resultSet.getLong("uploaded_at"));
	}
}
