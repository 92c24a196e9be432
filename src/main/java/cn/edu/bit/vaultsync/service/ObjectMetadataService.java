package cn.edu.bit.vaultsync.service;

import cn.edu.bit.vaultsync.db.DatabaseFactory;
import cn.edu.bit.vaultsync.db.InsertFileResult;
import cn.edu.bit.vaultsync.db.ObjectBlobDao;
import cn.edu.bit.vaultsync.db.ObjectNodeDao;
import cn.edu.bit.vaultsync.entity.ObjectBlobEntity;
import cn.edu.bit.vaultsync.entity.ObjectNodeEntity;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 对象存储的元数据操作：路径解析、去重登记、递归删除
 * 写操作在同一个事务内完成，失败时回滚
 */
public class ObjectMetadataService {
    private static final Logger logger = LoggerFactory.getLogger(ObjectMetadataService.class);
    public static final long ROOT_ID = 0;

    private final DataSource dataSource;
    private final ObjectBlobDao blobDao = new ObjectBlobDao();
    private final ObjectNodeDao nodeDao = new ObjectNodeDao();

    public ObjectMetadataService(DatabaseFactory databaseFactory) {
        this.dataSource = databaseFactory.getDataSource();
    }

    /**
     * 把远端路径拆成各级名称，忽略空段
     */
    public static List<String> splitPath(String path) {
        var names = new ArrayList<String>();
        for (String name : path.split("/")) {
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * 解析路径
     *
     * @return 节点，根目录返回ID为0的文件夹节点，不存在返回 null
     */
    public ObjectNodeEntity resolvePath(String path) throws SQLException {
        try (var connection = dataSource.getConnection()) {
            return resolve(connection, splitPath(path));
        }
    }

    /**
     * 查询内容是否已经存储
     *
     * @throws IllegalStateException 哈希相同但大小或前段哈希不同（哈希碰撞）
     */
    public boolean existsByHash(String hash, String sliceMd5, long size) throws SQLException {
        try (var connection = dataSource.getConnection()) {
            ObjectBlobEntity blob = blobDao.get(connection, hash);
            if (blob == null) {
                return false;
            }
            if (blob.size() != size || !blob.sliceMd5().equals(sliceMd5)) {
                throw new IllegalStateException("Hash collision: " + hash);
            }
            return true;
        }
    }

    public List<ObjectNodeEntity> getList(long parentId) throws SQLException {
        try (var connection = dataSource.getConnection()) {
            return nodeDao.listChildren(connection, parentId);
        }
    }

    /**
     * 登记文件节点，缺失的父目录一并创建
     * 同名文件内容不同时覆盖，旧内容的引用计数减一
     *
     * @throws IllegalArgumentException 路径上有同名文件占用了目录名，或目标是文件夹
     */
    public synchronized InsertFileResult insertFile(String path, String hash, String sliceMd5, long size,
            long mtimeSeconds) throws SQLException {
        List<String> names = splitPath(path);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Cannot write to the root directory");
        }
        String filename = names.get(names.size() - 1);
        try (var connection = dataSource.getConnection()) {
            connection.setAutoCommit(false); // 开启事务
            try {
                long parentId = makeDirectories(connection, names.subList(0, names.size() - 1));
                ObjectNodeEntity existingNode = nodeDao.getChild(connection, parentId, filename);
                long time = System.currentTimeMillis();
                var deletedHashes = new ArrayList<String>();

                if (existingNode == null) {
                    addReference(connection, hash, sliceMd5, size);
                    long id = nodeDao.insertFile(connection, parentId, filename, hash, size, mtimeSeconds, time);
                    connection.commit();
                    return new InsertFileResult(false, id, deletedHashes);
                }

                if (existingNode.folder()) {
                    throw new IllegalArgumentException("Folder with same name already exists: " + path);
                }

                if (existingNode.hash().equals(hash)) {
                    // 内容相同，只更新修改时间
                    nodeDao.updateContent(connection, existingNode.id(), hash, size, mtimeSeconds, time);
                    connection.commit();
                    return new InsertFileResult(true, existingNode.id(), deletedHashes);
                }

                releaseReference(connection, existingNode.hash(), deletedHashes);
                addReference(connection, hash, sliceMd5, size);
                nodeDao.updateContent(connection, existingNode.id(), hash, size, mtimeSeconds, time);
                connection.commit();
                return new InsertFileResult(false, existingNode.id(), deletedHashes);
            } catch (Exception e) {
                logger.error("Error inserting file {}, rolling back", path, e);
                connection.rollback();
                throw e;
            }
        }
    }

    /**
     * 逐级创建目录，已存在的目录直接复用
     *
     * @return 最后一级目录的ID
     */
    public synchronized long mkdirs(String path) throws SQLException {
        try (var connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                long id = makeDirectories(connection, splitPath(path));
                connection.commit();
                return id;
            } catch (Exception e) {
                logger.error("Error creating folder {}, rolling back", path, e);
                connection.rollback();
                throw e;
            }
        }
    }

    /**
     * 递归删除节点
     *
     * @return 引用计数降为0的内容哈希，调用方负责删除对应数据文件
     */
    public synchronized List<String> deleteNode(long id) throws SQLException {
        try (var connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                var deletedHashes = new ArrayList<String>();
                deleteNodeRecursive(connection, id, deletedHashes);
                connection.commit();
                return deletedHashes;
            } catch (Exception e) {
                logger.error("Error deleting node {}, rolling back", id, e);
                connection.rollback();
                throw e;
            }
        }
    }

    private void deleteNodeRecursive(Connection connection, long id, List<String> deletedHashes)
            throws SQLException {
        ObjectNodeEntity entity = nodeDao.get(connection, id);
        if (entity == null) {
            return;
        }

        if (entity.folder()) {
            // 递归删除子节点
            var children = nodeDao.listChildren(connection, id);
            for (var child : children) {
                deleteNodeRecursive(connection, child.id(), deletedHashes);
            }
        } else {
            releaseReference(connection, entity.hash(), deletedHashes);
        }
        nodeDao.delete(connection, id);
    }

    private ObjectNodeEntity resolve(Connection connection, List<String> names) throws SQLException {
        var current = ObjectNodeEntity.root();
        for (String name : names) {
            if (!current.folder()) {
                return null;
            }
            current = nodeDao.getChild(connection, current.id(), name);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private long makeDirectories(Connection connection, List<String> names) throws SQLException {
        long parentId = ROOT_ID;
        for (String name : names) {
            ObjectNodeEntity node = nodeDao.getChild(connection, parentId, name);
            if (node == null) {
                parentId = nodeDao.insertFolder(connection, parentId, name, System.currentTimeMillis());
            } else if (node.folder()) {
                parentId = node.id();
            } else {
                throw new IllegalArgumentException("File with same name already exists: " + name);
            }
        }
        return parentId;
    }

    private void addReference(Connection connection, String hash, String sliceMd5, long size) throws SQLException {
        if (blobDao.get(connection, hash) == null) {
            blobDao.insert(connection, hash, sliceMd5, size);
        } else {
            blobDao.addReferences(connection, hash, 1);
        }
    }

    private void releaseReference(Connection connection, String hash, List<String> deletedHashes)
            throws SQLException {
        if (blobDao.addReferences(connection, hash, -1) <= 0) {
            blobDao.deleteUnreferenced(connection, hash);
            deletedHashes.add(hash);
        }
    }
}
