package cn.edu.bit.vaultsync.fingerprint;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.db.FingerprintCacheDao;
import cn.edu.bit.vaultsync.entity.FingerprintCacheEntity;

/**
 * 持久化的指纹缓存，避免为未修改的文件重新计算指纹
 * 以 (本地路径, 远端路径, 用户ID) 为键
 */
public class FingerprintCache {
    private static final Logger logger = LoggerFactory.getLogger(FingerprintCache.class);
    private final FingerprintCacheDao dao;

    public FingerprintCache(FingerprintCacheDao dao) {
        this.dao = dao;
    }

    /**
     * 本地文件修改时间和记录一致时命中
     */
    public Optional<FingerprintCacheEntity> lookup(String localPath, String remotePath, long userId,
            long localMtime) {
        FingerprintCacheEntity entity = dao.getByKey(localPath, remotePath, userId);
        if (entity == null) {
            return Optional.empty();
        }
        if (entity.localMtime() != localMtime) {
            logger.debug("Fingerprint cache stale for {} (mtime {} != {})", localPath, entity.localMtime(),
                    localMtime);
            return Optional.empty();
        }
        return Optional.of(entity);
    }

    public void save(FingerprintCacheEntity entity) {
        dao.upsert(entity);
    }

    public List<FingerprintCacheEntity> list(FingerprintCacheDao.Order order, boolean descending, int limit,
            int offset) {
        return dao.list(order, descending, limit, offset);
    }

    public List<FingerprintCacheEntity> list(List<Long> ids) {
        return dao.listByIds(ids);
    }

    public List<FingerprintCacheEntity> search(String keyword, Set<FingerprintCacheDao.SearchField> fields) {
        return dao.search(keyword, fields);
    }

    public boolean delete(long id) {
        return dao.deleteById(id);
    }
}
