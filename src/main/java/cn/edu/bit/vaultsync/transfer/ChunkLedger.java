package cn.edu.bit.vaultsync.transfer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.db.ChunkLedgerDao;
import cn.edu.bit.vaultsync.entity.ChunkLedgerEntity;
import cn.edu.bit.vaultsync.entity.TransferTaskEntity;

/**
 * 分块完成情况的持久化账本
 * <p>
 * 只记录 DONE 和 FAILED，IN_FLIGHT 从不落盘；同一任务的写入在该任务的锁内进行。
 */
public class ChunkLedger {
    private static final Logger logger = LoggerFactory.getLogger(ChunkLedger.class);

    /**
     * 恢复出的任务记录
     */
    public record Snapshot(TransferTaskEntity task, List<ChunkLedgerEntity> chunks) {
    }

    private final ChunkLedgerDao dao;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ChunkLedger(ChunkLedgerDao dao) {
        this.dao = dao;
    }

    public Optional<Snapshot> load(String taskId) {
        TransferTaskEntity task = dao.getTask(taskId);
        if (task == null) {
            return Optional.empty();
        }
        return Optional.of(new Snapshot(task, dao.getChunks(taskId)));
    }

    public void create(TransferTaskEntity task, List<ChunkState> chunks) {
        var rows = new ArrayList<ChunkLedgerEntity>(chunks.size());
        for (var chunk : chunks) {
            ChunkStatus status = chunk.getStatus() == ChunkStatus.DONE ? ChunkStatus.DONE : ChunkStatus.PENDING;
            rows.add(new ChunkLedgerEntity(task.taskId(), chunk.getIndex(), chunk.getOffset(), chunk.getSize(),
                    status.name(), chunk.getRetryCount(), chunk.getToken()));
        }
        withLock(task.taskId(), () -> dao.replaceTask(task, rows));
        logger.debug("Created ledger for task {} with {} chunks", task.taskId(), rows.size());
    }

    public void recordDone(String taskId, ChunkState chunk) {
        withLock(taskId, () -> dao.updateChunk(taskId, chunk.getIndex(), ChunkStatus.DONE.name(), 0,
                chunk.getToken()));
    }

    public void recordFailed(String taskId, ChunkState chunk) {
        withLock(taskId, () -> dao.updateChunk(taskId, chunk.getIndex(), ChunkStatus.FAILED.name(),
                chunk.getRetryCount(), null));
    }

    public void remove(String taskId) {
        withLock(taskId, () -> dao.deleteTask(taskId));
        locks.remove(taskId);
    }

    private void withLock(String taskId, Runnable action) {
        ReentrantLock lock = locks.computeIfAbsent(taskId, id -> new ReentrantLock());
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 把账本中的分块恢复为内存状态：DONE 保留，其余回到 PENDING 且重试计数清零
     */
    static List<ChunkState> restoreChunks(List<ChunkLedgerEntity> rows) {
        var chunks = new ArrayList<ChunkState>(rows.size());
        for (var row : rows) {
            var chunk = new ChunkState(row.chunkIndex(), row.chunkOffset(), row.chunkSize());
            if (ChunkStatus.DONE.name().equals(row.status())) {
                chunk.restore(ChunkStatus.DONE, 0, row.token());
            }
            chunks.add(chunk);
        }
        return chunks;
    }
}
