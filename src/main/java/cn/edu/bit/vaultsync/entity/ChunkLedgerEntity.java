package cn.edu.bit.vaultsync.entity;

/**
 * 分块记录
 * 对应数据库表: chunk_ledger
 */
public record ChunkLedgerEntity(String taskId, int chunkIndex, long chunkOffset, int chunkSize, String status,
        int retryCount, String token) {
}
