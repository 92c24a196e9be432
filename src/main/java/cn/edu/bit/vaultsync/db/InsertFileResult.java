package cn.edu.bit.vaultsync.db;

import java.util.List;

/**
 * @param isDuplicated  同名且内容相同，没有写入
 * @param id            文件节点ID
 * @param deletedHashes 引用计数降为0、需要删除数据文件的内容哈希
 */
public record InsertFileResult(boolean isDuplicated, long id, List<String> deletedHashes) {
}
