package cn.edu.bit.vaultsync.transfer;

import java.util.List;
import java.util.Map;

/**
 * 批量传输结果，单个任务失败不影响其他任务
 *
 * @param completed 成功（或取消）的任务结果
 * @param failures  远端路径 -> 失败原因
 */
public record BatchResult(List<TransferResult> completed, Map<String, Throwable> failures) {

    public boolean isSuccessful() {
        return failures.isEmpty();
    }
}
