package cn.edu.bit.vaultsync.sync;

import java.util.List;
import java.util.Map;

/**
 * 一次同步的结果
 *
 * @param plan     差异列表
 * @param uploaded 成功上传（新建或更新）的相对路径
 * @param deleted  成功删除的相对路径
 * @param failures 相对路径 -> 失败原因
 */
public record SyncReport(List<SyncDiffEntry> plan, List<String> uploaded, List<String> deleted,
        Map<String, Throwable> failures) {

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public long count(SyncAction action) {
        return plan.stream().filter(entry -> entry.action() == action).count();
    }
}
