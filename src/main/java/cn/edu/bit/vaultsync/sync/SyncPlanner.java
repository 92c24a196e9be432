package cn.edu.bit.vaultsync.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 比较本地和远端目录树
 * <p>
 * 大小和修改时间都相同的文件视为未变化。只修改内容而大小、时间都不变的文件不会被发现。
 */
public final class SyncPlanner {

    private SyncPlanner() {
    }

    /**
     * @return 按相对路径排序的差异列表，包含 SKIP 项
     */
    public static List<SyncDiffEntry> diff(Collection<TreeEntry> local, Collection<TreeEntry> remote) {
        Map<String, TreeEntry> remoteByPath = new HashMap<>();
        for (var entry : remote) {
            remoteByPath.put(entry.relativePath(), entry);
        }
        List<SyncDiffEntry> result = new ArrayList<>();
        Map<String, Boolean> seen = new HashMap<>();
        for (var entry : local) {
            seen.put(entry.relativePath(), Boolean.TRUE);
            TreeEntry other = remoteByPath.get(entry.relativePath());
            SyncAction action;
            if (other == null) {
                action = SyncAction.CREATE_REMOTE;
            } else if (other.size() == entry.size() && other.mtimeSeconds() == entry.mtimeSeconds()) {
                action = SyncAction.SKIP;
            } else {
                action = SyncAction.UPDATE_REMOTE;
            }
            result.add(new SyncDiffEntry(entry.relativePath(), action));
        }
        for (var entry : remote) {
            if (!seen.containsKey(entry.relativePath())) {
                result.add(new SyncDiffEntry(entry.relativePath(), SyncAction.DELETE_REMOTE));
            }
        }
        result.sort(Comparator.comparing(SyncDiffEntry::relativePath));
        return result;
    }
}
