package cn.edu.bit.vaultsync.sync;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.remote.RemoteFileInfo;

/**
 * 递归列出远端目录下的所有文件；目录不存在时返回空列表
 */
public final class RemoteTreeLister {

    private RemoteTreeLister() {
    }

    public static List<TreeEntry> list(RemoteEndpoint endpoint, String remoteDir) throws IOException, RemoteException {
        String root = remoteDir.endsWith("/") && remoteDir.length() > 1
                ? remoteDir.substring(0, remoteDir.length() - 1)
                : remoteDir;
        var stat = endpoint.stat(root);
        if (stat.isEmpty()) {
            return List.of();
        }
        if (!stat.get().directory()) {
            throw new RemoteException(RemoteException.INVALID_ARGUMENT, "Not a directory: " + root);
        }
        List<TreeEntry> entries = new ArrayList<>();
        int prefix = root.equals("/") ? 1 : root.length() + 1;
        collect(endpoint, root, prefix, entries);
        return entries;
    }

    private static void collect(RemoteEndpoint endpoint, String dir, int prefix, List<TreeEntry> entries)
            throws IOException, RemoteException {
        for (RemoteFileInfo info : endpoint.list(dir)) {
            if (info.directory()) {
                collect(endpoint, info.path(), prefix, entries);
            } else {
                entries.add(new TreeEntry(info.path().substring(prefix), info.size(), info.mtimeSeconds()));
            }
        }
    }
}
