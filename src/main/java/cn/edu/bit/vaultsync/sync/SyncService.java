package cn.edu.bit.vaultsync.sync;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cn.edu.bit.vaultsync.crypto.CipherSuite;
import cn.edu.bit.vaultsync.crypto.EnvelopeCodec;
import cn.edu.bit.vaultsync.exception.RemoteException;
import cn.edu.bit.vaultsync.remote.RemoteEndpoint;
import cn.edu.bit.vaultsync.session.AccountContext;
import cn.edu.bit.vaultsync.transfer.BatchResult;
import cn.edu.bit.vaultsync.transfer.ProgressListener;
import cn.edu.bit.vaultsync.transfer.TransferRequest;
import cn.edu.bit.vaultsync.transfer.TransferResult;
import cn.edu.bit.vaultsync.transfer.TransferScheduler;

/**
 * 单向同步：让远端目录与本地目录一致
 * <p>
 * 新建和更新的文件交给调度器上传（先尝试秒传），全部上传结束后再删除远端多余的文件。
 */
public class SyncService {
    private static final Logger logger = LoggerFactory.getLogger(SyncService.class);

    private final RemoteEndpoint endpoint;
    private final TransferScheduler scheduler;

    public SyncService(RemoteEndpoint endpoint, TransferScheduler scheduler) {
        this.endpoint = endpoint;
        this.scheduler = scheduler;
    }

    public SyncReport sync(AccountContext context, Path localDir, String remoteDir)
            throws IOException, RemoteException, InterruptedException {
        return sync(context, localDir, remoteDir, ProgressListener.NONE);
    }

    public SyncReport sync(AccountContext context, Path localDir, String remoteDir, ProgressListener listener)
            throws IOException, RemoteException, InterruptedException {
        String remoteRoot = context.resolve(remoteDir);
        List<TreeEntry> local = LocalTreeScanner.scan(localDir);
        if (context.encrypts()) {
            local = toEncryptedSizes(context, local);
        }
        List<TreeEntry> remote = RemoteTreeLister.list(endpoint, remoteRoot);
        List<SyncDiffEntry> plan = SyncPlanner.diff(local, remote);

        List<TransferRequest> uploads = new ArrayList<>();
        Map<String, String> relativeByRemote = new LinkedHashMap<>();
        List<String> deletes = new ArrayList<>();
        for (var entry : plan) {
            switch (entry.action()) {
                case CREATE_REMOTE, UPDATE_REMOTE -> {
                    String remotePath = join(remoteRoot, entry.relativePath());
                    uploads.add(new TransferRequest(localDir.resolve(entry.relativePath()), remotePath));
                    relativeByRemote.put(remotePath, entry.relativePath());
                }
                case DELETE_REMOTE -> deletes.add(entry.relativePath());
                case SKIP -> {
                }
            }
        }
        logger.info("Sync {} -> {}: {} uploads, {} deletes, {} unchanged", localDir, remoteRoot, uploads.size(),
                deletes.size(), plan.size() - uploads.size() - deletes.size());

        List<String> uploaded = new ArrayList<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        if (!uploads.isEmpty()) {
            BatchResult batch;
            try {
                batch = scheduler.uploadAll(context, uploads, listener).get();
            } catch (ExecutionException e) {
                throw new IOException("Batch upload failed", e.getCause());
            }
            for (TransferResult result : batch.completed()) {
                uploaded.add(relativeByRemote.get(result.remotePath()));
            }
            batch.failures().forEach((remotePath, error) -> failures.put(relativeByRemote.get(remotePath), error));
        }

        List<String> deleted = new ArrayList<>();
        for (String relativePath : deletes) {
            try {
                endpoint.delete(join(remoteRoot, relativePath));
                deleted.add(relativePath);
            } catch (IOException | RemoteException e) {
                logger.warn("Failed to delete remote {}: {}", relativePath, e.getMessage());
                failures.put(relativePath, e);
            }
        }
        if (!deleted.isEmpty()) {
            logger.info("Deleted {} remote files", deleted.size());
        }
        return new SyncReport(plan, uploaded, deleted, failures);
    }

    private static List<TreeEntry> toEncryptedSizes(AccountContext context, List<TreeEntry> entries) {
        List<TreeEntry> mapped = new ArrayList<>(entries.size());
        int version = context.formatVersion() > 0 ? context.formatVersion() : EnvelopeCodec.CURRENT_VERSION;
        for (var entry : entries) {
            long size = CipherSuite.encryptedLength(context.algorithm(), version, entry.size());
            mapped.add(new TreeEntry(entry.relativePath(), size, entry.mtimeSeconds()));
        }
        return mapped;
    }

    static String join(String root, String relativePath) {
        return root.endsWith("/") ? root + relativePath : root + "/" + relativePath;
    }
}
