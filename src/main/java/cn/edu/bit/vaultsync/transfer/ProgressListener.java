package cn.edu.bit.vaultsync.transfer;

/**
 * 进度回调，在工作线程中调用，实现需要自行处理线程安全且不能阻塞太久
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = event -> {
    };

    void onProgress(ProgressEvent event);
}
