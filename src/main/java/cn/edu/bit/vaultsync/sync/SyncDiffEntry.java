package cn.edu.bit.vaultsync.sync;

public record SyncDiffEntry(String relativePath, SyncAction action) {
}
