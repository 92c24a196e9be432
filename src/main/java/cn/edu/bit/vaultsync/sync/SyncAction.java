package cn.edu.bit.vaultsync.sync;

public enum SyncAction {
    CREATE_REMOTE,
    UPDATE_REMOTE,
    DELETE_REMOTE,
    SKIP
}
