package cn.edu.bit.vaultsync.transfer;

public enum ChunkStatus {
    PENDING,
    IN_FLIGHT,
    DONE,
    FAILED
}
