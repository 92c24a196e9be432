package cn.edu.bit.vaultsync.transfer;

public enum TransferDirection {
    UPLOAD,
    DOWNLOAD
}
