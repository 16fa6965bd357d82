package com.projectgroup5.dogfight.protocol;

/**
 * 客户端无法解析或应用状态增量，需要请求全量快照
 */
public class SnapshotDecodeException extends Exception {

    public SnapshotDecodeException(String message) {
        super(message);
    }

    public SnapshotDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
