package com.aqua.stream.core.broadcast;

/**
 * 等待帧时 Broadcaster 已停止（或从未运行）
 */
public class BroadcasterStoppedException extends RuntimeException {
    public BroadcasterStoppedException(String message) {
        super(message);
    }
}
