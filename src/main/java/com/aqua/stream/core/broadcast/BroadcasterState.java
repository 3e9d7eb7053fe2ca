package com.aqua.stream.core.broadcast;

public enum BroadcasterState {
    NEW,
    RUNNING,
    /** 打开摄像头失败 */
    FAILED,
    /** 终止状态，不可重启 */
    STOPPED
}
