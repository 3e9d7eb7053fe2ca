package com.aqua.stream.core.broadcast;

/**
 * 摄像头无法打开，只影响对应的 Broadcaster
 */
public class CameraUnavailableException extends RuntimeException {
    public CameraUnavailableException(String message) {
        super(message);
    }

    public CameraUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
