package com.aqua.stream.core.broadcast;

public class FrameEncodingException extends RuntimeException {
    public FrameEncodingException(String message) {
        super(message);
    }
}
