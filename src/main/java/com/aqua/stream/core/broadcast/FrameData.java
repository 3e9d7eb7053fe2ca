package com.aqua.stream.core.broadcast;

/**
 * 帧数据封装类，包含 JPEG 字节、时间戳和序列号
 */
public final class FrameData {
    private final byte[] data;
    private final long timestamp;
    private final long sequence;

    public FrameData(byte[] data, long timestamp, long sequence) {
        this.data = data;
        this.timestamp = timestamp;
        this.sequence = sequence;
    }

    public byte[] getData() { return data; }
    public long getTimestamp() { return timestamp; }
    public long getSequence() { return sequence; }
}
