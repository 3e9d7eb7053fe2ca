package com.aqua.stream.core.broadcast;

/**
 * 采集循环的策略参数
 */
public final class CaptureSettings {
    private final int warmupFrames;
    private final long warmupDelayMs;
    private final long readRetryDelayMs;

    public CaptureSettings(int warmupFrames, long warmupDelayMs, long readRetryDelayMs) {
        if (warmupFrames < 0 || warmupDelayMs < 0 || readRetryDelayMs < 0) {
            throw new IllegalArgumentException("Capture settings must not be negative");
        }
        this.warmupFrames = warmupFrames;
        this.warmupDelayMs = warmupDelayMs;
        this.readRetryDelayMs = readRetryDelayMs;
    }

    public int getWarmupFrames() { return warmupFrames; }
    public long getWarmupDelayMs() { return warmupDelayMs; }
    public long getReadRetryDelayMs() { return readRetryDelayMs; }
}
