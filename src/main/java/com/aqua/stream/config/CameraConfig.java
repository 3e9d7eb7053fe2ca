package com.aqua.stream.config;

import com.aqua.stream.core.overlay.OverlayConfig;
import com.aqua.stream.core.overlay.Rotation;

/**
 * 单个摄像头的静态配置，启动时构建一次，之后不再修改
 */
public final class CameraConfig {
    private final int slot;
    private final String source;
    private final String description;
    private final int width;
    private final int height;
    private final double frameRate;
    private final double maxStreamFps;
    private final Rotation rotation;
    private final OverlayConfig overlay;

    public CameraConfig(int slot, String source, String description, int width, int height,
                        double frameRate, double maxStreamFps, Rotation rotation, OverlayConfig overlay) {
        if (slot < 0) {
            throw new IllegalArgumentException("Camera slot must not be negative: " + slot);
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Camera " + slot + " has no source");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Camera " + slot + " resolution must be positive: " + width + "x" + height);
        }
        if (frameRate <= 0 || maxStreamFps <= 0) {
            throw new IllegalArgumentException("Camera " + slot + " frame rates must be positive");
        }
        this.slot = slot;
        this.source = source.trim();
        this.description = description == null ? "" : description;
        this.width = width;
        this.height = height;
        this.frameRate = frameRate;
        this.maxStreamFps = maxStreamFps;
        this.rotation = rotation == null ? Rotation.NONE : rotation;
        this.overlay = overlay == null ? OverlayConfig.disabled() : overlay;
    }

    public int getSlot() { return slot; }
    public String getSource() { return source; }
    public String getDescription() { return description; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public double getFrameRate() { return frameRate; }
    public double getMaxStreamFps() { return maxStreamFps; }
    public Rotation getRotation() { return rotation; }
    public OverlayConfig getOverlay() { return overlay; }

    /**
     * 两次推送之间的最小间隔（毫秒）
     */
    public long getMinPublishIntervalMs() {
        return Math.round(1000.0 / maxStreamFps);
    }

    public String getStreamPath() {
        return "/stream" + slot + ".mjpg";
    }

    @Override
    public String toString() {
        return "CameraConfig{slot=" + slot + ", source=" + source + ", " + width + "x" + height
                + "@" + frameRate + "fps, cap=" + maxStreamFps + "fps, rotation=" + rotation.getDegrees()
                + ", overlay=" + overlay.isEnabled() + "}";
    }
}
