package com.aqua.stream.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * application.yml 中 camera-stream 段的绑定对象
 * <p>
 * 这里只是可变的配置载体，启动时由 {@link CameraRegistry} 校验并转换为不可变的 {@link CameraConfig}
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "camera-stream")
public class StreamProperties {
    private boolean autoStart = true;
    private String pageTitle = "Aquaponics - Multi-Camera Monitor";
    private int jpegQuality = 85;
    private int warmupFrames = 5;
    private long warmupDelayMs = 100;
    private int probeAttempts = 3;
    private long readRetryDelayMs = 10;
    // 0 表示无限等待下一帧
    private long frameTimeoutMs = 0;
    private List<CameraProperties> cameras = new ArrayList<>();

    @Data
    public static class CameraProperties {
        private Integer slot;
        private String source = "0"; // 设备索引或 rtsp:// 地址
        private String description = "Additional Camera";
        private int width = 1280;
        private int height = 720;
        private double frameRate = 10;
        private double maxStreamFps = 10;
        private int rotation = 0;
        private OverlayProperties overlay = new OverlayProperties();
    }

    @Data
    public static class OverlayProperties {
        private boolean enabled = false;
        private String text = "Camera Feed";
        private int cycleMinutes = 15;
        private int durationSeconds = 60;
        private double fontScale = 0.7;
        private int thickness = 2;
        private double backgroundOpacity = 0.6;
        private double textOpacity = 0.9;
        // BGR
        private List<Integer> textColor = new ArrayList<>(List.of(255, 255, 0));
    }
}
