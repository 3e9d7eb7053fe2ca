package com.aqua.stream.service;

import com.aqua.stream.config.CameraConfig;
import com.aqua.stream.config.CameraRegistry;
import com.aqua.stream.config.NativeLibraryLoader;
import com.aqua.stream.config.StreamProperties;
import com.aqua.stream.core.broadcast.BroadcasterState;
import com.aqua.stream.core.broadcast.CaptureSettings;
import com.aqua.stream.core.broadcast.CameraUnavailableException;
import com.aqua.stream.core.broadcast.FrameBroadcaster;
import com.aqua.stream.core.broadcast.FrameEncoder;
import com.aqua.stream.core.camera.CameraSourceFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 摄像头生命周期管理
 * <p>
 * 每个注册的摄像头对应一个 {@link FrameBroadcaster}，启动失败只影响该摄像头。
 */
@Service
public class CameraService {
    private static final Logger logger = LoggerFactory.getLogger(CameraService.class);

    private final StreamProperties properties;
    private final Map<Integer, FrameBroadcaster> broadcasters;

    @Autowired
    public CameraService(CameraRegistry registry, StreamProperties properties) {
        this(registry, properties, new CameraSourceFactory(properties.getProbeAttempts()), Clock.systemDefaultZone());
    }

    public CameraService(CameraRegistry registry, StreamProperties properties,
                         CameraSourceFactory sourceFactory, Clock clock) {
        this.properties = properties;
        CaptureSettings settings = new CaptureSettings(
                properties.getWarmupFrames(),
                properties.getWarmupDelayMs(),
                properties.getReadRetryDelayMs());
        FrameEncoder encoder = new FrameEncoder(properties.getJpegQuality());

        Map<Integer, FrameBroadcaster> bySlot = new LinkedHashMap<>();
        for (CameraConfig config : registry.getCameras()) {
            bySlot.put(config.getSlot(),
                    new FrameBroadcaster(config, sourceFactory.create(config), encoder, settings, clock));
        }
        this.broadcasters = Collections.unmodifiableMap(bySlot);
    }

    @PostConstruct
    public void init() {
        logger.info("CameraService initialized - {} camera(s) registered, JPEG Quality: {}, auto-start: {}",
                broadcasters.size(), properties.getJpegQuality(), properties.isAutoStart());
        if (properties.isAutoStart()) {
            NativeLibraryLoader.loadNativeLibraries();
            startCameras();
        }
    }

    /**
     * 依次启动所有摄像头，单个失败不影响其他摄像头
     */
    public void startCameras() {
        for (FrameBroadcaster broadcaster : broadcasters.values()) {
            if (broadcaster.getState() != BroadcasterState.NEW) {
                continue;
            }
            int slot = broadcaster.getConfig().getSlot();
            try {
                broadcaster.start();
                logger.info("Camera {} initialized successfully at {}", slot, broadcaster.getConfig().getStreamPath());
            } catch (CameraUnavailableException e) {
                logger.error("Camera {} failed to initialize: {}", slot, e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Camera {} failed to initialize", slot, e);
            }
        }

        int running = getRunningCount();
        if (running == 0 && !broadcasters.isEmpty()) {
            logger.error("No cameras could be initialized, stream endpoints will answer 503");
        } else {
            logger.info("{} of {} camera(s) streaming", running, broadcasters.size());
        }
    }

    /**
     * 停止所有摄像头
     */
    @PreDestroy
    public void stopCameras() {
        logger.info("Stopping cameras...");
        for (FrameBroadcaster broadcaster : broadcasters.values()) {
            try {
                broadcaster.stop();
            } catch (RuntimeException e) {
                logger.warn("Error stopping camera {}: {}", broadcaster.getConfig().getSlot(), e.getMessage());
            }
        }
        logger.info("All cameras stopped");
    }

    public Map<Integer, FrameBroadcaster> getBroadcasters() {
        return broadcasters;
    }

    public FrameBroadcaster getBroadcaster(int slot) {
        return broadcasters.get(slot);
    }

    public int getRunningCount() {
        return (int) broadcasters.values().stream().filter(FrameBroadcaster::isRunning).count();
    }

    public int getConfiguredCameraCount() {
        return broadcasters.size();
    }
}
