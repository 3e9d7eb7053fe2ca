package com.aqua.stream.config;

import com.aqua.stream.core.overlay.OverlayConfig;
import com.aqua.stream.core.overlay.Rotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 摄像头静态注册表：slot -> CameraConfig
 * <p>
 * 启动时从 {@link StreamProperties} 构建并校验一次，配置错误直接让应用启动失败
 */
@Component
public class CameraRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CameraRegistry.class);

    private final Map<Integer, CameraConfig> cameras;

    @Autowired
    public CameraRegistry(StreamProperties properties) {
        this(build(properties.getCameras()));
    }

    public CameraRegistry(List<CameraConfig> configs) {
        Map<Integer, CameraConfig> bySlot = new LinkedHashMap<>();
        for (CameraConfig config : configs) {
            if (bySlot.putIfAbsent(config.getSlot(), config) != null) {
                throw new IllegalArgumentException("Duplicate camera slot: " + config.getSlot());
            }
        }
        this.cameras = Collections.unmodifiableMap(bySlot);
        if (cameras.isEmpty()) {
            logger.warn("No cameras configured under camera-stream.cameras");
        }
        cameras.values().forEach(c -> logger.info("Registered {}", c));
    }

    private static List<CameraConfig> build(List<StreamProperties.CameraProperties> cameraProperties) {
        List<CameraConfig> configs = new ArrayList<>();
        if (cameraProperties == null) {
            return configs;
        }
        for (int i = 0; i < cameraProperties.size(); i++) {
            StreamProperties.CameraProperties p = cameraProperties.get(i);
            int slot = p.getSlot() != null ? p.getSlot() : i;
            configs.add(new CameraConfig(
                    slot,
                    p.getSource(),
                    p.getDescription(),
                    p.getWidth(),
                    p.getHeight(),
                    p.getFrameRate(),
                    p.getMaxStreamFps(),
                    Rotation.fromDegrees(p.getRotation()),
                    toOverlay(p.getOverlay())));
        }
        return configs;
    }

    private static OverlayConfig toOverlay(StreamProperties.OverlayProperties o) {
        if (o == null) {
            return OverlayConfig.disabled();
        }
        return OverlayConfig.fromColorList(
                o.isEnabled(),
                o.getText(),
                o.getCycleMinutes(),
                o.getDurationSeconds(),
                o.getFontScale(),
                o.getThickness(),
                o.getBackgroundOpacity(),
                o.getTextOpacity(),
                o.getTextColor());
    }

    public List<CameraConfig> getCameras() {
        return List.copyOf(cameras.values());
    }

    public CameraConfig getCamera(int slot) {
        return cameras.get(slot);
    }

    public int size() {
        return cameras.size();
    }
}
