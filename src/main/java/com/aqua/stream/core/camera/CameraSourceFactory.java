package com.aqua.stream.core.camera;

import com.aqua.stream.config.CameraConfig;

public class CameraSourceFactory {

    private final int probeAttempts;

    public CameraSourceFactory(int probeAttempts) {
        this.probeAttempts = probeAttempts;
    }

    /**
     * 创建相机源
     * @param config 摄像头配置，source 可以是
     *               - 数字字符串 ("0", "2"): 本地摄像头索引
     *               - "rtsp://..." 或其他 URL: 网络摄像头
     * @return 相机源实例（尚未打开）
     * @throws IllegalArgumentException 如果配置为空
     */
    public CameraSource create(CameraConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Camera config cannot be null");
        }

        String source = config.getSource();
        try {
            int index = Integer.parseInt(source);
            return new LocalCameraSource(index, config.getWidth(), config.getHeight(),
                    config.getFrameRate(), probeAttempts);
        } catch (NumberFormatException e) {
            return new RTSPCameraSource(source, probeAttempts);
        }
    }
}
