package com.aqua.stream.core.camera;

import org.opencv.core.Mat;
import org.opencv.videoio.VideoCapture;
import org.opencv.videoio.Videoio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * USB / 本地摄像头源
 * <p>
 * 按固定优先级尝试采集后端：平台首选 API，然后 CAP_ANY。
 * 分辨率和帧率只是请求值，驱动可能静默调整，实际值回读后记录日志。
 */
public class LocalCameraSource implements CameraSource {
    private static final Logger logger = LoggerFactory.getLogger(LocalCameraSource.class);

    private final int index;
    private final int width;
    private final int height;
    private final double frameRate;
    private final int probeAttempts;
    private VideoCapture capture;

    public LocalCameraSource(int index, int width, int height, double frameRate, int probeAttempts) {
        this.index = index;
        this.width = width;
        this.height = height;
        this.frameRate = frameRate;
        this.probeAttempts = Math.max(1, probeAttempts);
    }

    /**
     * 后端候选列表（按优先级）
     */
    static List<Integer> backendCandidates(String osName) {
        String os = osName == null ? "" : osName.toLowerCase();
        int preferred;
        if (os.contains("mac") || os.contains("darwin")) {
            preferred = Videoio.CAP_AVFOUNDATION;
        } else if (os.contains("win")) {
            preferred = Videoio.CAP_DSHOW;
        } else {
            preferred = Videoio.CAP_V4L2;
        }
        return List.of(preferred, Videoio.CAP_ANY);
    }

    @Override
    public boolean open() {
        for (int backend : backendCandidates(System.getProperty("os.name"))) {
            logger.info("Opening camera {} with backend {}", index, backendName(backend));
            VideoCapture candidate = new VideoCapture(index, backend);
            if (!candidate.isOpened()) {
                logger.warn("Failed to open camera {} with backend {}", index, backendName(backend));
                candidate.release();
                continue;
            }

            applySettings(candidate);

            if (probe(candidate)) {
                capture = candidate;
                logger.info("Camera {} opened with backend {}", index, backendName(backend));
                return true;
            }
            logger.warn("Camera {} opened with backend {} but cannot read frames", index, backendName(backend));
            candidate.release();
        }

        logger.error("Failed to open camera {} with any backend", index);
        return false;
    }

    private void applySettings(VideoCapture candidate) {
        candidate.set(Videoio.CAP_PROP_FRAME_WIDTH, width);
        candidate.set(Videoio.CAP_PROP_FRAME_HEIGHT, height);
        candidate.set(Videoio.CAP_PROP_FPS, frameRate);

        int actualWidth = (int) candidate.get(Videoio.CAP_PROP_FRAME_WIDTH);
        int actualHeight = (int) candidate.get(Videoio.CAP_PROP_FRAME_HEIGHT);
        double actualFps = candidate.get(Videoio.CAP_PROP_FPS);
        logger.info("Camera {} requested {}x{} @ {} FPS, actual {}x{} @ {} FPS",
                index, width, height, frameRate, actualWidth, actualHeight, actualFps);

        // 很多摄像头只支持固定模式，不一致只告警
        if (actualWidth != width || actualHeight != height) {
            logger.warn("Camera {} is using {}x{} instead of requested {}x{}",
                    index, actualWidth, actualHeight, width, height);
        }
        if (Math.abs(actualFps - frameRate) > 0.01) {
            logger.warn("Camera {} is using {} FPS instead of requested {} FPS", index, actualFps, frameRate);
        }
    }

    private boolean probe(VideoCapture candidate) {
        Mat testFrame = new Mat();
        try {
            for (int attempt = 1; attempt <= probeAttempts; attempt++) {
                if (candidate.read(testFrame) && !testFrame.empty()) {
                    logger.info("Camera {} test read successful on attempt {}, size: {}x{}",
                            index, attempt, testFrame.cols(), testFrame.rows());
                    return true;
                }
            }
            return false;
        } finally {
            testFrame.release();
        }
    }

    private static String backendName(int backend) {
        if (backend == Videoio.CAP_V4L2) return "V4L2";
        if (backend == Videoio.CAP_DSHOW) return "DSHOW";
        if (backend == Videoio.CAP_AVFOUNDATION) return "AVFOUNDATION";
        if (backend == Videoio.CAP_ANY) return "ANY";
        return String.valueOf(backend);
    }

    @Override
    public Mat read() {
        if (capture == null || !capture.isOpened()) {
            return null;
        }

        Mat frame = new Mat();
        boolean success = capture.read(frame);

        if (!success || frame.empty()) {
            frame.release();
            return null;
        }

        return frame;
    }

    @Override
    public void close() {
        if (capture != null) {
            capture.release();
            capture = null;
            logger.info("Camera {} released", index);
        }
    }

    @Override
    public boolean isOpened() {
        return capture != null && capture.isOpened();
    }

    @Override
    public String describe() {
        return "local camera " + index;
    }
}
