package com.aqua.stream.core.camera;

import org.opencv.core.Mat;
import org.opencv.videoio.VideoCapture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 网络摄像头源（RTSP / HTTP URL）
 */
public class RTSPCameraSource implements CameraSource {
    private static final Logger logger = LoggerFactory.getLogger(RTSPCameraSource.class);

    private final String url;
    private final int probeAttempts;
    private VideoCapture capture;

    public RTSPCameraSource(String url, int probeAttempts) {
        this.url = url;
        this.probeAttempts = Math.max(1, probeAttempts);
    }

    @Override
    public boolean open() {
        VideoCapture candidate = new VideoCapture(url);
        if (!candidate.isOpened()) {
            logger.error("Failed to open network camera {}", url);
            candidate.release();
            return false;
        }

        Mat testFrame = new Mat();
        try {
            for (int attempt = 1; attempt <= probeAttempts; attempt++) {
                if (candidate.read(testFrame) && !testFrame.empty()) {
                    capture = candidate;
                    logger.info("Network camera {} opened, size: {}x{}", url, testFrame.cols(), testFrame.rows());
                    return true;
                }
            }
        } finally {
            testFrame.release();
        }

        logger.error("Network camera {} opened but cannot read frames", url);
        candidate.release();
        return false;
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
        }
    }

    @Override
    public boolean isOpened() {
        return capture != null && capture.isOpened();
    }

    @Override
    public String describe() {
        return "network camera " + url;
    }
}
