package com.aqua.stream.core.overlay;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 周期性文字标签叠加
 * <p>
 * 每个周期（cycleMinutes）开始后的 durationSeconds 内显示标签，其余时间原样透传。
 * 状态只由生产者线程访问，不做同步。
 */
public class OverlayCompositor {
    private static final Logger logger = LoggerFactory.getLogger(OverlayCompositor.class);

    private static final int FONT = Imgproc.FONT_HERSHEY_SIMPLEX;
    private static final int MARGIN = 20;
    private static final int PADDING = 5;
    private static final Scalar BACKGROUND = new Scalar(0, 0, 0);

    public enum Transition {
        NONE, SHOWN, HIDDEN
    }

    private final String cameraName;
    private final String label;
    private final OverlayConfig config;
    private final Scalar textColor;
    private final long cycleStart;
    private boolean shown;

    public OverlayCompositor(int slot, OverlayConfig config, long cycleStartMillis) {
        this.cameraName = "camera-" + slot;
        // 多路画面并排时靠前缀区分摄像头
        this.label = "Camera " + slot + ": " + config.getText();
        this.config = config;
        int[] bgr = config.getTextColor();
        this.textColor = new Scalar(bgr[0], bgr[1], bgr[2]);
        this.cycleStart = cycleStartMillis;
        this.shown = false;
    }

    /**
     * elapsed = (now - cycleStart) mod cycle，elapsed < duration 时可见
     */
    public boolean isVisibleAt(long nowMillis) {
        if (!config.isEnabled()) {
            return false;
        }
        long elapsed = Math.floorMod(nowMillis - cycleStart, config.getCycleMillis());
        return elapsed < config.getDurationMillis();
    }

    /**
     * 更新显示状态，每个边沿只记录一次日志
     */
    public Transition updateVisibility(long nowMillis) {
        boolean visible = isVisibleAt(nowMillis);
        if (visible == shown) {
            return Transition.NONE;
        }
        shown = visible;
        if (visible) {
            logger.info("[{}] Label '{}' displayed for {}s", cameraName, config.getText(), config.getDurationSeconds());
            return Transition.SHOWN;
        }
        logger.info("[{}] Label '{}' hidden - next display in {} minutes",
                cameraName, config.getText(), config.getCycleMinutes());
        return Transition.HIDDEN;
    }

    /**
     * 对帧做叠加（原地修改）
     * @return 本帧是否绘制了标签
     */
    public boolean apply(Mat frame, long nowMillis) {
        if (!config.isEnabled()) {
            return false;
        }
        updateVisibility(nowMillis);
        if (shown) {
            render(frame);
        }
        return shown;
    }

    public boolean isShown() {
        return shown;
    }

    String getLabel() {
        return label;
    }

    void render(Mat frame) {
        int[] baseline = new int[1];
        Size textSize = Imgproc.getTextSize(label, FONT, config.getFontScale(), config.getThickness(), baseline);
        int x = MARGIN;
        int y = frame.rows() - MARGIN;

        // 半透明背景
        Mat overlay = frame.clone();
        try {
            Imgproc.rectangle(overlay,
                    new Point(x - PADDING, y - textSize.height - PADDING),
                    new Point(x + textSize.width + PADDING, y + baseline[0] + PADDING),
                    BACKGROUND, -1);
            blend(overlay, frame, config.getBackgroundOpacity());
        } finally {
            overlay.release();
        }

        // 文字单独混合，透明度独立于背景
        Mat textOverlay = frame.clone();
        try {
            Imgproc.putText(textOverlay, label, new Point(x, y), FONT,
                    config.getFontScale(), textColor, config.getThickness());
            blend(textOverlay, frame, config.getTextOpacity());
        } finally {
            textOverlay.release();
        }
    }

    private static void blend(Mat layer, Mat frame, double opacity) {
        Core.addWeighted(layer, opacity, frame, 1.0 - opacity, 0, frame);
    }
}
