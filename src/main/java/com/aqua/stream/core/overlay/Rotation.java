package com.aqua.stream.core.overlay;

import org.opencv.core.Core;

/**
 * 摄像头安装方向的固定旋转角度（顺时针）
 */
public enum Rotation {
    NONE(0, -1),
    CLOCKWISE_90(90, Core.ROTATE_90_CLOCKWISE),
    ROTATE_180(180, Core.ROTATE_180),
    CLOCKWISE_270(270, Core.ROTATE_90_COUNTERCLOCKWISE);

    private final int degrees;
    private final int rotateCode;

    Rotation(int degrees, int rotateCode) {
        this.degrees = degrees;
        this.rotateCode = rotateCode;
    }

    public static Rotation fromDegrees(int degrees) {
        for (Rotation rotation : values()) {
            if (rotation.degrees == degrees) {
                return rotation;
            }
        }
        throw new IllegalArgumentException("Unsupported rotation: " + degrees + " (expected 0, 90, 180 or 270)");
    }

    public int getDegrees() {
        return degrees;
    }

    /**
     * OpenCV Core.rotate 使用的旋转码，NONE 时为 -1
     */
    public int getRotateCode() {
        return rotateCode;
    }
}
