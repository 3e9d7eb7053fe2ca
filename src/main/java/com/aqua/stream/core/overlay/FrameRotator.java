package com.aqua.stream.core.overlay;

import org.opencv.core.Core;
import org.opencv.core.Mat;

public class FrameRotator {

    private final Rotation rotation;

    public FrameRotator(Rotation rotation) {
        this.rotation = rotation;
    }

    /**
     * 按固定角度旋转
     * @return 旋转后的新帧；NONE 时直接返回输入帧
     */
    public Mat apply(Mat frame) {
        if (rotation == Rotation.NONE) {
            return frame;
        }
        Mat rotated = new Mat();
        Core.rotate(frame, rotated, rotation.getRotateCode());
        return rotated;
    }

    public Rotation getRotation() {
        return rotation;
    }
}
