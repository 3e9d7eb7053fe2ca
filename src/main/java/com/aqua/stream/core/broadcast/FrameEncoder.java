package com.aqua.stream.core.broadcast;

import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;

/**
 * JPEG 编码
 */
public class FrameEncoder {

    private final int jpegQuality;

    public FrameEncoder(int jpegQuality) {
        if (jpegQuality < 1 || jpegQuality > 100) {
            throw new IllegalArgumentException("JPEG quality must be within [1, 100], got " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
    }

    public byte[] encode(Mat frame) {
        if (frame == null || frame.empty()) {
            throw new FrameEncodingException("Cannot encode an empty frame");
        }

        MatOfByte mob = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, jpegQuality);
        try {
            if (!Imgcodecs.imencode(".jpg", frame, mob, params)) {
                throw new FrameEncodingException("imencode returned false for " + frame.cols() + "x" + frame.rows() + " frame");
            }
            byte[] jpegBytes = mob.toArray();
            if (jpegBytes.length == 0) {
                throw new FrameEncodingException("imencode produced no data");
            }
            return jpegBytes;
        } finally {
            mob.release();
            params.release();
        }
    }

    public int getJpegQuality() {
        return jpegQuality;
    }
}
