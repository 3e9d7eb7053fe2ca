package com.aqua.stream.core.camera;

import org.opencv.core.Mat;

/**
 * 相机采集源，只允许一个生产者线程使用
 */
public interface CameraSource {
    /**
     * 打开相机源
     * @return 是否成功打开并读到可解码的帧
     */
    boolean open();

    /**
     * 读取一帧图像
     * @return 图像帧，读取失败返回 null（由调用方释放）
     */
    Mat read();

    /**
     * 关闭相机源
     */
    void close();

    /**
     * 检查相机是否已打开
     * @return 是否已打开
     */
    boolean isOpened();

    /**
     * 用于日志的源描述
     */
    String describe();
}
