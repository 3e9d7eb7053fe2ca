package com.aqua.stream.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个摄像头的运行状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CameraStatus {
    private int slot;
    private String source;
    private String description;
    private String streamPath;
    private String state;
    private int width;
    private int height;
    private double frameRate;
    private double maxStreamFps;
    private int rotation;
    private boolean overlayEnabled;
    private boolean overlayShown;
    private long framesPublished;
    private long framesDropped;
    private long readFailures;
    private long encodeFailures;
    private Long lastFrameTimestamp;
}
