package com.aqua.stream.controller;

import com.aqua.stream.config.CameraConfig;
import com.aqua.stream.core.broadcast.FrameBroadcaster;
import com.aqua.stream.core.broadcast.FrameData;
import com.aqua.stream.core.sensor.SensorProbe;
import com.aqua.stream.dto.CameraStatus;
import com.aqua.stream.server.ConnectionCounter;
import com.aqua.stream.service.CameraService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 摄像头状态接口
 */
@RestController
@RequestMapping("/api/camera")
@Tag(name = "摄像头状态", description = "摄像头运行状态、推流统计及传感器读数")
public class CameraStatusController {
    private static final Logger logger = LoggerFactory.getLogger(CameraStatusController.class);

    @Autowired
    private CameraService cameraService;

    @Autowired
    private ConnectionCounter streamConnectionCounter;

    @Autowired(required = false)
    private List<SensorProbe> sensorProbes = List.of();

    /**
     * 获取摄像头状态
     */
    @GetMapping("/status")
    @Operation(
            summary = "获取摄像头状态",
            description = """
                    返回每个摄像头的运行状态和推流统计，以及当前 MJPEG 连接数。

                    **state 取值：**
                    - `NEW`：尚未启动
                    - `RUNNING`：正在采集并推流
                    - `FAILED`：启动时无法打开摄像头，对应流地址返回 503
                    - `STOPPED`：已停止
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "状态查询成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(value = """
                                    {
                                      "status": "success",
                                      "data": {
                                        "activeConnections": 2,
                                        "runningCount": 1,
                                        "configuredCount": 2,
                                        "cameras": [
                                          {"slot": 0, "state": "RUNNING", "streamPath": "/stream0.mjpg", "framesPublished": 1520}
                                        ],
                                        "sensors": {"waterTemperature": 21.5}
                                      }
                                    }
                                    """)
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> response = new HashMap<>();
        Map<String, Object> data = new LinkedHashMap<>();

        List<CameraStatus> cameras = new ArrayList<>();
        for (FrameBroadcaster broadcaster : cameraService.getBroadcasters().values()) {
            cameras.add(toStatus(broadcaster));
        }

        data.put("activeConnections", streamConnectionCounter.getActive());
        data.put("totalConnections", streamConnectionCounter.getTotal());
        data.put("runningCount", cameraService.getRunningCount());
        data.put("configuredCount", cameraService.getConfiguredCameraCount());
        data.put("cameras", cameras);
        data.put("sensors", readSensors());

        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    private CameraStatus toStatus(FrameBroadcaster broadcaster) {
        CameraConfig config = broadcaster.getConfig();
        FrameData latest = broadcaster.getLatestFrame();
        return CameraStatus.builder()
                .slot(config.getSlot())
                .source(config.getSource())
                .description(config.getDescription())
                .streamPath(config.getStreamPath())
                .state(broadcaster.getState().name())
                .width(config.getWidth())
                .height(config.getHeight())
                .frameRate(config.getFrameRate())
                .maxStreamFps(config.getMaxStreamFps())
                .rotation(config.getRotation().getDegrees())
                .overlayEnabled(config.getOverlay().isEnabled())
                .overlayShown(broadcaster.isOverlayShown())
                .framesPublished(broadcaster.getFramesPublished())
                .framesDropped(broadcaster.getFramesDropped())
                .readFailures(broadcaster.getReadFailures())
                .encodeFailures(broadcaster.getEncodeFailures())
                .lastFrameTimestamp(latest != null ? latest.getTimestamp() : null)
                .build();
    }

    /**
     * 传感器读数，读取失败或异常时为 null
     */
    private Map<String, Double> readSensors() {
        Map<String, Double> readings = new LinkedHashMap<>();
        for (SensorProbe probe : sensorProbes) {
            Double value = null;
            try {
                Optional<Double> reading = probe.read();
                value = reading.orElse(null);
            } catch (RuntimeException e) {
                logger.warn("Sensor {} read failed: {}", probe.getName(), e.getMessage());
            }
            readings.put(probe.getName(), value);
        }
        return readings;
    }
}
