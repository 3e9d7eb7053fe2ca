package com.aqua.stream.config;

import com.aqua.stream.core.broadcast.FrameBroadcaster;
import com.aqua.stream.server.ConnectionCounter;
import com.aqua.stream.server.IndexPageHandler;
import com.aqua.stream.server.MjpegStreamHandler;
import com.aqua.stream.server.RouteHandler;
import com.aqua.stream.server.StreamRouter;
import com.aqua.stream.service.CameraService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 组装流媒体路由表
 * <p>
 * 路由：
 * - / 和 /index.html -> 首页
 * - /stream{slot}.mjpg -> 对应摄像头的 MJPEG 流
 */
@Configuration
public class StreamServerConfig {

    @Bean
    public ConnectionCounter streamConnectionCounter() {
        return new ConnectionCounter();
    }

    @Bean
    public StreamRouter streamRouter(CameraService cameraService, CameraRegistry registry,
                                     StreamProperties properties, ConnectionCounter streamConnectionCounter) {
        Map<String, RouteHandler> routes = new LinkedHashMap<>();

        IndexPageHandler indexPage = new IndexPageHandler(properties.getPageTitle(), registry.getCameras());
        routes.put("/", indexPage);
        routes.put("/index.html", indexPage);

        for (FrameBroadcaster broadcaster : cameraService.getBroadcasters().values()) {
            routes.put(broadcaster.getConfig().getStreamPath(),
                    new MjpegStreamHandler(broadcaster, streamConnectionCounter, properties.getFrameTimeoutMs()));
        }
        return new StreamRouter(routes);
    }
}
