package com.aqua.stream.controller;

import com.aqua.stream.server.StreamRouter;
import io.swagger.v3.oas.annotations.Hidden;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

import java.io.IOException;

/**
 * 首页和 MJPEG 流入口，实际分发交给 {@link StreamRouter}
 * <p>
 * 每个流连接在独立的 Tomcat 工作线程上运行，直到客户端断开
 */
@Hidden
@Controller
public class StreamController {

    @Autowired
    private StreamRouter streamRouter;

    @GetMapping({"/", "/index.html", "/{streamFile:stream\\d+\\.mjpg}"})
    public void dispatch(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        streamRouter.dispatch(path, request, response);
    }
}
