package com.aqua.stream.server;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * 单个路由的处理能力，由 {@link StreamRouter} 按路径分发
 */
public interface RouteHandler {

    void handle(HttpServletRequest request, HttpServletResponse response) throws IOException;
}
