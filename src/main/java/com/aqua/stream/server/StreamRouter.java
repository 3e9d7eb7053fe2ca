package com.aqua.stream.server;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * 路径 -> 处理器 路由表，构造时注入，之后不变
 */
public class StreamRouter {
    private static final Logger logger = LoggerFactory.getLogger(StreamRouter.class);

    private final Map<String, RouteHandler> routes;

    public StreamRouter(Map<String, RouteHandler> routes) {
        this.routes = Map.copyOf(routes);
        logger.info("Stream routes: {}", this.routes.keySet());
    }

    public void dispatch(String path, HttpServletRequest request, HttpServletResponse response) throws IOException {
        RouteHandler handler = routes.get(path);
        if (handler == null) {
            logger.debug("No route for {}", path);
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        handler.handle(request, response);
    }

    public Set<String> getPaths() {
        return routes.keySet();
    }
}
