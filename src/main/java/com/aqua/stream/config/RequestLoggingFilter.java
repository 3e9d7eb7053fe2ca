package com.aqua.stream.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_LOGGED_BODY = 2000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        // MJPEG 流是长连接，不能缓存响应体，连接日志由流处理器自己记录
        if (request.getRequestURI().endsWith(".mjpg")) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        long startTime = System.currentTimeMillis();

        try {
            filterChain.doFilter(request, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            String contentType = responseWrapper.getContentType();
            byte[] responseContent = responseWrapper.getContentAsByteArray();
            if (logger.isDebugEnabled() && contentType != null && contentType.contains("json")
                    && responseContent.length > 0) {
                String body = new String(responseContent, StandardCharsets.UTF_8);
                if (body.length() > MAX_LOGGED_BODY) body = body.substring(0, MAX_LOGGED_BODY) + "...";
                logger.debug("Response Body: {}", body);
            }

            // 必须把缓存的响应体写回原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("{} {} from {} | Status: {} | Duration: {} ms",
                    request.getMethod(), request.getRequestURI(), request.getRemoteAddr(),
                    responseWrapper.getStatus(), duration);
        }
    }
}
