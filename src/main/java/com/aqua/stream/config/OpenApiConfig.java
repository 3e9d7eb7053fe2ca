package com.aqua.stream.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cameraStreamOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Aqua Camera Stream API")
                        .description("""
                                多摄像头 MJPEG 实时监控服务

                                ### 流地址
                                | 路径 | 说明 |
                                |------|------|
                                | `/` 或 `/index.html` | 所有摄像头的预览页面 |
                                | `/stream{slot}.mjpg` | 单个摄像头的 MJPEG 流（`multipart/x-mixed-replace; boundary=FRAME`） |

                                未注册的流地址返回 404，已注册但摄像头不可用时返回 503。

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... }
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }
}
