package com.aqua.stream.server;

import com.aqua.stream.config.CameraConfig;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 首页：每个已注册摄像头一个 MJPEG 预览框
 */
public class IndexPageHandler implements RouteHandler {

    private static final String PAGE_TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
                <title>%s</title>
                <meta name="viewport" content="width=device-width, initial-scale=1">
                <style>
                    body { font-family: Arial, sans-serif; margin: 0; padding: 20px; background-color: #f0f0f0; }
                    .container { max-width: 1200px; margin: 0 auto; }
                    h1 { text-align: center; color: #333; }
                    .camera-grid { display: grid; grid-template-columns: repeat(auto-fit, minmax(400px, 1fr)); gap: 20px; }
                    .camera-box { background: white; border-radius: 8px; padding: 15px; box-shadow: 0 2px 10px rgba(0,0,0,0.1); }
                    .camera-title { text-align: center; margin-bottom: 10px; font-weight: bold; color: #555; }
                    .camera-stream { width: 100%%; height: auto; border-radius: 4px; }
                    .info { text-align: center; margin-top: 20px; color: #666; }
                </style>
            </head>
            <body>
            <div class="container">
                <h1>%s</h1>
                <div class="camera-grid">%s
                </div>
                <div class="info">Direct links: %s</div>
            </div>
            </body>
            </html>
            """;

    private final byte[] content;

    public IndexPageHandler(String title, List<CameraConfig> cameras) {
        this.content = render(title, cameras).getBytes(StandardCharsets.UTF_8);
    }

    static String render(String title, List<CameraConfig> cameras) {
        String escapedTitle = HtmlUtils.htmlEscape(title);
        String boxes = cameras.stream()
                .map(c -> String.format("""

                                    <div class="camera-box">
                                        <div class="camera-title">Camera %d - %s</div>
                                        <img src="%s" class="camera-stream" alt="Camera %d Stream">
                                    </div>""",
                        c.getSlot(), HtmlUtils.htmlEscape(c.getDescription()), c.getStreamPath(), c.getSlot()))
                .collect(Collectors.joining());
        String links = cameras.stream()
                .map(c -> String.format("<a href=\"%s\">Camera %d Stream</a>", c.getStreamPath(), c.getSlot()))
                .collect(Collectors.joining(" | "));
        return String.format(PAGE_TEMPLATE, escapedTitle, escapedTitle, boxes, links);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType("text/html;charset=UTF-8");
        response.setContentLength(content.length);
        response.getOutputStream().write(content);
    }
}
