package com.aqua.stream.server;

import com.aqua.stream.core.broadcast.BroadcasterStoppedException;
import com.aqua.stream.core.broadcast.FrameBroadcaster;
import com.aqua.stream.core.broadcast.FrameData;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * 单摄像头 MJPEG 流端点
 * <p>
 * 每个连接占用一个工作线程，循环从 Broadcaster 取最新帧并写成 multipart 的一个 part，
 * 直到写失败（客户端断开）、Broadcaster 停止或等待帧超时。
 */
public class MjpegStreamHandler implements RouteHandler {
    private static final Logger logger = LoggerFactory.getLogger(MjpegStreamHandler.class);

    public static final String BOUNDARY = "FRAME";
    public static final String CONTENT_TYPE = "multipart/x-mixed-replace; boundary=" + BOUNDARY;

    private static final byte[] PART_START = ("--" + BOUNDARY + "\r\n").getBytes(StandardCharsets.US_ASCII);
    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private final FrameBroadcaster broadcaster;
    private final ConnectionCounter counter;
    private final long frameTimeoutMs;
    private final int slot;

    public MjpegStreamHandler(FrameBroadcaster broadcaster, ConnectionCounter counter, long frameTimeoutMs) {
        this.broadcaster = broadcaster;
        this.counter = counter;
        this.frameTimeoutMs = frameTimeoutMs;
        this.slot = broadcaster.getConfig().getSlot();
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response) throws IOException {
        if (!broadcaster.isRunning()) {
            response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Camera " + slot + " not available");
            return;
        }

        String client = request.getRemoteAddr();
        int active = counter.connected();
        logger.info("New client for camera {} from {}. Active: {}", slot, client, active);

        long frameCount = 0;
        long streamStartTime = System.currentTimeMillis();
        try {
            response.setStatus(HttpServletResponse.SC_OK);
            response.setContentType(CONTENT_TYPE);
            response.setHeader("Age", "0");
            response.setHeader("Cache-Control", "no-cache, private");
            response.setHeader("Pragma", "no-cache");
            response.flushBuffer();

            OutputStream out = response.getOutputStream();
            while (true) {
                FrameData frame = nextFrame();
                if (frame == null) {
                    logger.warn("Camera {} produced no frame within {}ms, closing stream for {}",
                            slot, frameTimeoutMs, client);
                    break;
                }
                writePart(out, frame.getData());
                frameCount++;
            }
        } catch (IOException e) {
            logger.info("Camera {} client {} disconnected: {}", slot, client, e.getMessage());
        } catch (BroadcasterStoppedException e) {
            logger.info("Camera {} stream to {} closed: {}", slot, client, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Camera {} stream to {} interrupted", slot, client);
        } finally {
            int remaining = counter.disconnected();
            long duration = System.currentTimeMillis() - streamStartTime;
            logger.info("Camera {} client {} disconnected after {} frames in {}ms. Active: {}",
                    slot, client, frameCount, duration, remaining);
        }
    }

    private FrameData nextFrame() throws InterruptedException {
        if (frameTimeoutMs > 0) {
            return broadcaster.getFrame(frameTimeoutMs, TimeUnit.MILLISECONDS);
        }
        return broadcaster.getFrame();
    }

    static void writePart(OutputStream out, byte[] jpegBytes) throws IOException {
        out.write(PART_START);
        out.write("Content-Type: image/jpeg\r\n".getBytes(StandardCharsets.US_ASCII));
        out.write(("Content-Length: " + jpegBytes.length + "\r\n").getBytes(StandardCharsets.US_ASCII));
        out.write(CRLF);
        out.write(jpegBytes);
        out.write(CRLF);
        out.flush();
    }

    public int getSlot() {
        return slot;
    }
}
