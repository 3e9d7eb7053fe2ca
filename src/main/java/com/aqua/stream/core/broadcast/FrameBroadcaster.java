package com.aqua.stream.core.broadcast;

import com.aqua.stream.config.CameraConfig;
import com.aqua.stream.core.camera.CameraSource;
import com.aqua.stream.core.overlay.FrameRotator;
import com.aqua.stream.core.overlay.OverlayCompositor;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单摄像头帧广播器
 * <p>
 * 一个后台采集线程独占相机句柄，按 maxStreamFps 限速后旋转、叠加、编码，
 * 然后原子替换唯一的帧槽并唤醒所有等待者。没有队列：慢消费者只会拿到最新帧，跳过中间帧。
 * <p>
 * 生命周期：NEW -> RUNNING -> STOPPED，或 NEW -> FAILED -> STOPPED，不可重启。
 */
public class FrameBroadcaster {
    private static final Logger logger = LoggerFactory.getLogger(FrameBroadcaster.class);

    private static final long NEVER = Long.MIN_VALUE;
    private static final long STOP_WAIT_LOG_INTERVAL_MS = 2000;

    private final CameraConfig config;
    private final CameraSource source;
    private final FrameRotator rotator;
    private final OverlayCompositor compositor;
    private final FrameEncoder encoder;
    private final CaptureSettings settings;
    private final Clock clock;
    private final String name;

    // 帧槽、叠加状态和生命周期状态都由同一把锁保护，避免丢失唤醒
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition framePublished = lock.newCondition();
    private FrameData latestFrame;
    private boolean overlayShown;
    private volatile BroadcasterState state = BroadcasterState.NEW;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong framesDropped = new AtomicLong(0);
    private final AtomicLong readFailures = new AtomicLong(0);
    private final AtomicLong encodeFailures = new AtomicLong(0);

    private ExecutorService producer;
    private boolean sourceOpened;

    public FrameBroadcaster(CameraConfig config, CameraSource source, FrameEncoder encoder,
                            CaptureSettings settings, Clock clock) {
        this.config = config;
        this.source = source;
        this.encoder = encoder;
        this.settings = settings;
        this.clock = clock;
        this.name = "camera-" + config.getSlot();
        this.rotator = new FrameRotator(config.getRotation());
        this.compositor = new OverlayCompositor(config.getSlot(), config.getOverlay(), clock.millis());
    }

    /**
     * 打开摄像头、预热并启动采集线程
     *
     * @throws CameraUnavailableException 摄像头无法打开，或预热被中断
     * @throws IllegalStateException      已停止或启动失败后再次调用
     */
    public synchronized void start() {
        if (state == BroadcasterState.RUNNING) {
            logger.warn("[{}] Already running", name);
            return;
        }
        if (state != BroadcasterState.NEW) {
            throw new IllegalStateException(name + " cannot be started from state " + state);
        }

        logger.info("[{}] Starting capture from {} ({})", name, source.describe(), config.getDescription());
        boolean opened;
        try {
            opened = source.open();
        } catch (RuntimeException e) {
            logger.error("[{}] Error opening {}", name, source.describe(), e);
            opened = false;
        }
        if (!opened) {
            changeState(BroadcasterState.FAILED);
            throw new CameraUnavailableException("Could not open " + source.describe());
        }
        sourceOpened = true;

        if (!warmUp()) {
            // 中断标志保留给调用方
            releaseSource();
            changeState(BroadcasterState.FAILED);
            throw new CameraUnavailableException("Warm-up of " + source.describe() + " was interrupted");
        }

        running.set(true);
        changeState(BroadcasterState.RUNNING);
        producer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-capture");
            t.setDaemon(true);
            return t;
        });
        producer.submit(this::captureLoop);
        logger.info("[{}] Capture started, delivery capped at {} FPS", name, config.getMaxStreamFps());
    }

    /**
     * 丢弃前几帧，避开自动曝光未稳定的画面
     * @return false 表示预热被中断
     */
    private boolean warmUp() {
        logger.info("[{}] Warming up camera...", name);
        for (int i = 0; i < settings.getWarmupFrames(); i++) {
            Mat frame = readFrame();
            if (frame == null) {
                logger.warn("[{}] Frame {} failed during warm-up", name, i + 1);
            } else {
                frame.release();
            }
            if (!sleepQuietly(settings.getWarmupDelayMs())) {
                logger.warn("[{}] Warm-up interrupted", name);
                return false;
            }
        }
        logger.info("[{}] Camera warm-up complete", name);
        return true;
    }

    /**
     * 读取一帧，驱动抛出的异常按读失败处理
     */
    private Mat readFrame() {
        try {
            return source.read();
        } catch (RuntimeException e) {
            logger.warn("[{}] Error reading from {}: {}", name, source.describe(), e.getMessage());
            return null;
        }
    }

    private void captureLoop() {
        long minInterval = config.getMinPublishIntervalMs();
        long lastPublish = NEVER;

        while (running.get()) {
            Mat raw = readFrame();
            if (raw == null) {
                long failures = readFailures.incrementAndGet();
                logger.warn("[{}] Failed to read frame ({} failures so far)", name, failures);
                if (!sleepQuietly(settings.getReadRetryDelayMs())) {
                    break;
                }
                continue;
            }

            try {
                long now = clock.millis();
                if (lastPublish != NEVER && now - lastPublish < minInterval) {
                    // 超过限速的帧直接丢弃，不缓冲
                    framesDropped.incrementAndGet();
                    continue;
                }

                Mat oriented = rotator.apply(raw);
                byte[] jpegBytes;
                boolean shown;
                try {
                    shown = compositor.apply(oriented, now);
                    jpegBytes = encoder.encode(oriented);
                } finally {
                    if (oriented != raw) {
                        oriented.release();
                    }
                }
                publish(jpegBytes, shown, now);
                lastPublish = now;
            } catch (FrameEncodingException e) {
                encodeFailures.incrementAndGet();
                logger.warn("[{}] Dropping frame: {}", name, e.getMessage());
            } catch (RuntimeException e) {
                logger.error("[{}] Error processing frame: {}", name, e.getMessage(), e);
            } finally {
                raw.release();
            }
        }
        logger.info("[{}] Capture loop exited", name);
    }

    void publish(byte[] jpegBytes, boolean shown, long timestamp) {
        lock.lock();
        try {
            long sequence = latestFrame == null ? 1 : latestFrame.getSequence() + 1;
            latestFrame = new FrameData(jpegBytes, timestamp, sequence);
            overlayShown = shown;
            framePublished.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 阻塞直到调用之后发布的下一帧，返回最新帧
     *
     * @throws BroadcasterStoppedException 等待期间已停止，或当前不在运行
     */
    public FrameData getFrame() throws InterruptedException {
        lock.lock();
        try {
            long seen = currentSequence();
            while (true) {
                if (latestFrame != null && latestFrame.getSequence() > seen) {
                    return latestFrame;
                }
                ensureRunning();
                framePublished.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 同 {@link #getFrame()}，超时返回 null
     */
    public FrameData getFrame(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            long seen = currentSequence();
            while (true) {
                if (latestFrame != null && latestFrame.getSequence() > seen) {
                    return latestFrame;
                }
                ensureRunning();
                if (remaining <= 0) {
                    return null;
                }
                remaining = framePublished.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    private long currentSequence() {
        return latestFrame == null ? 0 : latestFrame.getSequence();
    }

    private void ensureRunning() {
        if (state != BroadcasterState.RUNNING) {
            throw new BroadcasterStoppedException(name + " is " + state);
        }
    }

    /**
     * 停止采集线程并释放相机句柄，幂等
     * <p>
     * 返回时采集线程已退出，之后不会再访问相机句柄
     */
    public synchronized void stop() {
        if (state == BroadcasterState.STOPPED) {
            return;
        }
        logger.info("[{}] Stopping...", name);
        running.set(false);

        if (producer != null) {
            producer.shutdownNow();
            awaitProducerExit();
            producer = null;
        }

        releaseSource();

        changeState(BroadcasterState.STOPPED);
        logger.info("[{}] Stopped", name);
    }

    private void releaseSource() {
        if (!sourceOpened) {
            return;
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            logger.warn("[{}] Error closing {}: {}", name, source.describe(), e.getMessage());
        }
        sourceOpened = false;
    }

    private void awaitProducerExit() {
        boolean interrupted = false;
        while (true) {
            try {
                if (producer.awaitTermination(STOP_WAIT_LOG_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    break;
                }
                logger.warn("[{}] Still waiting for capture thread to exit", name);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void changeState(BroadcasterState newState) {
        lock.lock();
        try {
            state = newState;
            framePublished.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private static boolean sleepQuietly(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public CameraConfig getConfig() {
        return config;
    }

    public BroadcasterState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == BroadcasterState.RUNNING;
    }

    /**
     * 当前帧槽的快照，不阻塞，可能为 null
     */
    public FrameData getLatestFrame() {
        lock.lock();
        try {
            return latestFrame;
        } finally {
            lock.unlock();
        }
    }

    public boolean isOverlayShown() {
        lock.lock();
        try {
            return overlayShown;
        } finally {
            lock.unlock();
        }
    }

    public long getFramesPublished() {
        lock.lock();
        try {
            return currentSequence();
        } finally {
            lock.unlock();
        }
    }

    public long getFramesDropped() {
        return framesDropped.get();
    }

    public long getReadFailures() {
        return readFailures.get();
    }

    public long getEncodeFailures() {
        return encodeFailures.get();
    }
}
