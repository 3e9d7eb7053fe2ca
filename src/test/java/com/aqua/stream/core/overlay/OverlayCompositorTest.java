package com.aqua.stream.core.overlay;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.aqua.stream.config.NativeLibraryLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class OverlayCompositorTest {

    private static final long CYCLE_START = 1_700_000_000_000L;
    private static final int ROWS = 480;
    private static final int COLS = 640;
    private static final int LABEL_X = 20;
    private static final int LABEL_Y = ROWS - 20;

    private static OverlayConfig label(double bgOpacity, double textOpacity) {
        return new OverlayConfig(true, "LABEL", 10, 30, 0.8, 2, bgOpacity, textOpacity, new int[]{0, 85, 204});
    }

    @Nested
    class Visibility {

        private ListAppender<ILoggingEvent> appender;
        private Logger compositorLogger;

        @BeforeEach
        void attachAppender() {
            compositorLogger = (Logger) LoggerFactory.getLogger(OverlayCompositor.class);
            appender = new ListAppender<>();
            appender.start();
            compositorLogger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            compositorLogger.detachAppender(appender);
        }

        @Test
        void visibleDuringFirstThirtySecondsOfEachTenMinuteCycle() {
            OverlayCompositor compositor = new OverlayCompositor(0, label(0.7, 0.9), CYCLE_START);

            assertThat(compositor.isVisibleAt(CYCLE_START)).isTrue();
            assertThat(compositor.isVisibleAt(CYCLE_START + 29_999)).isTrue();
            assertThat(compositor.isVisibleAt(CYCLE_START + 30_000)).isFalse();
            assertThat(compositor.isVisibleAt(CYCLE_START + 599_999)).isFalse();
            assertThat(compositor.isVisibleAt(CYCLE_START + 600_000)).isTrue();
            assertThat(compositor.isVisibleAt(CYCLE_START + 629_999)).isTrue();
            assertThat(compositor.isVisibleAt(CYCLE_START + 630_000)).isFalse();
        }

        @Test
        void timeBeforeCycleStartWrapsIntoPreviousCycle() {
            OverlayCompositor compositor = new OverlayCompositor(0, label(0.7, 0.9), CYCLE_START);

            assertThat(compositor.isVisibleAt(CYCLE_START - 600_000)).isTrue();
            assertThat(compositor.isVisibleAt(CYCLE_START - 1)).isFalse();
        }

        @Test
        void oneShownAndOneHiddenTransitionPerCycle() {
            OverlayCompositor compositor = new OverlayCompositor(0, label(0.7, 0.9), CYCLE_START);
            Map<OverlayCompositor.Transition, Integer> counts = new EnumMap<>(OverlayCompositor.Transition.class);

            // 10 FPS，跑满三个周期
            for (long t = 0; t < 3 * 600_000L; t += 100) {
                OverlayCompositor.Transition transition = compositor.updateVisibility(CYCLE_START + t);
                counts.merge(transition, 1, Integer::sum);
            }

            assertThat(counts.get(OverlayCompositor.Transition.SHOWN)).isEqualTo(3);
            assertThat(counts.get(OverlayCompositor.Transition.HIDDEN)).isEqualTo(3);
            assertThat(appender.list).hasSize(6);
            assertThat(appender.list.get(0).getFormattedMessage())
                    .isEqualTo("[camera-0] Label 'LABEL' displayed for 30s");
            assertThat(appender.list.get(1).getFormattedMessage())
                    .isEqualTo("[camera-0] Label 'LABEL' hidden - next display in 10 minutes");
        }

        @Test
        void labelIsPrefixedWithCameraSlot() {
            assertThat(new OverlayCompositor(2, label(0.7, 0.9), CYCLE_START).getLabel())
                    .isEqualTo("Camera 2: LABEL");
        }

        @Test
        void disabledOverlayNeverTransitions() {
            OverlayCompositor compositor = new OverlayCompositor(1, OverlayConfig.disabled(), CYCLE_START);

            for (long t = 0; t < 600_000L; t += 1000) {
                assertThat(compositor.updateVisibility(CYCLE_START + t)).isEqualTo(OverlayCompositor.Transition.NONE);
            }
            assertThat(compositor.isShown()).isFalse();
            assertThat(appender.list).isEmpty();
        }
    }

    @Nested
    class Rendering {

        @BeforeEach
        void loadOpenCv() {
            NativeLibraryLoader.loadNativeLibraries();
        }

        private Mat grayFrame() {
            return new Mat(ROWS, COLS, CvType.CV_8UC3, new Scalar(100, 100, 100));
        }

        @Test
        void hiddenLabelLeavesFrameUntouched() {
            OverlayCompositor compositor = new OverlayCompositor(0, label(0.7, 0.9), CYCLE_START);
            Mat frame = grayFrame();
            Mat original = frame.clone();

            boolean shown = compositor.apply(frame, CYCLE_START + 60_000);

            assertThat(shown).isFalse();
            assertThat(Core.norm(frame, original, Core.NORM_INF)).isZero();
        }

        @Test
        void disabledOverlayLeavesFrameUntouched() {
            OverlayCompositor compositor = new OverlayCompositor(0, OverlayConfig.disabled(), CYCLE_START);
            Mat frame = grayFrame();
            Mat original = frame.clone();

            assertThat(compositor.apply(frame, CYCLE_START)).isFalse();
            assertThat(Core.norm(frame, original, Core.NORM_INF)).isZero();
        }

        @Test
        void visibleLabelDarkensBackgroundByItsOwnOpacity() {
            OverlayCompositor compositor = new OverlayCompositor(0, label(0.7, 0.9), CYCLE_START);
            Mat frame = grayFrame();

            boolean shown = compositor.apply(frame, CYCLE_START + 1_000);

            assertThat(shown).isTrue();
            // 左侧 padding 区域只有背景：100 * (1 - 0.7)
            assertThat(frame.get(LABEL_Y, LABEL_X - 4)[0]).isCloseTo(30.0, offset(1.0));
            // 标签区域之外不变
            assertThat(frame.get(10, 10)).containsExactly(100.0, 100.0, 100.0);
            assertThat(frame.get(ROWS - 1, COLS - 1)).containsExactly(100.0, 100.0, 100.0);
        }

        @Test
        void textOpacityIsIndependentOfBackground() {
            Mat opaqueText = grayFrame();
            new OverlayCompositor(0, label(0.7, 1.0), CYCLE_START).render(opaqueText);
            Mat invisibleText = grayFrame();
            new OverlayCompositor(0, label(0.7, 0.0), CYCLE_START).render(invisibleText);

            assertThat(hasTextColoredPixel(opaqueText)).isTrue();
            assertThat(hasTextColoredPixel(invisibleText)).isFalse();
            assertThat(invisibleText.get(LABEL_Y, LABEL_X - 4)[0])
                    .isEqualTo(opaqueText.get(LABEL_Y, LABEL_X - 4)[0]);
        }

        // 文字颜色为 BGR (0, 85, 204)，红色通道明显高于灰底和黑色背景
        private boolean hasTextColoredPixel(Mat frame) {
            for (int row = LABEL_Y - 40; row < ROWS; row++) {
                for (int col = 0; col < COLS / 2; col++) {
                    if (frame.get(row, col)[2] > 150) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
