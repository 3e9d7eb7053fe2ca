package com.aqua.stream.service;

import com.aqua.stream.config.CameraConfig;
import com.aqua.stream.config.CameraRegistry;
import com.aqua.stream.config.StreamProperties;
import com.aqua.stream.core.broadcast.BroadcasterState;
import com.aqua.stream.core.camera.CameraSource;
import com.aqua.stream.core.camera.CameraSourceFactory;
import com.aqua.stream.core.overlay.Rotation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CameraServiceTest {

    private static final CameraConfig FISH_TANK =
            new CameraConfig(0, "0", "Fish Tank", 640, 480, 15, 15, Rotation.NONE, null);
    private static final CameraConfig PLANT_BEDS =
            new CameraConfig(1, "rtsp://cam/plants", "Plant Beds", 640, 480, 7.5, 15, Rotation.NONE, null);

    private CameraSource workingSource;
    private CameraSource brokenSource;
    private CameraSourceFactory factory;
    private CameraService service;

    @BeforeEach
    void setUp() {
        // 可打开但读不到帧的相机：广播器进入 RUNNING，采集循环持续重试
        workingSource = mock(CameraSource.class);
        when(workingSource.open()).thenReturn(true);
        brokenSource = mock(CameraSource.class);
        when(brokenSource.open()).thenReturn(false);

        factory = mock(CameraSourceFactory.class);
        when(factory.create(FISH_TANK)).thenReturn(workingSource);
        when(factory.create(PLANT_BEDS)).thenReturn(brokenSource);

        service = newService(0);
    }

    private CameraService newService(int warmupFrames) {
        StreamProperties properties = new StreamProperties();
        properties.setAutoStart(false);
        properties.setWarmupFrames(warmupFrames);
        properties.setWarmupDelayMs(0);
        properties.setReadRetryDelayMs(20);
        return new CameraService(new CameraRegistry(List.of(FISH_TANK, PLANT_BEDS)), properties,
                factory, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        service.stopCameras();
    }

    @Test
    void buildsOneBroadcasterPerRegisteredCamera() {
        assertThat(service.getConfiguredCameraCount()).isEqualTo(2);
        assertThat(service.getBroadcasters()).containsOnlyKeys(0, 1);
        assertThat(service.getBroadcaster(1).getConfig()).isSameAs(PLANT_BEDS);
        assertThat(service.getBroadcaster(0).getState()).isEqualTo(BroadcasterState.NEW);
    }

    @Test
    void autoStartDisabledLeavesCamerasIdle() {
        service.init();

        assertThat(service.getRunningCount()).isZero();
        verify(workingSource, never()).open();
    }

    @Test
    void oneFailingCameraDoesNotStopTheOthers() {
        service.startCameras();

        assertThat(service.getBroadcaster(0).getState()).isEqualTo(BroadcasterState.RUNNING);
        assertThat(service.getBroadcaster(1).getState()).isEqualTo(BroadcasterState.FAILED);
        assertThat(service.getRunningCount()).isEqualTo(1);
    }

    @Test
    void startingTwiceOpensEachCameraOnce() {
        service.startCameras();
        service.startCameras();

        verify(workingSource, times(1)).open();
        verify(brokenSource, times(1)).open();
    }

    @Test
    void stopReleasesOnlyCamerasThatOpened() {
        service.startCameras();

        service.stopCameras();

        assertThat(service.getBroadcasters().values())
                .allMatch(b -> b.getState() == BroadcasterState.STOPPED);
        verify(workingSource, times(1)).close();
        verify(brokenSource, never()).close();
    }

    @Test
    void driverErrorDuringWarmUpDoesNotBlockOtherCameras() {
        when(brokenSource.open()).thenReturn(true);
        when(workingSource.read()).thenThrow(new IllegalStateException("driver glitch during warm-up"));
        service = newService(2);

        service.startCameras();

        assertThat(service.getBroadcaster(0).getState()).isEqualTo(BroadcasterState.RUNNING);
        assertThat(service.getBroadcaster(1).getState()).isEqualTo(BroadcasterState.RUNNING);
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.getBroadcaster(0).getReadFailures() > 0);
    }

    @Test
    void unexpectedStartErrorOnlyAffectsThatCamera() {
        when(workingSource.describe()).thenThrow(new IllegalStateException("source misconfigured"));
        when(brokenSource.open()).thenReturn(true);

        service.startCameras();

        assertThat(service.getBroadcaster(0).isRunning()).isFalse();
        assertThat(service.getBroadcaster(1).getState()).isEqualTo(BroadcasterState.RUNNING);
        assertThat(service.getRunningCount()).isEqualTo(1);
    }
}
