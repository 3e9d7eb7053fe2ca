package com.aqua.stream.core.camera;

import com.aqua.stream.config.CameraConfig;
import com.aqua.stream.core.overlay.Rotation;
import org.junit.jupiter.api.Test;
import org.opencv.videoio.Videoio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CameraSourceFactoryTest {

    private final CameraSourceFactory factory = new CameraSourceFactory(3);

    private static CameraConfig camera(String source) {
        return new CameraConfig(0, source, "test", 1280, 720, 15, 15, Rotation.NONE, null);
    }

    @Test
    void numericSourceCreatesLocalCamera() {
        CameraSource source = factory.create(camera("2"));

        assertThat(source).isInstanceOf(LocalCameraSource.class);
        assertThat(source.describe()).isEqualTo("local camera 2");
        assertThat(source.isOpened()).isFalse();
    }

    @Test
    void urlSourceCreatesNetworkCamera() {
        CameraSource source = factory.create(camera("rtsp://192.168.1.20:554/live"));

        assertThat(source).isInstanceOf(RTSPCameraSource.class);
        assertThat(source.describe()).isEqualTo("network camera rtsp://192.168.1.20:554/live");
        assertThat(source.isOpened()).isFalse();
    }

    @Test
    void nullConfigIsRejected() {
        assertThatThrownBy(() -> factory.create(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prefersPlatformBackendThenAny() {
        assertThat(LocalCameraSource.backendCandidates("Mac OS X"))
                .containsExactly(Videoio.CAP_AVFOUNDATION, Videoio.CAP_ANY);
        assertThat(LocalCameraSource.backendCandidates("Windows 11"))
                .containsExactly(Videoio.CAP_DSHOW, Videoio.CAP_ANY);
        assertThat(LocalCameraSource.backendCandidates("Linux"))
                .containsExactly(Videoio.CAP_V4L2, Videoio.CAP_ANY);
        assertThat(LocalCameraSource.backendCandidates(null))
                .containsExactly(Videoio.CAP_V4L2, Videoio.CAP_ANY);
    }
}
