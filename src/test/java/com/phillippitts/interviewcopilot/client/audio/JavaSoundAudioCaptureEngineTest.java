package com.phillippitts.interviewcopilot.client.audio;

import com.phillippitts.interviewcopilot.config.properties.AudioCaptureProperties;
import com.phillippitts.interviewcopilot.exception.DeviceUnavailableException;
import com.phillippitts.interviewcopilot.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.Control;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JavaSoundAudioCaptureEngineTest {

    // 100ms chunks made of 20ms analysis windows; 100ms of silence fires
    private static final AudioCaptureProperties PROPS = new AudioCaptureProperties(100, 20, 5.0, 100, null);
    private static final short LOUD = 8000;

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final List<CaptureEvent> events = new CopyOnWriteArrayList<>();
    private final FakeTargetDataLine line = new FakeTargetDataLine();

    private JavaSoundAudioCaptureEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    @Test
    void emitsFixedSizeChunksWithContiguousSequences() throws Exception {
        line.amplitude = LOUD;
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> line);

        engine.start(events::add).get(2, TimeUnit.SECONDS);
        await().atMost(Duration.ofSeconds(5)).until(() -> chunks().size() >= 3);
        engine.stop().get(2, TimeUnit.SECONDS);

        List<CaptureEvent.ChunkCaptured> chunks = chunks();
        for (int i = 0; i < chunks.size(); i++) {
            assertThat(chunks.get(i).chunk().sequence()).isEqualTo(i);
            assertThat(chunks.get(i).chunk().sampleRate()).isEqualTo(16_000);
        }
        assertThat(chunks.get(0).chunk().pcm()).hasSize(3200);
        assertThat(engine.isCapturing()).isFalse();
        assertThat(line.isOpen()).isFalse();
    }

    @Test
    void reportsLevelOfLatestWindow() throws Exception {
        line.amplitude = LOUD;
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> line);

        engine.start(events::add).get(2, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(5)).until(() -> engine.currentLevel() > 40.0);
        assertThat(events).anyMatch(CaptureEvent.LevelSampled.class::isInstance);
    }

    @Test
    void sustainedSilenceFiresOncePerInterval() throws Exception {
        line.amplitude = 0;
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> line);

        engine.start(events::add).get(2, TimeUnit.SECONDS);
        await().atMost(Duration.ofSeconds(5)).until(() -> silences() == 1);
        // Several more silent windows go by without a second signal
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).until(() -> silences() == 1);

        line.amplitude = LOUD;
        int levelsBefore = levels();
        await().atMost(Duration.ofSeconds(5)).until(() -> levels() > levelsBefore + 3);
        line.amplitude = 0;

        await().atMost(Duration.ofSeconds(5)).until(() -> silences() == 2);
    }

    @Test
    void pausedAudioIsDiscarded() throws Exception {
        line.amplitude = LOUD;
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> line);
        engine.start(events::add).get(2, TimeUnit.SECONDS);
        await().atMost(Duration.ofSeconds(5)).until(() -> chunks().size() >= 1);

        engine.pause();
        assertThat(engine.isPaused()).isTrue();
        Thread.sleep(100);
        int pausedAt = chunks().size();
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).until(() -> chunks().size() == pausedAt);

        engine.resume();
        await().atMost(Duration.ofSeconds(5)).until(() -> chunks().size() > pausedAt);
        assertThat(chunks().get(pausedAt).chunk().sequence()).isEqualTo(pausedAt);
    }

    @Test
    void unavailableDeviceFailsStartAndPublishesCaptureError() {
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> {
            throw new LineUnavailableException("busy");
        });

        assertThatThrownBy(() -> engine.start(events::add).get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DeviceUnavailableException.class);
        await().atMost(Duration.ofSeconds(2)).until(() -> !publisher.ofType(CaptureErrorEvent.class).isEmpty());
        CaptureErrorEvent error = publisher.ofType(CaptureErrorEvent.class).get(0);
        assertThat(error.reason()).isEqualTo(DeviceUnavailableException.MIC_UNAVAILABLE);
        assertThat(error.phase()).isEqualTo(CaptureErrorEvent.Phase.OPEN);
        assertThat(error.device()).isEqualTo("default");
        assertThat(error.chunksEmitted()).isZero();
        await().atMost(Duration.ofSeconds(2)).until(() -> !engine.isCapturing());
    }

    @Test
    void deniedPermissionHasItsOwnReason() {
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> {
            throw new SecurityException("no microphone access");
        });

        assertThatThrownBy(() -> engine.start(events::add).get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(DeviceUnavailableException.class)
                .satisfies(e -> assertThat(((DeviceUnavailableException) e.getCause()).getReason())
                        .isEqualTo(DeviceUnavailableException.MIC_PERMISSION_DENIED));
    }

    @Test
    void readFailureAfterStartIsReportedAsCaptureFailed() throws Exception {
        line.failReads = true;
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> line);

        engine.start(events::add).get(2, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(2)).until(() -> events.stream().anyMatch(CaptureEvent.CaptureFailed.class::isInstance));
        await().atMost(Duration.ofSeconds(2)).until(() -> !engine.isCapturing());
        assertThat(publisher.ofType(CaptureErrorEvent.class)).singleElement().satisfies(error -> {
            assertThat(error.reason()).isEqualTo(DeviceUnavailableException.MIC_UNAVAILABLE);
            assertThat(error.phase()).isEqualTo(CaptureErrorEvent.Phase.CAPTURE);
        });
    }

    @Test
    void secondStartWhileActiveIsRejected() throws Exception {
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> line);
        engine.start(events::add).get(2, TimeUnit.SECONDS);

        assertThatThrownBy(() -> engine.start(events::add)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopWithoutStartCompletesImmediately() {
        engine = new JavaSoundAudioCaptureEngine(PROPS, publisher, (fmt, device) -> line);

        assertThat(engine.stop()).isCompleted();
    }

    private List<CaptureEvent.ChunkCaptured> chunks() {
        return events.stream()
                .filter(CaptureEvent.ChunkCaptured.class::isInstance)
                .map(CaptureEvent.ChunkCaptured.class::cast)
                .toList();
    }

    private long silences() {
        return events.stream().filter(CaptureEvent.SilenceDetected.class::isInstance).count();
    }

    private int levels() {
        return (int) events.stream().filter(CaptureEvent.LevelSampled.class::isInstance).count();
    }

    /** Line producing a constant PCM16LE sample, throttled to roughly real time. */
    static final class FakeTargetDataLine implements TargetDataLine {
        private final javax.sound.sampled.AudioFormat fmt = new javax.sound.sampled.AudioFormat(16_000, 16, 1, true, false);
        volatile short amplitude;
        volatile boolean failReads;
        private volatile boolean started;
        private volatile boolean open = true;

        @Override public int read(byte[] b, int off, int len) {
            if (failReads) {
                throw new IllegalStateException("device unplugged");
            }
            if (!started || !open) {
                return 0;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 0;
            }
            int n = Math.min(len, 640) & ~1;
            for (int i = off; i < off + n; i += 2) {
                b[i] = (byte) (amplitude & 0xFF);
                b[i + 1] = (byte) ((amplitude >> 8) & 0xFF);
            }
            return n;
        }
        @Override public javax.sound.sampled.AudioFormat getFormat() {
            return fmt;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format, int bufferSize) {
            open = true;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format) {
            open = true;
        }
        @Override public void open() {
            open = true;
        }
        @Override public void start() {
            started = true;
        }
        @Override public void stop() {
            started = false;
        }
        @Override public void close() {
            open = false;
        }
        @Override public boolean isOpen() {
            return open;
        }
        @Override public int available() {
            return 0;
        }
        @Override public void drain() {
        }
        @Override public void flush() {
        }
        @Override public int getBufferSize() {
            return 0;
        }
        @Override public int getFramePosition() {
            return 0;
        }
        @Override public long getLongFramePosition() {
            return 0;
        }
        @Override public long getMicrosecondPosition() {
            return 0L;
        }
        @Override public float getLevel() {
            return 0;
        }
        @Override public boolean isActive() {
            return started;
        }
        @Override public boolean isRunning() {
            return started;
        }
        @Override public Control getControl(Control.Type control) {
            throw new IllegalArgumentException();
        }
        @Override public Control[] getControls() {
            return new Control[0];
        }
        @Override public boolean isControlSupported(Control.Type control) {
            return false;
        }
        @Override public void addLineListener(LineListener listener) {
        }
        @Override public void removeLineListener(LineListener listener) {
        }
        @Override public javax.sound.sampled.Line.Info getLineInfo() {
            return new DataLine.Info(TargetDataLine.class, fmt);
        }
    }
}
