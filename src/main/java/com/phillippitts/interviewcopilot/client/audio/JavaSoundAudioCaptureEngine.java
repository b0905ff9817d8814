package com.phillippitts.interviewcopilot.client.audio;

import com.phillippitts.interviewcopilot.config.properties.AudioCaptureProperties;
import com.phillippitts.interviewcopilot.domain.AudioChunk;
import com.phillippitts.interviewcopilot.exception.DeviceUnavailableException;
import com.phillippitts.interviewcopilot.service.audio.AudioFormat;
import com.phillippitts.interviewcopilot.service.audio.AudioLevelMeter;
import com.phillippitts.interviewcopilot.util.Timeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Java Sound based microphone capture that streams PCM16LE mono @16kHz in fixed-duration chunks.
 *
 * <p>The capture thread reads the line in analysis frames of
 * {@code audio.capture.level-window-millis}. Each frame updates the level metric and the
 * {@link SilenceDetector}, then is appended to the current chunk; a chunk is emitted once it
 * holds {@code audio.capture.chunk-millis} of audio. {@link #stop()} emits the partial chunk.
 *
 * <p>Thread-safe for a single active capture.
 */
public class JavaSoundAudioCaptureEngine implements AudioCaptureEngine {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureEngine.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private Run current;

    private volatile double level;

    public JavaSoundAudioCaptureEngine(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureEngine(AudioCaptureProperties props,
                                ApplicationEventPublisher publisher,
                                DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            Mixer.Info[] mixers = AudioSystem.getMixerInfo();
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : mixers) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public CompletableFuture<Void> start(Consumer<? super CaptureEvent> events) {
        Objects.requireNonNull(events, "events");
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Another capture is already active");
            }
            Run run = new Run(events, new SilenceDetector(props.getSilenceThreshold(), props.getSilenceDurationMs()));
            current = run;
            Thread t = new Thread(() -> doCapture(run), "audio-capture");
            t.setDaemon(true);
            run.thread = t;
            run.active.set(true);
            t.start();
            LOG.info("Audio capture starting: device='{}', chunk={}ms, window={}ms, silence<{} for {}ms",
                    props.getDeviceName() != null ? props.getDeviceName() : "default",
                    props.getChunkMillis(), props.getLevelWindowMillis(),
                    props.getSilenceThreshold(), props.getSilenceDurationMs());
            return run.started;
        }
    }

    @Override
    public CompletableFuture<Void> stop() {
        synchronized (lock) {
            if (current == null) {
                return CompletableFuture.completedFuture(null);
            }
            current.active.set(false);
            return current.stopped;
        }
    }

    @Override
    public void pause() {
        synchronized (lock) {
            if (current != null) {
                current.paused = true;
            }
        }
    }

    @Override
    public void resume() {
        synchronized (lock) {
            if (current != null) {
                current.resumed = true;
                current.paused = false;
            }
        }
    }

    @Override
    public boolean isCapturing() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    @Override
    public boolean isPaused() {
        synchronized (lock) {
            return current != null && current.paused;
        }
    }

    @Override
    public double currentLevel() {
        return level;
    }

    @PreDestroy
    public void shutdown() {
        Thread captureThread = null;
        synchronized (lock) {
            if (current != null && current.active.get()) {
                LOG.info("Shutting down with active capture; forcing cleanup");
                current.active.set(false);
                captureThread = current.thread;
            }
        }
        // Join thread outside lock to avoid deadlock
        if (captureThread != null) {
            joinThread(captureThread, Timeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
        }
    }

    private void doCapture(Run run) {
        final int windowBytes = AudioFormat.bytesFor(props.getLevelWindowMillis());
        final int chunkBytes = AudioFormat.bytesFor(props.getChunkMillis());
        TargetDataLine line = null;
        try {
            try {
                line = provider.open(AudioFormat.toJavaSound(), Optional.ofNullable(props.getDeviceName()));
                line.start();
            } catch (LineUnavailableException | IllegalArgumentException e) {
                fail(run, new DeviceUnavailableException(DeviceUnavailableException.MIC_UNAVAILABLE, e.getMessage(), e));
                return;
            } catch (SecurityException e) {
                fail(run, new DeviceUnavailableException(DeviceUnavailableException.MIC_PERMISSION_DENIED, e.getMessage(), e));
                return;
            }
            run.started.complete(null);
            LOG.info("Microphone acquired");

            byte[] buf = new byte[windowBytes];
            byte[] window = new byte[windowBytes];
            int windowFill = 0;
            ByteArrayOutputStream chunk = new ByteArrayOutputStream(chunkBytes);

            while (run.active.get()) {
                int n = line.read(buf, 0, windowBytes - windowFill);
                if (n <= 0) {
                    continue;
                }
                System.arraycopy(buf, 0, window, windowFill, n);
                windowFill += n;
                if (windowFill < windowBytes) {
                    continue;
                }
                windowFill = 0;
                onWindow(run, window, chunk, chunkBytes);
            }
            // Flush: the unfinished window and the partial chunk
            if (!run.paused) {
                if (windowFill > 0) {
                    chunk.write(window, 0, windowFill - (windowFill % AudioFormat.REQUIRED_BLOCK_ALIGN));
                }
                if (chunk.size() > 0) {
                    emitChunk(run, chunk);
                }
            }
            LOG.info("Audio capture completed: {} chunks emitted", run.sequence);
        } catch (RuntimeException t) {
            LOG.warn("Capture failed: {}", t.toString());
            DeviceUnavailableException failure = new DeviceUnavailableException(
                    DeviceUnavailableException.MIC_UNAVAILABLE, "capture failed: " + t.getMessage(), t);
            publisher.publishEvent(CaptureErrorEvent.of(failure, CaptureErrorEvent.Phase.CAPTURE,
                    props.getDeviceName(), run.sequence));
            run.events.accept(new CaptureEvent.CaptureFailed(failure));
        } finally {
            run.active.set(false);
            closeQuietly(line);
            run.started.complete(null);
            run.stopped.complete(null);
        }
    }

    private void onWindow(Run run, byte[] window, ByteArrayOutputStream chunk, int chunkBytes) {
        double windowLevel = AudioLevelMeter.level(window);
        level = windowLevel;
        run.events.accept(new CaptureEvent.LevelSampled(windowLevel));

        if (run.paused) {
            // Paused audio is discarded, never sent later
            chunk.reset();
            return;
        }
        if (run.resumed) {
            run.resumed = false;
            run.silence.reset();
        }
        if (run.silence.observe(windowLevel, props.getLevelWindowMillis())) {
            LOG.debug("Silence detected after {}ms below level {}", props.getSilenceDurationMs(), props.getSilenceThreshold());
            run.events.accept(new CaptureEvent.SilenceDetected(Instant.now()));
        }
        chunk.write(window, 0, window.length);
        if (chunk.size() >= chunkBytes) {
            emitChunk(run, chunk);
        }
    }

    private void emitChunk(Run run, ByteArrayOutputStream chunk) {
        AudioChunk audio = new AudioChunk(run.sequence++, System.currentTimeMillis(),
                AudioFormat.REQUIRED_SAMPLE_RATE, chunk.toByteArray());
        chunk.reset();
        run.events.accept(new CaptureEvent.ChunkCaptured(audio));
    }

    private void fail(Run run, DeviceUnavailableException e) {
        LOG.warn("Microphone unavailable: reason={}, {}", e.getReason(), e.getCause() != null ? e.getCause().getMessage() : "");
        publisher.publishEvent(CaptureErrorEvent.of(e, CaptureErrorEvent.Phase.OPEN, props.getDeviceName(), 0));
        run.started.completeExceptionally(e);
    }

    private static void closeQuietly(TargetDataLine line) {
        if (line == null) {
            return;
        }
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error releasing audio line: {}", e.toString());
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Run {
        final Consumer<? super CaptureEvent> events;
        final SilenceDetector silence;
        final AtomicBoolean active = new AtomicBoolean(false);
        final CompletableFuture<Void> started = new CompletableFuture<>();
        final CompletableFuture<Void> stopped = new CompletableFuture<>();
        volatile boolean paused;
        volatile boolean resumed;
        volatile Thread thread;
        long sequence;

        Run(Consumer<? super CaptureEvent> events, SilenceDetector silence) {
            this.events = events;
            this.silence = silence;
        }
    }
}
