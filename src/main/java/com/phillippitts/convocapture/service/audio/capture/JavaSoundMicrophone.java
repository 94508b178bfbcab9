package com.phillippitts.convocapture.service.audio.capture;

import com.phillippitts.convocapture.util.SessionTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import javax.sound.sampled.TargetDataLine;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Microphone} backed by an opened Java Sound {@link TargetDataLine}.
 *
 * <p>A daemon driver thread reads fixed-size chunks from the line and hands each one to the
 * {@link FrameCallback}. Each frame is a fresh array, so the callback may queue it without
 * copying.
 */
final class JavaSoundMicrophone implements Microphone {

    private static final Logger LOG = LogManager.getLogger(JavaSoundMicrophone.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final TargetDataLine line;
    private final int bytesPerChunk;
    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread driver;

    JavaSoundMicrophone(TargetDataLine line, int bytesPerChunk) {
        this.line = Objects.requireNonNull(line, "line");
        this.bytesPerChunk = bytesPerChunk;
    }

    @Override
    public void start(FrameCallback callback) {
        Objects.requireNonNull(callback, "callback");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Microphone already started");
        }
        if (closed.get()) {
            throw new IllegalStateException("Microphone already closed");
        }
        line.start();
        active.set(true);

        // Carry the session's logging context onto the driver thread
        Map<String, String> context = ThreadContext.getImmutableContext();
        Thread t = new Thread(() -> {
            ThreadContext.putAll(context);
            try {
                doCapture(callback);
            } finally {
                ThreadContext.clearAll();
            }
        }, "audio-capture-" + THREAD_SEQ.incrementAndGet());
        t.setDaemon(true);
        driver = t;
        t.start();
    }

    private void doCapture(FrameCallback callback) {
        byte[] buf = new byte[bytesPerChunk];
        long frames = 0;
        try {
            while (active.get()) {
                int n = line.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                callback.onFrame(Arrays.copyOf(buf, n));
                frames++;
            }
            LOG.info("Audio capture completed: {} frames delivered", frames);
        } catch (RuntimeException e) {
            LOG.warn("Capture failed after {} frames: {}", frames, e.toString());
        } finally {
            active.set(false);
        }
    }

    @Override
    public boolean isActive() {
        return active.get() && line.isOpen();
    }

    @Override
    public void stop() {
        boolean wasActive = active.getAndSet(false);
        if (started.get()) {
            try {
                line.stop();
                line.flush();
            } catch (RuntimeException e) {
                LOG.debug("Error stopping input line: {}", e.toString());
            }
        }
        if (wasActive) {
            joinDriver(SessionTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        }
    }

    @Override
    public void close() {
        stop();
        if (closed.compareAndSet(false, true)) {
            try {
                line.close();
            } catch (RuntimeException e) {
                LOG.debug("Error closing input line: {}", e.toString());
            }
        }
    }

    private void joinDriver(long timeoutMs) {
        Thread thread = driver;
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
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
}
