package com.phillippitts.convocapture.service.audio.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands raw audio frames from the microphone driver thread to a session's sender pipeline.
 *
 * <p>Multi-producer, single-consumer FIFO. {@link #enqueue(byte[])} never blocks and is safe to
 * call from the audio driver thread; {@link #take()} blocks the consumer until a frame or the
 * end-of-stream marker is available.
 *
 * <p><b>Shutdown:</b> {@link #signalEndOfStream()} appends a sentinel after any frames already
 * queued and rejects later frames. Once the consumer reaches the sentinel every further
 * {@link #take()} returns {@code null} immediately, so a blocked take is released even when no
 * real data will ever arrive.
 *
 * @since 1.0
 */
public final class AudioCaptureBridge {

    private static final Logger LOG = LogManager.getLogger(AudioCaptureBridge.class);

    /** Number of initial frames logged at INFO to help diagnose silent microphones. */
    private static final int VERBOSE_FRAME_COUNT = 3;

    // Compared by identity; never handed to the consumer
    private static final byte[] END_OF_STREAM = new byte[0];

    private final BlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private volatile boolean drained;

    /**
     * Queues a frame for the consumer without blocking.
     *
     * @param frame raw PCM bytes; null or empty frames are ignored
     * @return {@code true} if queued, {@code false} if ignored or the stream has ended
     */
    public boolean enqueue(byte[] frame) {
        if (frame == null || frame.length == 0) {
            return false;
        }
        if (ended.get()) {
            rejected.incrementAndGet();
            return false;
        }
        // Unbounded queue: offer always succeeds
        queue.offer(frame);
        long n = enqueued.incrementAndGet();
        if (n <= VERBOSE_FRAME_COUNT) {
            LOG.info("Enqueued audio chunk {} (bytes={})", n, frame.length);
        } else if (LOG.isTraceEnabled()) {
            LOG.trace("Enqueued audio chunk {} (bytes={})", n, frame.length);
        }
        return true;
    }

    /**
     * Blocks until the next frame is available.
     *
     * @return the next frame in enqueue order, or {@code null} once the end-of-stream marker
     *         has been reached
     * @throws InterruptedException if the consumer thread is interrupted while waiting
     */
    public byte[] take() throws InterruptedException {
        if (drained) {
            return null;
        }
        byte[] frame = queue.take();
        return onTaken(frame);
    }

    /**
     * Waits up to the given time for the next frame.
     *
     * @return the next frame, or {@code null} on timeout or once the end-of-stream marker has
     *         been reached (distinguish with {@link #isDrained()})
     * @throws InterruptedException if interrupted while waiting
     */
    public byte[] poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (drained) {
            return null;
        }
        byte[] frame = queue.poll(timeout, unit);
        return frame == null ? null : onTaken(frame);
    }

    private byte[] onTaken(byte[] frame) {
        if (frame == END_OF_STREAM) {
            drained = true;
            return null;
        }
        return frame;
    }

    /**
     * Marks the end of the stream. Idempotent; frames queued before the call are still
     * delivered ahead of the marker.
     */
    public void signalEndOfStream() {
        if (ended.compareAndSet(false, true)) {
            queue.offer(END_OF_STREAM);
            LOG.debug("End of audio stream signalled ({} frames pending)", pendingFrames());
        }
    }

    /** Whether the consumer has reached the end-of-stream marker. */
    public boolean isDrained() {
        return drained;
    }

    /** Whether {@link #signalEndOfStream()} has been called. */
    public boolean isEnded() {
        return ended.get();
    }

    /** Total frames accepted by {@link #enqueue(byte[])}. */
    public long enqueuedCount() {
        return enqueued.get();
    }

    /** Frames rejected because they arrived after end of stream. */
    public long rejectedCount() {
        return rejected.get();
    }

    /** Real frames still waiting for the consumer. */
    public int pendingFrames() {
        int size = queue.size();
        return (ended.get() && !drained && size > 0) ? size - 1 : size;
    }
}
