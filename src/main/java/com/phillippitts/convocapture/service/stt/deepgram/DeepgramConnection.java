package com.phillippitts.convocapture.service.stt.deepgram;

import com.phillippitts.convocapture.exception.TranscriptionStreamException;
import com.phillippitts.convocapture.service.stt.TranscriptEvent;
import com.phillippitts.convocapture.service.stt.TranscriptionConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A live Deepgram stream over a JDK {@link WebSocket}.
 */
final class DeepgramConnection implements TranscriptionConnection {

    private static final Logger LOG = LogManager.getLogger(DeepgramConnection.class);

    /** Number of initial frames logged at INFO. */
    private static final int VERBOSE_FRAME_COUNT = 3;

    private final WebSocket ws;
    private final QueueingListener listener;
    private final String endpoint;
    private final Duration sendTimeout;
    private final Duration closeTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong framesSent = new AtomicLong();

    DeepgramConnection(WebSocket ws, QueueingListener listener, String endpoint,
                       Duration sendTimeout, Duration closeTimeout) {
        this.ws = ws;
        this.listener = listener;
        this.endpoint = endpoint;
        this.sendTimeout = sendTimeout;
        this.closeTimeout = closeTimeout;
    }

    @Override
    public void send(byte[] frame) {
        if (closed.get() || ws.isOutputClosed()) {
            throw new TranscriptionStreamException("Connection is closed", endpoint);
        }
        try {
            ws.sendBinary(ByteBuffer.wrap(frame), true)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionStreamException("Interrupted while sending audio", endpoint, e);
        } catch (ExecutionException e) {
            throw new TranscriptionStreamException("Failed to send audio", endpoint, e.getCause());
        } catch (TimeoutException e) {
            throw new TranscriptionStreamException(
                    "Timed out sending audio after " + sendTimeout.toMillis() + "ms", endpoint, e);
        }
        long n = framesSent.incrementAndGet();
        if (n <= VERBOSE_FRAME_COUNT) {
            LOG.info("Sent audio chunk {} (bytes={})", n, frame.length);
        } else if (LOG.isTraceEnabled()) {
            LOG.trace("Sent audio chunk {} (bytes={})", n, frame.length);
        }
    }

    @Override
    public TranscriptEvent receive() throws InterruptedException {
        TranscriptEvent event = listener.next();
        if (event == null && listener.failure() != null) {
            throw new TranscriptionStreamException("Transcription stream failed", endpoint, listener.failure());
        }
        return event;
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !listener.isEnded() && !ws.isOutputClosed();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        long timeoutMs = closeTimeout.toMillis();
        try {
            if (!ws.isOutputClosed()) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "session stopped")
                        .get(timeoutMs, TimeUnit.MILLISECONDS);
            }
            if (!listener.awaitEnd(timeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Server did not acknowledge close within {}ms; aborting stream", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while closing transcription stream");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Graceful close of transcription stream failed: {}", e.toString());
        } finally {
            if (!listener.isEnded()) {
                ws.abort();
                listener.end(null);
            }
        }
        LOG.debug("Transcription stream closed after {} frames", framesSent.get());
    }

    long framesSent() {
        return framesSent.get();
    }
}
