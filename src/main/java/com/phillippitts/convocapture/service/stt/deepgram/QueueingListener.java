package com.phillippitts.convocapture.service.stt.deepgram;

import com.phillippitts.convocapture.service.stt.TranscriptEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WebSocket listener that turns incoming text messages into a blocking event queue.
 *
 * <p>Requests one message at a time. Text split across several frames is reassembled before
 * parsing. Close and error both enqueue an end marker so a blocked {@link #next()} returns.
 */
final class QueueingListener implements WebSocket.Listener {

    private static final Logger LOG = LogManager.getLogger(QueueingListener.class);

    /** Unparseable messages logged at DEBUG before going quiet. */
    private static final int MAX_IGNORED_LOGS = 5;

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final StringBuilder partial = new StringBuilder();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final CountDownLatch endLatch = new CountDownLatch(1);
    private final AtomicInteger ignored = new AtomicInteger();
    private volatile Throwable failure;

    @Override
    public void onOpen(WebSocket webSocket) {
        LOG.debug("Transcription stream opened");
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        partial.append(data);
        if (last) {
            String message = partial.toString();
            partial.setLength(0);
            TranscriptEvent event = DeepgramEventParser.parse(message);
            if (event != null) {
                queue.offer(event);
            } else if (ignored.incrementAndGet() <= MAX_IGNORED_LOGS) {
                LOG.debug("Ignored transcription message ({} chars)", message.length());
            }
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        LOG.info("Transcription stream closed by server (code={}, reason='{}')", statusCode, reason);
        end(null);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        LOG.warn("Transcription stream error: {}", error.toString());
        end(error);
    }

    /**
     * Marks the stream as ended. Only the first call has an effect.
     *
     * @param error cause if the stream ended abnormally, otherwise null
     */
    void end(Throwable error) {
        if (ended.compareAndSet(false, true)) {
            failure = error;
            queue.offer(END);
            endLatch.countDown();
        }
    }

    /**
     * Blocks for the next event.
     *
     * @return the next event, or {@code null} once the stream has ended (on every later call too)
     */
    TranscriptEvent next() throws InterruptedException {
        Object item = queue.take();
        if (item == END) {
            // keep the marker visible to later calls
            queue.offer(END);
            return null;
        }
        return (TranscriptEvent) item;
    }

    boolean awaitEnd(long timeout, TimeUnit unit) throws InterruptedException {
        return endLatch.await(timeout, unit);
    }

    boolean isEnded() {
        return ended.get();
    }

    /** Cause of an abnormal end, or null. */
    Throwable failure() {
        return failure;
    }
}
