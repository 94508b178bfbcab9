package com.phillippitts.convocapture.testutil;

import com.phillippitts.convocapture.exception.TranscriptionStreamException;
import com.phillippitts.convocapture.service.stt.TranscriptEvent;
import com.phillippitts.convocapture.service.stt.TranscriptionConnection;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transcription stream. Tests push events with {@link #push}, end the stream with
 * {@link #endStream()} or {@link #failStream(Throwable)}, and inspect the frames sent.
 */
public class FakeTranscriptionConnection implements TranscriptionConnection {

    private static final Object END = new Object();

    private final BlockingQueue<Object> events = new LinkedBlockingQueue<>();
    private final List<byte[]> sent = new CopyOnWriteArrayList<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final AtomicInteger closeCalls = new AtomicInteger();
    private volatile Throwable failure;
    private volatile boolean failSends;
    private volatile String finalOnClose;

    /** Queues a finalized fragment. */
    public void pushFinal(String text) {
        push(new TranscriptEvent("Results", true, text));
    }

    public void push(TranscriptEvent event) {
        events.offer(event);
    }

    public void endStream() {
        if (ended.compareAndSet(false, true)) {
            events.offer(END);
        }
    }

    public void failStream(Throwable cause) {
        failure = cause;
        endStream();
    }

    /** Makes {@link #close()} deliver one more finalized fragment before ending the stream. */
    public void pushFinalOnClose(String text) {
        finalOnClose = text;
    }

    /** Makes every subsequent send fail. */
    public void failSends() {
        failSends = true;
    }

    @Override
    public void send(byte[] frame) {
        if (failSends || ended.get()) {
            throw new TranscriptionStreamException("send failed", "fake://stt");
        }
        sent.add(frame);
    }

    @Override
    public TranscriptEvent receive() throws InterruptedException {
        Object item = events.take();
        if (item == END) {
            events.offer(END);
            if (failure != null) {
                throw new TranscriptionStreamException("stream failed", "fake://stt", failure);
            }
            return null;
        }
        return (TranscriptEvent) item;
    }

    @Override
    public boolean isOpen() {
        return !ended.get();
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
        String late = finalOnClose;
        if (late != null && !ended.get()) {
            finalOnClose = null;
            pushFinal(late);
        }
        endStream();
    }

    public List<byte[]> sent() {
        return sent;
    }

    public int closeCalls() {
        return closeCalls.get();
    }
}
