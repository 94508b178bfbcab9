package com.phillippitts.convocapture.service.session;

import com.phillippitts.convocapture.config.logging.SessionLogContext;
import com.phillippitts.convocapture.domain.RecentTranscripts;
import com.phillippitts.convocapture.domain.SessionState;
import com.phillippitts.convocapture.domain.SessionStats;
import com.phillippitts.convocapture.domain.TranscriptEntry;
import com.phillippitts.convocapture.exception.ConversationPersistenceException;
import com.phillippitts.convocapture.exception.TranscriptionStreamException;
import com.phillippitts.convocapture.service.analysis.ConversationAnalyzer;
import com.phillippitts.convocapture.service.audio.capture.AudioCaptureBridge;
import com.phillippitts.convocapture.service.audio.capture.Microphone;
import com.phillippitts.convocapture.service.audio.capture.MicrophoneFactory;
import com.phillippitts.convocapture.service.metrics.SessionMetrics;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import com.phillippitts.convocapture.service.stt.StreamParameters;
import com.phillippitts.convocapture.service.stt.TranscriptEvent;
import com.phillippitts.convocapture.service.stt.TranscriptionClient;
import com.phillippitts.convocapture.service.stt.TranscriptionConnection;
import com.phillippitts.convocapture.service.transcript.BufferedLinesStrategy;
import com.phillippitts.convocapture.service.transcript.FinalTranscriptCompiler;
import com.phillippitts.convocapture.service.transcript.NameDetector;
import com.phillippitts.convocapture.service.transcript.PersistedMessagesStrategy;
import com.phillippitts.convocapture.service.transcript.TranscriptBuffer;
import com.phillippitts.convocapture.util.LogSanitizer;
import com.phillippitts.convocapture.util.SessionTimeouts;
import com.phillippitts.convocapture.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live capture-and-transcription session bound to a single persisted conversation.
 *
 * <p><b>Threads:</b>
 * <ul>
 *   <li>the session thread runs {@link #run()}: start-up, then the two pipelines until they end</li>
 *   <li>the microphone driver thread only hands frames to the {@link AudioCaptureBridge}</li>
 *   <li>two pipeline workers: the sender drains the bridge into the transcription stream, the
 *       receiver turns finalized events into buffered lines, persisted messages and name
 *       detection</li>
 *   <li>{@link #stop()} is called from the manager's caller thread, or from the session thread
 *       itself when the pipelines end without a stop request</li>
 * </ul>
 *
 * <p><b>Shutdown order</b> (runs exactly once, whichever of stop or failure gets there first):
 * release the microphone, end the audio stream, close the transcription stream, wait for the
 * pipelines, compile and persist the final transcript, analyze (stop only), close the store.
 * Resources that were never acquired are skipped.
 *
 * <p>Sessions are single-use: once stopped or failed they are never restarted.
 */
public final class ConversationSession implements Runnable {

    private static final Logger LOG = LogManager.getLogger(ConversationSession.class);

    private final String sessionId;
    private final long userId;
    private final long partnerId;
    private final long conversationId;
    private final String credential;
    private final String messageSender;

    private final MicrophoneFactory microphoneFactory;
    private final TranscriptionClient transcriptionClient;
    private final StreamParameters streamParameters;
    private final ConversationStore store;
    private final ConversationAnalyzer analyzer;
    private final SessionMetrics metrics;

    private final SessionStateMachine state = new SessionStateMachine();
    private final AudioCaptureBridge bridge = new AudioCaptureBridge();
    private final TranscriptBuffer buffer;
    private final int recentCapacity;
    private final FinalTranscriptCompiler transcriptCompiler;

    // Guards microphone/connection hand-off against a concurrent stop
    private final Lock resources = new ReentrantLock();
    private Microphone microphone;
    private TranscriptionConnection connection;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean tornDown = new AtomicBoolean(false);
    private final AtomicReference<String> detectedPartnerName = new AtomicReference<>();
    private final AtomicInteger messageCount = new AtomicInteger();
    private final AtomicInteger fragmentsReceived = new AtomicInteger();
    private final AtomicLong chunksSent = new AtomicLong();
    private final CountDownLatch startupLatch = new CountDownLatch(1);
    private final CountDownLatch pipelinesDone = new CountDownLatch(1);

    private volatile long startNanos;
    private volatile long stopNanos;
    private volatile Throwable failureCause;

    ConversationSession(String sessionId,
                        long userId,
                        long partnerId,
                        long conversationId,
                        String credential,
                        MicrophoneFactory microphoneFactory,
                        TranscriptionClient transcriptionClient,
                        StreamParameters streamParameters,
                        ConversationStore store,
                        ConversationAnalyzer analyzer,
                        SessionMetrics metrics,
                        TranscriptBuffer buffer,
                        int recentCapacity,
                        String messageSender) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.partnerId = partnerId;
        this.conversationId = conversationId;
        this.credential = credential;
        this.microphoneFactory = microphoneFactory;
        this.transcriptionClient = transcriptionClient;
        this.streamParameters = streamParameters;
        this.store = store;
        this.analyzer = analyzer;
        this.metrics = metrics;
        this.buffer = buffer;
        this.recentCapacity = recentCapacity;
        this.messageSender = messageSender;
        this.transcriptCompiler = FinalTranscriptCompiler.preferBuffered(
                new BufferedLinesStrategy(buffer),
                new PersistedMessagesStrategy(store, conversationId));
    }

    /**
     * Session thread body: starts the session and runs the pipelines until they end.
     */
    @Override
    public void run() {
        SessionLogContext.bind(sessionId, conversationId);
        try {
            if (start()) {
                runPipelines();
            }
        } catch (RuntimeException e) {
            LOG.error("Session thread failed unexpectedly", e);
            fail(e);
        } finally {
            SessionLogContext.clear();
        }
    }

    /**
     * Acquires the microphone, then opens the transcription stream.
     *
     * @return {@code true} if the session reached {@link SessionState#RUNNING}
     */
    boolean start() {
        if (!state.transition(SessionState.CREATED, SessionState.STARTING)) {
            return false;
        }
        startNanos = System.nanoTime();
        LOG.info("Starting session (user={}, partner={})", userId, partnerId);

        try {
            Microphone mic = microphoneFactory.open();
            resources.lock();
            try {
                if (state.current() != SessionState.STARTING) {
                    mic.close();
                    return false;
                }
                microphone = mic;
                running.set(true);
            } finally {
                resources.unlock();
            }
            mic.start(this::onAudioFrame);
            LOG.info("Microphone active");
            startupLatch.countDown();

            TranscriptionConnection conn = transcriptionClient.connect(streamParameters, credential);
            resources.lock();
            try {
                if (state.current() != SessionState.STARTING) {
                    conn.close();
                    return false;
                }
                connection = conn;
                state.advance(SessionState.RUNNING);
            } finally {
                resources.unlock();
            }
            LOG.info("Session running");
            return true;
        } catch (RuntimeException e) {
            fail(e);
            return false;
        }
    }

    /**
     * Microphone driver thread callback. Never blocks.
     */
    private void onAudioFrame(byte[] frame) {
        if (running.get()) {
            bridge.enqueue(frame);
        }
    }

    private void runPipelines() {
        ExecutorService workers = Executors.newFixedThreadPool(2,
                SessionLogContext.daemonThreadFactory("session-" + sessionId + "-pipeline"));
        try {
            CompletableFuture<Void> sender = CompletableFuture.runAsync(this::sendLoop, workers);
            CompletableFuture<Void> receiver = CompletableFuture.runAsync(this::receiveLoop, workers);
            CompletableFuture.allOf(sender, receiver).join();
        } catch (CompletionException e) {
            LOG.error("Pipeline terminated abnormally", e.getCause());
        } finally {
            running.set(false);
            workers.shutdownNow();
            pipelinesDone.countDown();
        }
        LOG.info("Pipelines finished ({} chunks sent, {} messages)", chunksSent.get(), messageCount.get());

        if (!stopRequested.get()) {
            LOG.info("Transcription ended without a stop request; stopping session");
            stop();
        }
    }

    private void sendLoop() {
        boolean failed = false;
        try {
            while (running.get()) {
                byte[] frame = bridge.take();
                if (frame == null) {
                    break;
                }
                connection.send(frame);
                chunksSent.incrementAndGet();
                metrics.audioChunkSent();
            }
        } catch (TranscriptionStreamException e) {
            failed = true;
            LOG.warn("Audio sender stopped: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (failed) {
            // Nothing more can be sent; let the receiver drain and finish
            connection.close();
        }
        LOG.debug("Sender pipeline finished ({} frames pending)", bridge.pendingFrames());
    }

    private void receiveLoop() {
        try {
            while (running.get()) {
                TranscriptEvent event = connection.receive();
                if (event == null) {
                    LOG.info("Transcription stream ended");
                    break;
                }
                if (!running.get()) {
                    // Fragments flushed during the close handshake belong to no live session
                    LOG.debug("Discarding event received after stop");
                    break;
                }
                if (event.hasFinalText()) {
                    onFinalFragment(event.transcript());
                }
            }
        } catch (TranscriptionStreamException e) {
            LOG.warn("Transcription stream failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            // Release a sender blocked on an empty queue
            bridge.signalEndOfStream();
        }
    }

    private void onFinalFragment(String text) {
        double elapsed = elapsedSeconds();
        TranscriptEntry entry = new TranscriptEntry(TimeUtils.formatElapsed(elapsed), elapsed, text, Instant.now());
        buffer.append(entry);
        fragmentsReceived.incrementAndGet();
        LOG.info("[{}] {}", entry.timestamp(), LogSanitizer.preview(text));

        try {
            store.appendMessage(conversationId, messageSender, text, entry.receivedAt());
            messageCount.incrementAndGet();
            metrics.messagePersisted();
        } catch (ConversationPersistenceException e) {
            LOG.warn("Message not persisted: {}", e.getMessage());
            metrics.persistenceFailure(e.getOperation());
        }

        if (detectedPartnerName.get() == null) {
            NameDetector.detect(text).ifPresent(this::commitPartnerName);
        }
    }

    private void commitPartnerName(String name) {
        if (!detectedPartnerName.compareAndSet(null, name)) {
            return;
        }
        LOG.info("Detected partner name: {}", name);
        try {
            if (store.renamePartner(partnerId, name)) {
                LOG.info("Partner {} renamed to {}", partnerId, name);
            }
        } catch (ConversationPersistenceException e) {
            LOG.warn("Partner name not stored: {}", e.getMessage());
            metrics.persistenceFailure(e.getOperation());
        }
    }

    /**
     * Stops the session and finalizes the conversation. Idempotent; a no-op once the session
     * has stopped or failed.
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        boolean moved;
        resources.lock();
        try {
            moved = state.advance(SessionState.STOPPING);
        } finally {
            resources.unlock();
        }
        if (!moved) {
            LOG.debug("Stop ignored in state {}", state.current());
            return;
        }
        LOG.info("Stopping session");
        markStopped();
        teardown(true);
        state.advance(SessionState.STOPPED);
        LOG.info("Session stopped after {} ({} messages)", TimeUtils.formatElapsed(elapsedSeconds()),
                messageCount.get());
    }

    private void fail(Throwable cause) {
        failureCause = cause;
        boolean moved;
        resources.lock();
        try {
            moved = state.advance(SessionState.FAILED);
        } finally {
            resources.unlock();
        }
        if (!moved) {
            LOG.warn("Start-up aborted in state {}: {}", state.current(), cause.getMessage());
            return;
        }
        LOG.error("Session failed: {}", cause.getMessage());
        markStopped();
        teardown(false);
    }

    private void markStopped() {
        running.set(false);
        if (startNanos != 0) {
            stopNanos = System.nanoTime();
        }
        startupLatch.countDown();
    }

    private void teardown(boolean analyze) {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        Microphone mic;
        TranscriptionConnection conn;
        resources.lock();
        try {
            mic = microphone;
            conn = connection;
        } finally {
            resources.unlock();
        }

        if (mic != null) {
            try {
                mic.stop();
            } catch (RuntimeException e) {
                LOG.warn("Error stopping microphone: {}", e.getMessage());
            }
            try {
                mic.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing microphone: {}", e.getMessage());
            }
        }

        bridge.signalEndOfStream();

        if (conn != null) {
            try {
                conn.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing transcription stream: {}", e.getMessage());
            }
        }

        if (state.hasReachedRunning()) {
            awaitPipelines();
        }

        String transcript = transcriptCompiler.compile();
        try {
            if (!store.updateConversation(conversationId, Instant.now(), transcript)) {
                LOG.warn("Conversation {} not found; final transcript not saved", conversationId);
            }
        } catch (ConversationPersistenceException e) {
            LOG.error("Final transcript not saved: {}", e.getMessage());
            metrics.persistenceFailure(e.getOperation());
        }

        if (analyze) {
            try {
                analyzer.analyze(conversationId);
            } catch (RuntimeException e) {
                LOG.warn("Analysis of conversation {} failed", conversationId, e);
            }
        }

        try {
            store.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing conversation store: {}", e.getMessage());
        }
    }

    private void awaitPipelines() {
        long timeoutMs = SessionTimeouts.PIPELINE_SHUTDOWN_TIMEOUT.toMillis();
        try {
            if (!pipelinesDone.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Pipelines did not finish within {}ms; compiling transcript anyway", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits until the microphone reports active, or the session stops or fails.
     *
     * @return the state when the wait ended
     */
    public SessionState awaitStartup(Duration timeout) throws InterruptedException {
        startupLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return state.current();
    }

    /**
     * Snapshot of public statistics. Reads published counters only.
     */
    public SessionStats stats() {
        double elapsed = elapsedSeconds();
        return new SessionStats(
                sessionId,
                userId,
                partnerId,
                conversationId,
                running.get(),
                state.current(),
                elapsed,
                TimeUtils.formatElapsed(elapsed),
                messageCount.get(),
                Math.min(fragmentsReceived.get(), recentCapacity),
                detectedPartnerName.get(),
                bridge.enqueuedCount(),
                chunksSent.get());
    }

    /**
     * Last {@code n} finalized fragments, oldest first, with the detected partner name.
     */
    public RecentTranscripts recentTranscripts(int n) {
        return new RecentTranscripts(sessionId, buffer.recent(n), buffer.recentCount(),
                detectedPartnerName.get());
    }

    private double elapsedSeconds() {
        long start = startNanos;
        if (start == 0) {
            return 0.0;
        }
        long end = stopNanos;
        return end != 0 ? (end - start) / TimeUtils.NANOS_PER_SECOND : TimeUtils.elapsedSeconds(start);
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getConversationId() {
        return conversationId;
    }

    public SessionState getState() {
        return state.current();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Detected partner name, or null. */
    public String getDetectedPartnerName() {
        return detectedPartnerName.get();
    }

    /** Cause of a start-up failure, or null. */
    public Throwable getFailureCause() {
        return failureCause;
    }
}
