package com.phillippitts.convocapture.service.session;

import com.phillippitts.convocapture.config.properties.SessionProperties;
import com.phillippitts.convocapture.config.properties.TranscriptionProperties;
import com.phillippitts.convocapture.service.analysis.ConversationAnalyzer;
import com.phillippitts.convocapture.service.analysis.NoopConversationAnalyzer;
import com.phillippitts.convocapture.service.audio.capture.MicrophoneFactory;
import com.phillippitts.convocapture.service.metrics.SessionMetrics;
import com.phillippitts.convocapture.service.persistence.ConversationStore;
import com.phillippitts.convocapture.service.persistence.ConversationStoreFactory;
import com.phillippitts.convocapture.service.stt.StreamParameters;
import com.phillippitts.convocapture.service.stt.TranscriptionClient;
import com.phillippitts.convocapture.service.transcript.TranscriptBuffer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Builds {@link ConversationSession}s wired to the shared collaborators. Every session gets its
 * own conversation store handle, capture bridge and transcript buffer.
 */
@Component
public class ConversationSessionFactory {

    private final MicrophoneFactory microphoneFactory;
    private final TranscriptionClient transcriptionClient;
    private final ConversationStoreFactory storeFactory;
    private final ConversationAnalyzer analyzer;
    private final SessionMetrics metrics;
    private final SessionProperties sessionProps;
    private final StreamParameters streamParameters;

    @Autowired
    public ConversationSessionFactory(MicrophoneFactory microphoneFactory,
                                      TranscriptionClient transcriptionClient,
                                      ConversationStoreFactory storeFactory,
                                      ObjectProvider<ConversationAnalyzer> analyzer,
                                      SessionMetrics metrics,
                                      SessionProperties sessionProps,
                                      TranscriptionProperties transcriptionProps) {
        this(microphoneFactory, transcriptionClient, storeFactory,
                analyzer.getIfAvailable(() -> NoopConversationAnalyzer.INSTANCE),
                metrics, sessionProps,
                StreamParameters.forCaptureFormat(transcriptionProps.isPunctuate()));
    }

    public ConversationSessionFactory(MicrophoneFactory microphoneFactory,
                                      TranscriptionClient transcriptionClient,
                                      ConversationStoreFactory storeFactory,
                                      ConversationAnalyzer analyzer,
                                      SessionMetrics metrics,
                                      SessionProperties sessionProps,
                                      StreamParameters streamParameters) {
        this.microphoneFactory = Objects.requireNonNull(microphoneFactory, "microphoneFactory");
        this.transcriptionClient = Objects.requireNonNull(transcriptionClient, "transcriptionClient");
        this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.metrics = metrics == null ? SessionMetrics.NOOP : metrics;
        this.sessionProps = Objects.requireNonNull(sessionProps, "sessionProps");
        this.streamParameters = Objects.requireNonNull(streamParameters, "streamParameters");
    }

    /**
     * Creates a session for an already persisted conversation on a new store handle. The
     * session is not started.
     *
     * @throws com.phillippitts.convocapture.exception.ConversationPersistenceException if the
     *         session's store handle cannot be opened
     */
    public ConversationSession create(String sessionId, long userId, long partnerId,
                                      long conversationId, String credential) {
        return create(sessionId, userId, partnerId, conversationId, credential, storeFactory.open());
    }

    /**
     * Creates a session that takes ownership of {@code store} and closes it when it stops.
     */
    public ConversationSession create(String sessionId, long userId, long partnerId,
                                      long conversationId, String credential, ConversationStore store) {
        TranscriptBuffer buffer = new TranscriptBuffer(
                sessionProps.getTranscriptMaxChars(),
                sessionProps.getTranscriptMinLines(),
                sessionProps.getRecentCapacity());
        return new ConversationSession(sessionId, userId, partnerId, conversationId, credential,
                microphoneFactory, transcriptionClient, streamParameters,
                store, analyzer, metrics, buffer,
                sessionProps.getRecentCapacity(), sessionProps.getMessageSender());
    }

    /** Store factory the manager opens session handles from. */
    ConversationStoreFactory storeFactory() {
        return storeFactory;
    }
}
