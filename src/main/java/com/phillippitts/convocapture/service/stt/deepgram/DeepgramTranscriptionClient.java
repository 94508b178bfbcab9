package com.phillippitts.convocapture.service.stt.deepgram;

import com.phillippitts.convocapture.config.properties.TranscriptionProperties;
import com.phillippitts.convocapture.exception.TranscriptionStreamException;
import com.phillippitts.convocapture.service.stt.StreamParameters;
import com.phillippitts.convocapture.service.stt.TranscriptionClient;
import com.phillippitts.convocapture.service.stt.TranscriptionConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens Deepgram live-transcription streams.
 *
 * <p>Stream parameters travel as query parameters, the credential as an
 * {@code Authorization: Token <key>} header.
 */
@Component
public class DeepgramTranscriptionClient implements TranscriptionClient {

    private static final Logger LOG = LogManager.getLogger(DeepgramTranscriptionClient.class);

    private final HttpClient httpClient;
    private final TranscriptionProperties props;

    public DeepgramTranscriptionClient(HttpClient transcriptionHttpClient, TranscriptionProperties props) {
        this.httpClient = Objects.requireNonNull(transcriptionHttpClient, "httpClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public TranscriptionConnection connect(StreamParameters params, String credential) {
        Objects.requireNonNull(params, "params");
        if (credential == null || credential.isBlank()) {
            throw new TranscriptionStreamException("Missing transcription credential", props.getUrl());
        }
        URI uri = buildUri(props.getUrl(), params);
        Duration connectTimeout = Duration.ofMillis(props.getConnectTimeoutMs());
        QueueingListener listener = new QueueingListener();

        LOG.info("Connecting to transcription service {}", uri);
        WebSocket ws;
        try {
            ws = httpClient.newWebSocketBuilder()
                    .header("Authorization", "Token " + credential)
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, listener)
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionStreamException("Interrupted while connecting", props.getUrl(), e);
        } catch (ExecutionException e) {
            throw new TranscriptionStreamException("Failed to connect", props.getUrl(), e.getCause());
        } catch (TimeoutException e) {
            throw new TranscriptionStreamException(
                    "Timed out connecting after " + connectTimeout.toMillis() + "ms", props.getUrl(), e);
        }
        LOG.info("Connected to transcription service");
        return new DeepgramConnection(ws, listener, props.getUrl(),
                Duration.ofMillis(props.getSendTimeoutMs()),
                Duration.ofMillis(props.getCloseTimeoutMs()));
    }

    /**
     * Appends the stream parameters to the base URL, e.g.
     * {@code wss://api.deepgram.com/v1/listen?punctuate=true&encoding=linear16&sample_rate=16000&channels=1}.
     */
    static URI buildUri(String baseUrl, StreamParameters params) {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator
                + "punctuate=" + params.punctuate()
                + "&encoding=" + params.encoding()
                + "&sample_rate=" + params.sampleRate()
                + "&channels=" + params.channels());
    }
}
