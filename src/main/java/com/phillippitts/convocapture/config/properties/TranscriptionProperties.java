package com.phillippitts.convocapture.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the streaming speech-to-text service.
 *
 * <p>{@code apiKey} is only a fallback: callers normally pass a credential when creating a
 * session. When neither is present, session creation fails with a configuration error.
 */
@Validated
@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties {

    /** WebSocket endpoint of the streaming transcription service, without query parameters. */
    @NotBlank
    private final String url;

    /** Fallback credential used when a caller does not supply one. */
    private final String apiKey;

    @Min(100)
    @Max(60_000)
    private final int connectTimeoutMs;

    @Min(100)
    @Max(60_000)
    private final int sendTimeoutMs;

    @Min(100)
    @Max(60_000)
    private final int closeTimeoutMs;

    /** Ask the service to add punctuation to transcripts. */
    private final boolean punctuate;

    @ConstructorBinding
    public TranscriptionProperties(@DefaultValue("wss://api.deepgram.com/v1/listen") String url,
                                   String apiKey,
                                   @DefaultValue("10000") int connectTimeoutMs,
                                   @DefaultValue("5000") int sendTimeoutMs,
                                   @DefaultValue("5000") int closeTimeoutMs,
                                   @DefaultValue("true") boolean punctuate) {
        this.url = url;
        this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey;
        this.connectTimeoutMs = connectTimeoutMs;
        this.sendTimeoutMs = sendTimeoutMs;
        this.closeTimeoutMs = closeTimeoutMs;
        this.punctuate = punctuate;
    }

    public String getUrl() { return url; }
    public String getApiKey() { return apiKey; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public int getSendTimeoutMs() { return sendTimeoutMs; }
    public int getCloseTimeoutMs() { return closeTimeoutMs; }
    public boolean isPunctuate() { return punctuate; }
}
