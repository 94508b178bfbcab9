package com.phillippitts.convocapture.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for conversation session lifecycle and transcript retention.
 */
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    /** Upper bound on how long create waits for the microphone to report active. */
    @Min(0)
    @Max(30_000)
    private final int startupWaitMs;

    /** Upper bound on how long stop waits for the session thread to terminate. */
    @Min(0)
    @Max(60_000)
    private final int stopJoinTimeoutMs;

    /** Character budget of the compiled transcript kept in memory. */
    @Min(1)
    private final int transcriptMaxChars;

    /** Lines always retained regardless of the character budget. */
    @Min(0)
    private final int transcriptMinLines;

    /** Capacity of the recent-transcript ring. */
    @Min(1)
    @Max(10_000)
    private final int recentCapacity;

    /** Sender recorded on every persisted message (the capturing party). */
    @NotBlank
    private final String messageSender;

    @ConstructorBinding
    public SessionProperties(@DefaultValue("1000") int startupWaitMs,
                             @DefaultValue("5000") int stopJoinTimeoutMs,
                             @DefaultValue("20000") int transcriptMaxChars,
                             @DefaultValue("50") int transcriptMinLines,
                             @DefaultValue("100") int recentCapacity,
                             @DefaultValue("user") String messageSender) {
        this.startupWaitMs = startupWaitMs;
        this.stopJoinTimeoutMs = stopJoinTimeoutMs;
        this.transcriptMaxChars = transcriptMaxChars;
        this.transcriptMinLines = transcriptMinLines;
        this.recentCapacity = recentCapacity;
        this.messageSender = messageSender;
    }

    /** Defaults used when no configuration is bound (tests and standalone wiring). */
    public static SessionProperties defaults() {
        return new SessionProperties(1000, 5000, 20_000, 50, 100, "user");
    }

    public int getStartupWaitMs() { return startupWaitMs; }
    public int getStopJoinTimeoutMs() { return stopJoinTimeoutMs; }
    public int getTranscriptMaxChars() { return transcriptMaxChars; }
    public int getTranscriptMinLines() { return transcriptMinLines; }
    public int getRecentCapacity() { return recentCapacity; }
    public String getMessageSender() { return messageSender; }
}
