package com.phillippitts.convocapture.presentation.console;

import com.phillippitts.convocapture.domain.SessionStats;
import com.phillippitts.convocapture.exception.ConvoCaptureException;
import com.phillippitts.convocapture.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Interactive driver: starts one session, waits for Enter, stops it and prints a summary.
 *
 * <p>Enabled with {@code console.enabled=true}. Options:
 * <pre>
 * --user-id=1 --partner-id=1 [--api-key=...]
 * </pre>
 * Without {@code --api-key} the configured {@code transcription.api-key} is used.
 */
@Component
@ConditionalOnProperty(prefix = "console", name = "enabled", havingValue = "true")
public class ConsoleSessionRunner implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(ConsoleSessionRunner.class);

    private final SessionManager sessionManager;
    private final InputStream in;
    private final PrintStream out;

    public ConsoleSessionRunner(SessionManager sessionManager) {
        this(sessionManager, System.in, System.out);
    }

    ConsoleSessionRunner(SessionManager sessionManager, InputStream in, PrintStream out) {
        this.sessionManager = sessionManager;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        long userId = longOption(args, "user-id", 1L);
        long partnerId = longOption(args, "partner-id", 1L);
        String apiKey = stringOption(args, "api-key");
        String sessionId = UUID.randomUUID().toString();

        SessionStats started;
        try {
            started = sessionManager.create(sessionId, userId, partnerId, apiKey);
        } catch (ConvoCaptureException e) {
            LOG.error("Failed to create session: {}", e.getMessage());
            out.println("Failed to create session: " + e.getMessage());
            return;
        }
        out.println("Session started (ID: " + sessionId + ")");
        out.println("Conversation ID: " + started.conversationId());
        out.println("Speak into your microphone...");
        out.println("Press Enter to stop the session");

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        reader.readLine();

        out.println("Stopping session...");
        SessionStats last = sessionManager.stopAndReport(sessionId).orElse(started);
        out.println("Session ended");
        out.println("  Duration: " + last.elapsedFormatted());
        out.println("  Messages: " + last.messageCount());
        if (last.detectedPartnerName() != null) {
            out.println("  Partner:  " + last.detectedPartnerName());
        }
    }

    private static long longOption(ApplicationArguments args, String name, long defaultValue) {
        String value = stringOption(args, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + value, e);
        }
    }

    private static String stringOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
