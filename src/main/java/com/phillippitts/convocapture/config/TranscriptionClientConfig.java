package com.phillippitts.convocapture.config;

import com.phillippitts.convocapture.config.properties.TranscriptionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP client shared by all transcription streams. WebSocket connections opened from it are
 * independent of each other; only the connection machinery is shared.
 */
@Configuration
public class TranscriptionClientConfig {

    @Bean
    public HttpClient transcriptionHttpClient(TranscriptionProperties props) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .build();
    }
}
