package com.phillippitts.convocapture;

import com.phillippitts.convocapture.config.properties.SessionProperties;
import com.phillippitts.convocapture.config.properties.TranscriptionProperties;
import com.phillippitts.convocapture.presentation.console.ConsoleSessionRunner;
import com.phillippitts.convocapture.service.analysis.ConversationAnalyzer;
import com.phillippitts.convocapture.service.health.SessionHealthIndicator;
import com.phillippitts.convocapture.service.persistence.ConversationStoreFactory;
import com.phillippitts.convocapture.service.session.SessionManager;
import com.phillippitts.convocapture.service.stt.TranscriptionClient;
import com.phillippitts.convocapture.service.stt.deepgram.DeepgramTranscriptionClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConvoCaptureApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private SessionHealthIndicator health;

    @Test
    void contextLoads() {
        assertThat(context.getBean(TranscriptionClient.class)).isInstanceOf(DeepgramTranscriptionClient.class);
        assertThat(context.getBean(ConversationStoreFactory.class)).isNotNull();
        assertThat(context.getBeansOfType(ConsoleSessionRunner.class)).isEmpty();
        assertThat(context.getBeansOfType(ConversationAnalyzer.class)).isEmpty();
    }

    @Test
    void bindsTestProperties() {
        assertThat(context.getBean(TranscriptionProperties.class).getApiKey()).isEqualTo("test-key");
        assertThat(context.getBean(SessionProperties.class).getStartupWaitMs()).isEqualTo(200);
        assertThat(context.getBean(SessionProperties.class).getMessageSender()).isEqualTo("user");
    }

    @Test
    void startsWithNoSessionsAndHealthy() {
        assertThat(sessionManager.size()).isZero();
        assertThat(health.health().getStatus()).isEqualTo(Status.UP);
    }
}
