package com.phillippitts.convocapture.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allSessionErrorsShareTheBaseType() {
        assertThat(new ConfigurationException("transcription.api-key")).isInstanceOf(ConvoCaptureException.class);
        assertThat(new DuplicateSessionException("s1")).isInstanceOf(ConvoCaptureException.class);
        assertThat(new TranscriptionStreamException("boom", "wss://x")).isInstanceOf(ConvoCaptureException.class);
        assertThat(new ConversationPersistenceException("append message", new IOException()))
                .isInstanceOf(ConvoCaptureException.class);
        assertThat(new DeviceUnavailableException(DeviceUnavailableException.MIC_UNAVAILABLE, "none", null))
                .isInstanceOf(ConvoCaptureException.class);
    }

    @Test
    void configurationExceptionShouldNameTheSetting() {
        ConfigurationException ex = new ConfigurationException("transcription.api-key");

        assertThat(ex.getMessage()).contains("transcription.api-key");
        assertThat(ex.getSetting()).isEqualTo("transcription.api-key");
    }

    @Test
    void deviceUnavailableExceptionShouldCarryReasonAndCause() {
        SecurityException cause = new SecurityException("denied");
        DeviceUnavailableException ex = new DeviceUnavailableException(
                DeviceUnavailableException.MIC_PERMISSION_DENIED, "denied", cause);

        assertThat(ex.getReason()).isEqualTo("MIC_PERMISSION_DENIED");
        assertThat(ex.getMessage()).contains("MIC_PERMISSION_DENIED").contains("denied");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void transcriptionStreamExceptionShouldIncludeEndpoint() {
        IOException cause = new IOException("reset");
        TranscriptionStreamException ex = new TranscriptionStreamException("Failed to send audio", "wss://stt", cause);

        assertThat(ex.getMessage()).contains("Failed to send audio").contains("wss://stt");
        assertThat(ex.getEndpoint()).isEqualTo("wss://stt");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void persistenceExceptionShouldNameTheOperation() {
        ConversationPersistenceException ex = new ConversationPersistenceException("create conversation",
                new IllegalStateException("db down"));

        assertThat(ex.getOperation()).isEqualTo("create conversation");
        assertThat(ex.getMessage()).contains("create conversation");
    }

    @Test
    void duplicateSessionExceptionShouldNameTheSession() {
        DuplicateSessionException ex = new DuplicateSessionException("abc");

        assertThat(ex.getSessionId()).isEqualTo("abc");
        assertThat(ex.getMessage()).contains("abc");
    }
}
