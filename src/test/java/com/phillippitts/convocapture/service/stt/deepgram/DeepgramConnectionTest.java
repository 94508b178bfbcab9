package com.phillippitts.convocapture.service.stt.deepgram;

import com.phillippitts.convocapture.exception.TranscriptionStreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeepgramConnectionTest {

    private static final String ENDPOINT = "wss://stt.test/v1/listen";

    private WebSocket ws;
    private QueueingListener listener;
    private DeepgramConnection connection;

    @BeforeEach
    void setUp() {
        ws = mock(WebSocket.class);
        listener = new QueueingListener();
        connection = new DeepgramConnection(ws, listener, ENDPOINT,
                Duration.ofMillis(200), Duration.ofMillis(200));
    }

    @Test
    void shouldSendFramesAsBinaryMessages() {
        when(ws.sendBinary(any(ByteBuffer.class), anyBoolean()))
                .thenReturn(CompletableFuture.completedFuture(ws));

        connection.send(new byte[]{1, 2, 3, 4});
        connection.send(new byte[]{5, 6});

        verify(ws, times(2)).sendBinary(any(ByteBuffer.class), eq(true));
        assertThat(connection.framesSent()).isEqualTo(2);
        assertThat(connection.isOpen()).isTrue();
    }

    @Test
    void shouldWrapSendFailure() {
        when(ws.sendBinary(any(ByteBuffer.class), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("broken pipe")));

        assertThatThrownBy(() -> connection.send(new byte[]{1, 2}))
                .isInstanceOf(TranscriptionStreamException.class)
                .hasRootCauseMessage("broken pipe")
                .extracting(e -> ((TranscriptionStreamException) e).getEndpoint())
                .isEqualTo(ENDPOINT);
    }

    @Test
    void shouldTimeOutStalledSend() {
        when(ws.sendBinary(any(ByteBuffer.class), anyBoolean())).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> connection.send(new byte[]{1, 2}))
                .isInstanceOf(TranscriptionStreamException.class)
                .hasMessageContaining("Timed out");
    }

    @Test
    void shouldRejectSendAfterClose() {
        when(ws.sendClose(anyInt(), anyString())).thenAnswer(inv -> {
            listener.onClose(ws, WebSocket.NORMAL_CLOSURE, "");
            return CompletableFuture.completedFuture(ws);
        });
        connection.close();

        assertThatThrownBy(() -> connection.send(new byte[]{1, 2}))
                .isInstanceOf(TranscriptionStreamException.class);
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    void gracefulCloseDoesNotAbort() throws Exception {
        when(ws.sendClose(anyInt(), anyString())).thenAnswer(inv -> {
            listener.onClose(ws, WebSocket.NORMAL_CLOSURE, "");
            return CompletableFuture.completedFuture(ws);
        });

        connection.close();
        connection.close();

        verify(ws, times(1)).sendClose(eq(WebSocket.NORMAL_CLOSURE), anyString());
        verify(ws, never()).abort();
        assertThat(connection.receive()).isNull();
    }

    @Test
    void unacknowledgedCloseAbortsAndReleasesReceiver() throws Exception {
        when(ws.sendClose(anyInt(), anyString())).thenReturn(CompletableFuture.completedFuture(ws));

        connection.close();

        verify(ws).abort();
        assertThat(listener.isEnded()).isTrue();
        assertThat(connection.receive()).isNull();
    }

    @Test
    void receiveSurfacesAbnormalEnd() {
        listener.onError(ws, new IOException("reset"));

        assertThatThrownBy(connection::receive)
                .isInstanceOf(TranscriptionStreamException.class)
                .hasRootCauseMessage("reset");
    }

    @Test
    void receiveReturnsQueuedEventsBeforeEnd() throws Exception {
        listener.onText(ws, "{\"is_final\":true,\"transcript\":\"hi\"}", true);
        listener.onClose(ws, WebSocket.NORMAL_CLOSURE, "");

        assertThat(connection.receive().transcript()).isEqualTo("hi");
        assertThat(connection.receive()).isNull();
    }
}
