package com.fleetmind.notify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NtfyChannelTest {

    private HttpClient client;
    private HttpResponse<Object> response;
    private NtfyChannel channel;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        client = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        channel = new NtfyChannel(client, "https://ntfy.example/", "fleet");
    }

    @Test
    @DisplayName("publish POSTs to the topic with the outbound tag")
    void publishTagsOutbound() throws Exception {
        when(response.statusCode()).thenReturn(200);
        doReturn(response).when(client).send(any(HttpRequest.class), any());

        channel.publish("📱受信: hello");

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertEquals("POST", request.method());
        assertEquals("https://ntfy.example/fleet", request.uri().toString());
        assertEquals("outbound", request.headers().firstValue("Tags").orElseThrow());
    }

    @Test
    @DisplayName("non-2xx response -> NotificationException")
    void httpError() throws Exception {
        when(response.statusCode()).thenReturn(503);
        when(response.body()).thenReturn("unavailable");
        doReturn(response).when(client).send(any(HttpRequest.class), any());

        var ex = assertThrows(NotificationException.class, () -> channel.publish("hi"));
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    @DisplayName("I/O failure -> NotificationException")
    void ioError() throws Exception {
        doThrow(new IOException("connection refused")).when(client).send(any(HttpRequest.class), any());

        assertThrows(NotificationException.class, () -> channel.publish("hi"));
    }
}
