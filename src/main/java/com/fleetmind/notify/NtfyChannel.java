package com.fleetmind.notify;

import com.fleetmind.core.model.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Publishes to an ntfy topic with a plain-text POST. Every message carries the
 * {@value NotificationEvent#OUTBOUND_TAG} tag.
 */
public class NtfyChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(NtfyChannel.class);

    private final HttpClient httpClient;
    private final URI topicUri;

    public NtfyChannel(String server, String topic) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), server, topic);
    }

    NtfyChannel(HttpClient httpClient, String server, String topic) {
        this.httpClient = httpClient;
        this.topicUri = NtfyUris.topic(server, topic);
    }

    @Override
    public void publish(String text) {
        var request = HttpRequest.newBuilder()
                .uri(topicUri)
                .timeout(Duration.ofSeconds(10))
                .header("Tags", NotificationEvent.OUTBOUND_TAG)
                .header("Content-Type", "text/plain; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(text, StandardCharsets.UTF_8))
                .build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new NotificationException("ntfy publish failed (HTTP %d): %s"
                        .formatted(response.statusCode(), response.body()));
            }
            log.debug("Published {} chars to {}", text.length(), topicUri);
        } catch (IOException e) {
            throw new NotificationException("ntfy publish failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while publishing to ntfy", e);
        }
    }
}
