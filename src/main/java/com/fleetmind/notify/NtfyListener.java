package com.fleetmind.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.FleetException;
import com.fleetmind.core.model.NotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Long-running subscriber to an ntfy topic's JSON stream. Each line is decoded into a
 * {@link NotificationEvent} and handed to the consumer. After a dropped connection the
 * stream is reopened with {@code since=<last id>} so nothing delivered in between is lost.
 * Until a first event has been consumed there is no id to resume after; the stream then
 * resumes from a unix timestamp instead: the failed event's own time, or the moment of the
 * first subscription.
 */
public class NtfyListener {

    private static final Logger log = LoggerFactory.getLogger(NtfyListener.class);

    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String server;
    private final String topic;

    private volatile boolean running;
    private volatile String lastEventId;
    private volatile Long replayFrom;

    public NtfyListener(String server, String topic, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), server, topic, objectMapper);
    }

    NtfyListener(HttpClient httpClient, String server, String topic, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.server = server;
        this.topic = topic;
        this.objectMapper = objectMapper;
    }

    /**
     * Blocks, delivering events until {@link #stop()} is called or the thread is interrupted.
     */
    public void listen(Consumer<NotificationEvent> consumer) {
        running = true;
        Duration backoff = INITIAL_BACKOFF;
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                streamOnce(consumer);
                backoff = INITIAL_BACKOFF;
            } catch (IOException | NotificationException e) {
                log.warn("ntfy stream for '{}' dropped: {}; reconnecting in {}s", topic, e.getMessage(), backoff.toSeconds());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!running) {
                break;
            }
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            backoff = backoff.multipliedBy(2).compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff.multipliedBy(2);
        }
        log.info("ntfy listener for '{}' stopped", topic);
    }

    public void stop() {
        running = false;
    }

    public String lastEventId() {
        return lastEventId;
    }

    void streamOnce(Consumer<NotificationEvent> consumer) throws IOException, InterruptedException {
        var request = HttpRequest.newBuilder()
                .uri(streamUri())
                .GET()
                .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            response.body().close();
            throw new NotificationException("ntfy subscribe returned HTTP " + response.statusCode());
        }
        log.info("Subscribed to ntfy topic '{}'", topic);
        if (lastEventId == null && replayFrom == null) {
            replayFrom = Instant.now().getEpochSecond();
        }
        try (Stream<String> lines = response.body()) {
            lines.takeWhile(line -> running).forEach(line -> handleLine(line, consumer));
        }
    }

    void handleLine(String line, Consumer<NotificationEvent> consumer) {
        if (line == null || line.isBlank()) {
            return;
        }
        NotificationEvent event;
        try {
            event = objectMapper.readValue(line, NotificationEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping undecodable ntfy line: {}", e.getOriginalMessage());
            return;
        }
        try {
            consumer.accept(event);
        } catch (FleetException e) {
            // The event stays unconsumed; lastEventId is not advanced so a reconnect replays it.
            if (lastEventId == null && event.messageEvent() && event.time() > 0) {
                replayFrom = event.time();
            }
            throw new NotificationException("Event " + event.id() + " not delivered: " + e.getMessage(), e);
        }
        if (event.id() != null && event.messageEvent()) {
            lastEventId = event.id();
            replayFrom = null;
        }
    }

    /** Where the next subscription resumes: the last consumed id, else a unix timestamp, else live. */
    String resumePoint() {
        if (lastEventId != null) {
            return lastEventId;
        }
        Long from = replayFrom;
        return from == null ? null : String.valueOf(from);
    }

    URI streamUri() {
        return NtfyUris.stream(server, topic, resumePoint());
    }
}
