package com.fleetmind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An event observed on the external notification relay, in the relay's JSON stream shape.
 *
 * @param eventKind "message", "keepalive", "open", ...
 * @param id        relay-assigned event id
 * @param time      epoch seconds
 * @param content   message body, passed through verbatim
 * @param tags      relay tags; {@value #OUTBOUND_TAG} marks this system's own acknowledgments
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationEvent(
    @JsonProperty("event") String eventKind,
    String id,
    long time,
    @JsonProperty("message") String content,
    List<String> tags
) {

    public static final String OUTBOUND_TAG = "outbound";
    public static final String MESSAGE_KIND = "message";

    public NotificationEvent {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean messageEvent() {
        return MESSAGE_KIND.equals(eventKind);
    }

    public boolean outbound() {
        return tags.contains(OUTBOUND_TAG);
    }
}
