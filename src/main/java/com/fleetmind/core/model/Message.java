package com.fleetmind.core.model;

import java.time.Instant;

/**
 * One entry of a worker mailbox. Only {@code read} ever changes after append, and only false to true.
 */
public record Message(
    String id,
    String from,
    String type,
    String content,
    boolean read,
    Instant timestamp
) {

    public static final String TYPE_TASK_ASSIGNED = "task_assigned";
    public static final String TYPE_MODEL_SWITCH = "model_switch";
    public static final String TYPE_REPORT_RECEIVED = "report_received";
    public static final String TYPE_NTFY_RECEIVED = "ntfy_received";
    public static final String TYPE_INFO = "info";

    public Message asRead() {
        return read ? this : new Message(id, from, type, content, true, timestamp);
    }
}
