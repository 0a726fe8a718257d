package com.fleetmind.notify;

/**
 * Outbound side of the push-notification topic shared with the operator.
 */
public interface NotificationChannel {

    /**
     * Publishes {@code text} to the topic, marked as outbound so the listener never
     * re-ingests it.
     *
     * @throws NotificationException if the notification service rejects or cannot be reached
     */
    void publish(String text);
}
