package com.fleetmind.notify;

import com.fleetmind.core.FleetException;

public class NotificationException extends FleetException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
