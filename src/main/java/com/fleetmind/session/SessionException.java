package com.fleetmind.session;

import com.fleetmind.core.FleetException;

public class SessionException extends FleetException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
