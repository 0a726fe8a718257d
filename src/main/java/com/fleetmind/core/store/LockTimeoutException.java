package com.fleetmind.core.store;

import com.fleetmind.core.FleetException;

import java.time.Duration;

/**
 * A worker-scoped lock could not be acquired within its bound. No write happened.
 */
public class LockTimeoutException extends FleetException {

    private final String key;

    public LockTimeoutException(String key, Duration waited) {
        super("Timed out after " + waited.toMillis() + "ms waiting for lock on " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
