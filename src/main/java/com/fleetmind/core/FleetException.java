package com.fleetmind.core;

/**
 * Base type for every failure the orchestration kernel reports to its callers.
 * <p>
 * All subclasses are local and recoverable: the dispatcher treats any of them as
 * "retry next tick" for the affected worker.
 */
public class FleetException extends RuntimeException {

    public FleetException(String message) {
        super(message);
    }

    public FleetException(String message, Throwable cause) {
        super(message, cause);
    }
}
