package com.fleetmind.core.registry;

import com.fleetmind.core.FleetException;

/**
 * The requested change is not in the task lifecycle: leaving {@code done}, skipping a state,
 * holding two unfinished tasks on one worker, or a redo that does not follow a done task.
 */
public class IllegalTransitionException extends FleetException {

    public IllegalTransitionException(String message) {
        super(message);
    }
}
