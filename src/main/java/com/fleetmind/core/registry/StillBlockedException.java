package com.fleetmind.core.registry;

import com.fleetmind.core.FleetException;

import java.util.List;

/**
 * A blocked task cannot be assigned yet: at least one predecessor is not done.
 * Expected during normal scheduling; callers simply try again later.
 */
public class StillBlockedException extends FleetException {

    private final String taskId;
    private final List<String> pending;

    public StillBlockedException(String taskId, List<String> pending) {
        super("Task " + taskId + " still blocked by " + pending);
        this.taskId = taskId;
        this.pending = List.copyOf(pending);
    }

    public String taskId() {
        return taskId;
    }

    public List<String> pending() {
        return pending;
    }
}
