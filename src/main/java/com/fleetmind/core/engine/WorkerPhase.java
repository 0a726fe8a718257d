package com.fleetmind.core.engine;

import com.fleetmind.core.model.Task;
import com.fleetmind.core.model.TaskStatus;
import com.fleetmind.core.model.WorkerActivity;

import java.util.Locale;
import java.util.Optional;

/**
 * Where a worker stands from the dispatcher's point of view: task status crossed with the
 * observed activity.
 */
public enum WorkerPhase {
    BLOCKED,
    READY_NO_TASK,
    ASSIGNED_IDLE_UNNOTIFIED,
    ASSIGNED_BUSY,
    ASSIGNED_IDLE_NOTIFIED;

    public static WorkerPhase of(Optional<Task> task, WorkerActivity activity, int unread) {
        if (task.isEmpty() || task.get().status() == TaskStatus.DONE) {
            return READY_NO_TASK;
        }
        if (task.get().status() == TaskStatus.BLOCKED) {
            return BLOCKED;
        }
        if (activity == WorkerActivity.BUSY) {
            return ASSIGNED_BUSY;
        }
        return unread > 0 ? ASSIGNED_IDLE_UNNOTIFIED : ASSIGNED_IDLE_NOTIFIED;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
