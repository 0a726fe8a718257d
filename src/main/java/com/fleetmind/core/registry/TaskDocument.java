package com.fleetmind.core.registry;

import com.fleetmind.core.model.Task;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted shape of a worker's task file: the active task plus the worker's earlier
 * tasks, oldest first. History is what lets predecessors and redo lineage be resolved
 * after a worker has moved on.
 */
public record TaskDocument(Task task, List<Task> history) {

    public TaskDocument {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * Makes {@code next} the active task; the previous one (if different) moves to history.
     */
    public TaskDocument replaceWith(Task next) {
        if (task == null || task.taskId().equals(next.taskId())) {
            return new TaskDocument(next, history);
        }
        var archived = new ArrayList<>(history);
        archived.add(task);
        return new TaskDocument(next, archived);
    }

    public List<Task> allTasks() {
        var all = new ArrayList<>(history);
        if (task != null) {
            all.add(task);
        }
        return all;
    }
}
