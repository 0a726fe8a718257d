package com.fleetmind.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A unit of work handed to exactly one worker.
 *
 * @param taskId      immutable identifier (e.g. "subtask_042a")
 * @param parentId    grouping identifier of the command this task belongs to
 * @param type        free-form task category
 * @param description what the worker should accomplish
 * @param bloomLevel  optional cognitive-demand estimate, 1..6
 * @param blockedBy   predecessor task ids that must be done before assignment
 * @param redoOf      id of the done task this one supersedes; write-once
 * @param status      current status
 * @param timestamp   time of the last transition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("parent_id") String parentId,
    String type,
    String description,
    @JsonProperty("bloom_level") Integer bloomLevel,
    @JsonProperty("blocked_by") List<String> blockedBy,
    @JsonProperty("redo_of") String redoOf,
    TaskStatus status,
    Instant timestamp
) {

    public Task {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("task_id cannot be empty");
        }
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
    }

    public boolean hasPredecessors() {
        return !blockedBy.isEmpty();
    }

    public Task withStatus(TaskStatus newStatus, Instant at) {
        return new Task(taskId, parentId, type, description, bloomLevel, blockedBy, redoOf, newStatus, at);
    }

    public Task withRedoOf(String predecessorId) {
        return new Task(taskId, parentId, type, description, bloomLevel, blockedBy, predecessorId, status, timestamp);
    }
}
