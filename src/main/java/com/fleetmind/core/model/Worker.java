package com.fleetmind.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A provisioned worker process.
 *
 * @param workerId     identity, also the key of its mailbox and task documents
 * @param model        current capability tier (model identifier)
 * @param cli          the program family the worker drives
 * @param session      execution-context target (e.g. a tmux pane) used for capture and control
 * @param turnDeferred  true once the turn-completion hook has held the current turn open for mail
 * @param announcedTask id of the last task whose assignment notice reached the mailbox
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Worker(
    @JsonProperty("worker_id") String workerId,
    String model,
    CliFamily cli,
    String session,
    @JsonProperty("turn_deferred") boolean turnDeferred,
    @JsonProperty("announced_task") String announcedTask
) {

    public Worker(String workerId, String model, CliFamily cli, String session) {
        this(workerId, model, cli, session, false, null);
    }

    public Worker withModel(String newModel) {
        return new Worker(workerId, newModel, cli, session, turnDeferred, announcedTask);
    }

    public Worker withTurnDeferred(boolean deferred) {
        return new Worker(workerId, model, cli, session, deferred, announcedTask);
    }

    public Worker withAnnouncedTask(String taskId) {
        return new Worker(workerId, model, cli, session, turnDeferred, taskId);
    }
}
