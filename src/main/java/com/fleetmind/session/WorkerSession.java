package com.fleetmind.session;

import com.fleetmind.core.model.Worker;

/**
 * Abstraction over the execution context a worker's interactive program runs in.
 * Implementations: TmuxWorkerSession (terminal multiplexer panes).
 */
public interface WorkerSession {

    /**
     * Captures the worker's visible terminal text. Returns an empty string when the context
     * is gone, which classifies as absent.
     */
    String capture(Worker worker);

    /**
     * Types {@code text} into the worker's input and submits it.
     *
     * @throws SessionException if the keystrokes could not be delivered
     */
    void send(Worker worker, String text);

    /**
     * Whether the multiplexer itself is reachable.
     */
    boolean available();
}
