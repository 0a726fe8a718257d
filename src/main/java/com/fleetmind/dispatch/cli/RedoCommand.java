package com.fleetmind.dispatch.cli;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.engine.Dispatcher;
import com.fleetmind.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: fleetmind redo &lt;worker&gt; &lt;new-task-id&gt;
 * <p>
 * Resets the worker's session and replaces its done task with a corrected successor.
 */
@Command(name = "redo", mixinStandardHelpOptions = true, description = "Replace a worker's done task with a corrected one")
@Component
public class RedoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Worker id")
    private String workerId;

    @Parameters(index = "1", description = "Successor task id")
    private String taskId;

    @Option(names = "--redo-of", description = "Id of the done task being redone (checked against the worker's task)")
    private String redoOf;

    @Mixin
    private TaskSpecOptions spec = new TaskSpecOptions();

    private final Dispatcher dispatcher;

    public RedoCommand(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        try {
            Task next = dispatcher.redo(workerId, spec.toTask(taskId, redoOf));
            ConsoleOutput.task(workerId, next);
            return 0;
        } catch (FleetException | IllegalArgumentException e) {
            ConsoleOutput.error("Redo failed: " + e.getMessage());
            return 1;
        }
    }
}
