package com.fleetmind.dispatch.cli;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.engine.Dispatcher;
import com.fleetmind.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: fleetmind assign &lt;worker&gt; &lt;task-id&gt;
 */
@Command(name = "assign", mixinStandardHelpOptions = true, description = "Give a worker its next task")
@Component
public class AssignCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Worker id")
    private String workerId;

    @Parameters(index = "1", description = "New task id")
    private String taskId;

    @Mixin
    private TaskSpecOptions spec = new TaskSpecOptions();

    private final Dispatcher dispatcher;

    public AssignCommand(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        try {
            Task stored = dispatcher.assign(workerId, spec.toTask(taskId, null));
            ConsoleOutput.task(workerId, stored);
            return 0;
        } catch (FleetException | IllegalArgumentException e) {
            ConsoleOutput.error("Assign failed: " + e.getMessage());
            return 1;
        }
    }
}
