package com.fleetmind.dispatch.cli;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.engine.Dispatcher;
import com.fleetmind.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: fleetmind complete &lt;worker&gt;
 * <p>
 * Marks the worker's assigned task done and drops a report notice in the owner's mailbox.
 */
@Command(name = "complete", mixinStandardHelpOptions = true, description = "Mark a worker's task done")
@Component
public class CompleteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Worker id")
    private String workerId;

    @Option(names = {"--summary", "-s"}, description = "One-line result summary for the owner")
    private String summary;

    private final Dispatcher dispatcher;

    public CompleteCommand(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        try {
            Task done = dispatcher.complete(workerId, summary);
            ConsoleOutput.task(workerId, done);
            return 0;
        } catch (FleetException e) {
            ConsoleOutput.error("Complete failed: " + e.getMessage());
            return 1;
        }
    }
}
