package com.fleetmind.dispatch.cli;

import com.fleetmind.core.engine.Dispatcher;
import com.fleetmind.core.engine.WorkerPhase;
import com.fleetmind.core.mailbox.MailboxStore;
import com.fleetmind.core.model.Task;
import com.fleetmind.core.model.Worker;
import com.fleetmind.core.model.WorkerActivity;
import com.fleetmind.core.registry.TaskRegistry;
import com.fleetmind.core.roster.WorkerRoster;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;

/**
 * CLI command: fleetmind status
 * <p>
 * One row per worker: model, task, task status, unread mail, observed activity and phase.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show every worker's task, mailbox and activity")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--lineage"}, description = "Also print each worker's redo chain")
    private boolean lineage;

    private final WorkerRoster roster;
    private final TaskRegistry registry;
    private final MailboxStore mailbox;
    private final Dispatcher dispatcher;

    public StatusCommand(WorkerRoster roster, TaskRegistry registry, MailboxStore mailbox, Dispatcher dispatcher) {
        this.roster = roster;
        this.registry = registry;
        this.mailbox = mailbox;
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<Worker> workers = roster.all();
        if (workers.isEmpty()) {
            ConsoleOutput.info("No workers configured (fleetmind.workers).");
            return;
        }
        System.out.printf("  %-10s %-12s %-16s %-9s %3s  %-6s %s%n",
                "WORKER", "MODEL", "TASK", "STATUS", "NEW", "STATE", "PHASE");
        for (Worker worker : workers) {
            Optional<Task> task = registry.get(worker.workerId());
            int unread = mailbox.unreadCount(worker.workerId());
            WorkerActivity activity = dispatcher.observe(worker);
            WorkerPhase phase = WorkerPhase.of(task, activity, unread);
            ConsoleOutput.workerRow(
                    worker.workerId(),
                    ConsoleOutput.truncate(worker.model(), 12),
                    task.map(Task::taskId).map(id -> ConsoleOutput.truncate(id, 16)).orElse("-"),
                    task.map(t -> t.status().wireName()).orElse("-"),
                    unread,
                    activity.label(),
                    phase.label());
        }
        if (lineage) {
            System.out.println();
            for (Worker worker : workers) {
                List<Task> chain = registry.lineage(worker.workerId());
                if (chain.size() > 1) {
                    ConsoleOutput.info(worker.workerId() + ": " + String.join(" <- ", chain.stream().map(Task::taskId).toList()));
                }
            }
        }
    }
}
