package com.fleetmind.core.engine;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.inference.StateClassifier;
import com.fleetmind.core.logging.MdcContext;
import com.fleetmind.core.mailbox.MailboxStore;
import com.fleetmind.core.metrics.FleetMetrics;
import com.fleetmind.core.model.CliFamily;
import com.fleetmind.core.model.Message;
import com.fleetmind.core.model.Task;
import com.fleetmind.core.model.TaskStatus;
import com.fleetmind.core.model.Worker;
import com.fleetmind.core.model.WorkerActivity;
import com.fleetmind.core.registry.StillBlockedException;
import com.fleetmind.core.registry.TaskRegistry;
import com.fleetmind.core.roster.WorkerRoster;
import com.fleetmind.core.routing.CapabilityRouter;
import com.fleetmind.core.routing.CapabilityTier;
import com.fleetmind.core.routing.InvalidBloomLevelException;
import com.fleetmind.core.routing.RoutingMode;
import com.fleetmind.session.SessionException;
import com.fleetmind.session.WorkerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The orchestration core. Each {@link #tick()} walks the roster once and, per worker:
 * <ol>
 *   <li>unblocks a blocked task whose predecessors are all done and announces it, preceded by
 *       a model switch when the task needs more capability than the worker's model has;</li>
 *   <li>re-announces an assigned task whose notice never reached the mailbox;</li>
 *   <li>nudges an idle worker with an assigned task and unread mail, and leaves a busy one
 *       alone so its own end-of-turn hook picks the mail up.</li>
 * </ol>
 * A failure on one worker is logged and retried on the next tick; it never stops the others.
 */
@Service
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    public static final String SENDER = "dispatcher";
    public static final String NUDGE_PREFIX = "inbox";

    private final WorkerRoster roster;
    private final TaskRegistry registry;
    private final MailboxStore mailbox;
    private final StateClassifier classifier;
    private final CapabilityRouter router;
    private final WorkerSession session;
    private final FleetMetrics metrics;
    private final String ownerId;
    private final AtomicLong ticks = new AtomicLong();

    @Autowired
    public Dispatcher(WorkerRoster roster, TaskRegistry registry, MailboxStore mailbox, StateClassifier classifier,
                      CapabilityRouter router, WorkerSession session, FleetMetrics metrics,
                      FleetProperties properties) {
        this(roster, registry, mailbox, classifier, router, session, metrics, properties.getOwnerId());
    }

    public Dispatcher(WorkerRoster roster, TaskRegistry registry, MailboxStore mailbox, StateClassifier classifier,
                      CapabilityRouter router, WorkerSession session, FleetMetrics metrics, String ownerId) {
        this.roster = roster;
        this.registry = registry;
        this.mailbox = mailbox;
        this.classifier = classifier;
        this.router = router;
        this.session = session;
        this.metrics = metrics;
        this.ownerId = ownerId;
    }

    public TickReport tick() {
        long started = System.currentTimeMillis();
        TickReport report = new TickReport(ticks.incrementAndGet());
        MdcContext.setTick(report.tick());
        try {
            for (Worker worker : roster.all()) {
                MdcContext.setWorker(worker.workerId());
                try {
                    step(worker, report);
                } catch (FleetException e) {
                    log.warn("Worker {} left for next tick: {}", worker.workerId(), e.getMessage());
                    metrics.recordWorkerFailure(e.getClass().getSimpleName());
                    report.failed(worker.workerId(), e.getMessage());
                } finally {
                    MdcContext.clearWorker();
                }
            }
        } finally {
            MdcContext.clear();
        }
        metrics.recordTick(System.currentTimeMillis() - started);
        if (!report.quiet()) {
            log.info("{}", report);
        }
        return report;
    }

    private void step(Worker worker, TickReport report) {
        String workerId = worker.workerId();
        Optional<Task> current = registry.get(workerId);
        if (current.isEmpty() || current.get().status() == TaskStatus.DONE) {
            return;
        }
        Task task = current.get();
        MdcContext.setTask(workerId, task.taskId());

        if (task.status() == TaskStatus.BLOCKED) {
            try {
                task = registry.transition(workerId, TaskStatus.ASSIGNED);
            } catch (StillBlockedException e) {
                log.debug("Task {} still waits on {}", task.taskId(), e.pending());
                return;
            }
            metrics.recordUnblock();
            report.unblocked(workerId);
        }
        if (!task.taskId().equals(worker.announcedTask())) {
            if (announce(worker, task)) {
                report.switched(workerId);
            }
            report.announced(workerId);
        }

        int unread = mailbox.unreadCount(workerId);
        if (unread == 0) {
            return;
        }
        WorkerActivity activity = observe(worker);
        switch (activity) {
            case BUSY -> {
                log.debug("{} busy with {} unread; its turn-completion hook will deliver", workerId, unread);
                metrics.recordNudge("deferred");
                report.deferred(workerId);
            }
            case IDLE -> {
                session.send(worker, NUDGE_PREFIX + unread);
                metrics.recordNudge("sent");
                report.nudged(workerId);
            }
            case ABSENT -> {
                log.debug("{} has no capturable session; {} unread left in place", workerId, unread);
                metrics.recordNudge("absent");
                report.absent(workerId);
            }
        }
    }

    /**
     * Creates the worker's next task and, when it starts out assigned, announces it right away.
     * An announcement that fails here is retried by the next tick.
     */
    public Task assign(String workerId, Task task) {
        Worker worker = roster.require(workerId);
        Task stored = registry.assign(workerId, task);
        announceIfAssigned(worker, stored);
        return stored;
    }

    /**
     * Marks the worker's assigned task done and reports it to the owner's mailbox.
     */
    public Task complete(String workerId, String summary) {
        roster.require(workerId);
        Task done = registry.transition(workerId, TaskStatus.DONE);
        String content = summary == null || summary.isBlank()
                ? done.taskId() + " done"
                : done.taskId() + " done: " + summary;
        mailbox.append(ownerId, workerId, Message.TYPE_REPORT_RECEIVED, content);
        return done;
    }

    /**
     * Replaces the worker's done task with a corrected successor. The worker's session is reset
     * first, so the successor is only visible to a fresh context.
     */
    public Task redo(String workerId, Task successor) {
        Worker worker = roster.require(workerId);
        Task previous = registry.checkRedo(workerId, successor);
        session.send(worker, worker.cli().resetCommand());
        log.info("Reset {} with {} before redo of {}", workerId, worker.cli().resetCommand(), previous.taskId());
        Task next = registry.redo(workerId, successor);
        announceIfAssigned(worker, next);
        return next;
    }

    public WorkerPhase phaseOf(Worker worker) {
        return WorkerPhase.of(registry.get(worker.workerId()), observe(worker), mailbox.unreadCount(worker.workerId()));
    }

    public WorkerActivity observe(Worker worker) {
        try {
            return classifier.classify(session.capture(worker));
        } catch (SessionException e) {
            log.debug("Capture of {} failed: {}", worker.workerId(), e.getMessage());
            return WorkerActivity.ABSENT;
        }
    }

    private void announceIfAssigned(Worker worker, Task task) {
        if (task.status() != TaskStatus.ASSIGNED) {
            return;
        }
        try {
            announce(worker, task);
        } catch (FleetException e) {
            log.warn("Announcement of {} to {} deferred to next tick: {}", task.taskId(), worker.workerId(), e.getMessage());
        }
    }

    /**
     * Appends the task-assigned notice, preceded by a model-switch instruction when routing
     * calls for one.
     *
     * @return whether a model switch was issued
     */
    private boolean announce(Worker worker, Task task) {
        boolean switched = switchModelIfNeeded(worker, task);
        mailbox.append(worker.workerId(), SENDER, Message.TYPE_TASK_ASSIGNED, notice(task));
        roster.markAnnounced(worker.workerId(), task.taskId());
        metrics.recordAnnouncement(Message.TYPE_TASK_ASSIGNED);
        return switched;
    }

    private boolean switchModelIfNeeded(Worker worker, Task task) {
        if (task.bloomLevel() == null) {
            return false;
        }
        int required = task.bloomLevel();
        int available = router.capability(worker.model());
        if (available >= required) {
            return false;
        }
        Optional<String> recommended;
        try {
            recommended = router.recommend(required);
        } catch (InvalidBloomLevelException e) {
            log.warn("Task {} has bloom level {} outside the routable range; no switch", task.taskId(), required);
            return false;
        }
        if (recommended.isEmpty() || recommended.get().equals(worker.model())) {
            return false;
        }
        String target = recommended.get();
        RoutingMode mode = router.mode();
        if (mode != RoutingMode.AUTO) {
            log.info("Task {} (bloom {}) exceeds {} on {} (max {}); routing is {}, recommend {}",
                    task.taskId(), required, worker.model(), worker.workerId(), available,
                    mode.name().toLowerCase(Locale.ROOT), target);
            return false;
        }
        Optional<CliFamily> family = router.tier(target).flatMap(CapabilityTier::family);
        if (family.isEmpty() || family.get() != worker.cli()) {
            log.warn("Recommended model {} does not run on {} ({}); keeping {}",
                    target, worker.workerId(), worker.cli().wireName(), worker.model());
            return false;
        }
        mailbox.append(worker.workerId(), SENDER, Message.TYPE_MODEL_SWITCH, worker.cli().modelSwitchCommand(target));
        roster.switchModel(worker.workerId(), target);
        metrics.recordModelSwitch(worker.model(), target);
        return true;
    }

    static String notice(Task task) {
        StringBuilder sb = new StringBuilder(task.taskId());
        if (task.description() != null && !task.description().isBlank()) {
            sb.append(": ").append(task.description());
        }
        if (task.redoOf() != null) {
            sb.append(" (redo of ").append(task.redoOf()).append(')');
        }
        return sb.toString();
    }
}
