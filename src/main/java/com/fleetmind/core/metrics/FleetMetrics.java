package com.fleetmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the dispatcher and its collaborators.
 */
@Service
public class FleetMetrics {

    private final MeterRegistry registry;

    public FleetMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTick(long ms) {
        Timer.builder("fleetmind.dispatcher.tick")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordNudge(String outcome) {
        Counter.builder("fleetmind.nudges.total")
                .description("Mailbox nudge decisions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAnnouncement(String type) {
        Counter.builder("fleetmind.announcements.total")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordUnblock() {
        Counter.builder("fleetmind.unblocks.total")
                .register(registry)
                .increment();
    }

    public void recordModelSwitch(String fromModel, String toModel) {
        Counter.builder("fleetmind.model_switches.total")
                .tag("from", fromModel == null ? "none" : fromModel)
                .tag("to", toModel)
                .register(registry)
                .increment();
    }

    /**
     * Counts per-worker failures inside a tick. The failed step is retried on the next tick.
     *
     * @param reason exception simple name
     */
    public void recordWorkerFailure(String reason) {
        Counter.builder("fleetmind.worker_failures.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordBridgeOutcome(String outcome) {
        Counter.builder("fleetmind.bridge.events")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordHookDecision(boolean blocked) {
        Counter.builder("fleetmind.hook.decisions")
                .tag("decision", blocked ? "block" : "allow")
                .register(registry)
                .increment();
    }
}
