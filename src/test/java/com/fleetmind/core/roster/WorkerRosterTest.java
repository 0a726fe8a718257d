package com.fleetmind.core.roster;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.model.CliFamily;
import com.fleetmind.core.model.Worker;
import com.fleetmind.core.store.DocumentStore;
import com.fleetmind.core.store.FileDocumentStore;
import com.fleetmind.core.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRosterTest {

    private InMemoryDocumentStore<Worker> documents;
    private WorkerRoster roster;

    @BeforeEach
    void setUp() {
        documents = new InMemoryDocumentStore<>();
        roster = new WorkerRoster(documents, List.of(
                new Worker("karo", "opus", CliFamily.CLAUDE, "multiagent:0.0"),
                new Worker("ashigaru1", "spark", CliFamily.CODEX, "multiagent:0.1")));
    }

    @Test
    @DisplayName("all() keeps configuration order")
    void configurationOrder() {
        assertEquals(List.of("karo", "ashigaru1"), roster.all().stream().map(Worker::workerId).toList());
    }

    @Test
    @DisplayName("unknown worker -> empty / FleetException")
    void unknownWorker() {
        assertTrue(roster.find("ghost").isEmpty());
        assertThrows(FleetException.class, () -> roster.require("ghost"));
        assertThrows(FleetException.class, () -> roster.switchModel("ghost", "opus"));
    }

    @Test
    @DisplayName("duplicate worker ids are rejected")
    void duplicateIds() {
        var seeds = List.of(new Worker("karo", "opus", CliFamily.CLAUDE, "a"),
                new Worker("karo", "sonnet", CliFamily.CLAUDE, "b"));
        assertThrows(FleetException.class, () -> new WorkerRoster(documents, seeds));
    }

    @Test
    @DisplayName("persisted model overrides the configured one, identity stays from configuration")
    void persistedModelWins() {
        roster.switchModel("karo", "sonnet");

        Worker karo = roster.require("karo");
        assertEquals("sonnet", karo.model());
        assertEquals("multiagent:0.0", karo.session());
        assertEquals(CliFamily.CLAUDE, karo.cli());
    }

    @Test
    @DisplayName("markDeferred returns the previous flag and skips no-op writes")
    void markDeferred() {
        assertFalse(roster.markDeferred("karo", true));
        assertTrue(roster.require("karo").turnDeferred());
        assertTrue(roster.markDeferred("karo", true));
        assertTrue(roster.markDeferred("karo", false));
        assertFalse(roster.require("karo").turnDeferred());

        assertFalse(roster.markDeferred("ashigaru1", false));
        assertTrue(documents.read("ashigaru1").isEmpty());
    }

    @Test
    @DisplayName("markAnnounced survives a reload from disk")
    void announcedPersisted(@TempDir Path dir) {
        DocumentStore<Worker> store = new FileDocumentStore<>(dir, Worker.class, Duration.ofSeconds(2));
        var seeds = List.of(new Worker("karo", "opus", CliFamily.CLAUDE, "multiagent:0.0"));
        new WorkerRoster(store, seeds).markAnnounced("karo", "subtask_001a");

        Worker reloaded = new WorkerRoster(new FileDocumentStore<>(dir, Worker.class, Duration.ofSeconds(2)), seeds)
                .require("karo");
        assertEquals("subtask_001a", reloaded.announcedTask());
        assertEquals("opus", reloaded.model());
    }

    @Test
    @DisplayName("seeds from properties: session defaults to the worker id, cli parsed")
    void seedsFromProperties() {
        var props = new FleetProperties();
        props.setWorkers(List.of(
                new FleetProperties.WorkerSpec("karo", "opus", "claude", "multiagent:0.0"),
                new FleetProperties.WorkerSpec("ashigaru1", "spark", "codex", "")));

        var seeds = WorkerRoster.seedsFrom(props.getWorkers());

        assertEquals("multiagent:0.0", seeds.get(0).session());
        assertEquals("ashigaru1", seeds.get(1).session());
        assertEquals(CliFamily.CODEX, seeds.get(1).cli());
    }
}
