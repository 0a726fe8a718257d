package com.fleetmind.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FleetPropertiesTest {

    @Test
    @DisplayName("defaults")
    void defaults() {
        var props = new FleetProperties();

        assertEquals("shogun", props.getOwnerId());
        assertEquals(Duration.ofSeconds(10), props.lockTimeout());
        assertEquals(5, props.getDispatcher().getIntervalSeconds());
        assertEquals("config/settings.yaml", props.getRouting().getConfigFile());
        assertFalse(props.getNtfy().isConfigured());
        assertTrue(props.getWorkers().isEmpty());
    }

    @Test
    @DisplayName("state subdirectories derive from the state dir")
    void derivedPaths() {
        var props = new FleetProperties();
        props.setStateDir("/var/fleet");

        assertEquals(Path.of("/var/fleet/inbox"), props.inboxDir());
        assertEquals(Path.of("/var/fleet/tasks"), props.tasksDir());
        assertEquals(Path.of("/var/fleet/workers"), props.workersDir());
    }

    @Test
    @DisplayName("lock timeout is at least one second")
    void lockTimeoutFloor() {
        var props = new FleetProperties();
        props.setLockTimeoutSeconds(0);
        assertEquals(Duration.ofSeconds(1), props.lockTimeout());
    }

    @Test
    @DisplayName("ntfy counts as configured once a topic is set")
    void ntfyConfigured() {
        var props = new FleetProperties();
        props.getNtfy().setTopic("  ");
        assertFalse(props.getNtfy().isConfigured());
        props.getNtfy().setTopic("fleet-alerts");
        assertTrue(props.getNtfy().isConfigured());
    }
}
