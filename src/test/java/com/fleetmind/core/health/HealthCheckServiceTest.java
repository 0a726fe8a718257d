package com.fleetmind.core.health;

import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.routing.CapabilityConfigLoader;
import com.fleetmind.session.WorkerSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path dir;

    private FleetProperties properties(Path stateDir) {
        var props = new FleetProperties();
        props.setStateDir(stateDir.toString());
        return props;
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns state-dir, routing, session components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(properties(dir.resolve("queue")),
                new CapabilityConfigLoader(dir.resolve("missing.yaml")), mock(WorkerSession.class));

        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("state-dir", "routing", "session"), components);
    }

    @Test
    @DisplayName("writable state dir -> UP, created if missing")
    void stateDirUp() {
        Path stateDir = dir.resolve("queue");
        var service = new HealthCheckService(properties(stateDir),
                new CapabilityConfigLoader(dir.resolve("missing.yaml")), mock(WorkerSession.class));

        assertEquals(HealthStatus.Status.UP, component(service.checkAll(), "state-dir").status());
        assertTrue(Files.isDirectory(stateDir));
    }

    @Test
    @DisplayName("state dir path occupied by a file -> DOWN")
    void stateDirDown() throws IOException {
        Path blocker = Files.writeString(dir.resolve("queue"), "not a directory");
        var service = new HealthCheckService(properties(blocker),
                new CapabilityConfigLoader(dir.resolve("missing.yaml")), mock(WorkerSession.class));

        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "state-dir").status());
    }

    @Test
    @DisplayName("no capability file -> routing DEGRADED; configured tiers -> UP")
    void routing() throws IOException {
        var missing = new HealthCheckService(properties(dir),
                new CapabilityConfigLoader(dir.resolve("missing.yaml")), mock(WorkerSession.class));
        assertEquals(HealthStatus.Status.DEGRADED, component(missing.checkAll(), "routing").status());

        Path settings = Files.writeString(dir.resolve("settings.yaml"), """
                bloom_routing: auto
                capability_tiers:
                  opus:
                    max_bloom: 6
                    cost_group: claude_max
                """);
        var configured = new HealthCheckService(properties(dir),
                new CapabilityConfigLoader(settings), mock(WorkerSession.class));
        HealthStatus routing = component(configured.checkAll(), "routing");
        assertEquals(HealthStatus.Status.UP, routing.status());
        assertTrue(routing.detail().contains("1 tier"), routing.detail());
    }

    @Test
    @DisplayName("session backend reachable -> UP, otherwise DOWN")
    void session() {
        WorkerSession up = mock(WorkerSession.class);
        when(up.available()).thenReturn(true);

        var reachable = new HealthCheckService(properties(dir),
                new CapabilityConfigLoader(dir.resolve("missing.yaml")), up);
        var unreachable = new HealthCheckService(properties(dir),
                new CapabilityConfigLoader(dir.resolve("missing.yaml")), mock(WorkerSession.class));

        assertEquals(HealthStatus.Status.UP, component(reachable.checkAll(), "session").status());
        assertEquals(HealthStatus.Status.DOWN, component(unreachable.checkAll(), "session").status());
    }
}
