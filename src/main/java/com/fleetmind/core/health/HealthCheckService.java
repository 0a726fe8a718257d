package com.fleetmind.core.health;

import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.routing.CapabilityConfig;
import com.fleetmind.core.routing.CapabilityConfigLoader;
import com.fleetmind.session.WorkerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final FleetProperties properties;
    private final CapabilityConfigLoader routingConfig;
    private final WorkerSession session;

    public HealthCheckService(FleetProperties properties, CapabilityConfigLoader routingConfig, WorkerSession session) {
        this.properties = properties;
        this.routingConfig = routingConfig;
        this.session = session;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStateDir());
        results.add(checkRouting());
        results.add(checkSession());
        return results;
    }

    private HealthStatus checkStateDir() {
        Path root = properties.stateRoot().toAbsolutePath();
        try {
            Files.createDirectories(root);
            Path probe = Files.createTempFile(root, ".health", ".tmp");
            Files.delete(probe);
            return new HealthStatus("state-dir", HealthStatus.Status.UP,
                    "Writable", Map.of("path", root.toString()));
        } catch (IOException e) {
            log.warn("State directory check failed: {}", e.getMessage());
            return new HealthStatus("state-dir", HealthStatus.Status.DOWN,
                    "Not writable: " + e.getMessage(), Map.of("path", root.toString()));
        }
    }

    private HealthStatus checkRouting() {
        Path file = routingConfig.configFile();
        CapabilityConfig config = routingConfig.load();
        if (!config.enabled()) {
            String detail = Files.isRegularFile(file)
                    ? "Routing off (mode " + config.mode().name().toLowerCase(Locale.ROOT) + ")"
                    : "No capability configuration; every model treated as fully capable";
            return new HealthStatus("routing", HealthStatus.Status.DEGRADED, detail, Map.of("file", file.toString()));
        }
        return new HealthStatus("routing", HealthStatus.Status.UP,
                config.tiers().size() + " tier(s), mode " + config.mode().name().toLowerCase(Locale.ROOT),
                Map.of("file", file.toString()));
    }

    private HealthStatus checkSession() {
        if (session.available()) {
            return new HealthStatus("session", HealthStatus.Status.UP,
                    "Session backend reachable (" + session.getClass().getSimpleName() + ")", Map.of());
        }
        return new HealthStatus("session", HealthStatus.Status.DOWN,
                "Session backend not reachable (" + session.getClass().getSimpleName() + ")", Map.of());
    }
}
