package com.fleetmind.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.bridge.BridgeOutcome;
import com.fleetmind.core.bridge.NotificationBridge;
import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.metrics.FleetMetrics;
import com.fleetmind.notify.NtfyListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: fleetmind listen
 * <p>
 * Subscribes to the configured ntfy topic and feeds every event through the notification
 * bridge until interrupted.
 */
@Command(name = "listen", mixinStandardHelpOptions = true, description = "Deliver inbound ntfy messages to the owner mailbox")
@Component
public class ListenCommand implements Callable<Integer> {

    private final NotificationBridge bridge;
    private final FleetProperties properties;
    private final ObjectMapper objectMapper;
    private final FleetMetrics metrics;

    public ListenCommand(NotificationBridge bridge, FleetProperties properties, ObjectMapper objectMapper,
                         FleetMetrics metrics) {
        this.bridge = bridge;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        FleetProperties.Ntfy ntfy = properties.getNtfy();
        if (!ntfy.isConfigured()) {
            ConsoleOutput.error("fleetmind.ntfy.topic is not set");
            return 1;
        }
        ConsoleOutput.info("Listening on " + ntfy.getServer() + "/" + ntfy.getTopic());
        NtfyListener listener = new NtfyListener(ntfy.getServer(), ntfy.getTopic(), objectMapper);
        Runtime.getRuntime().addShutdownHook(new Thread(listener::stop, "ntfy-listener-stop"));
        listener.listen(event -> {
            BridgeOutcome outcome = bridge.onEvent(event);
            metrics.recordBridgeOutcome(outcome.name());
        });
        return 0;
    }
}
