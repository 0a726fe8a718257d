package com.fleetmind.dispatch.cli;

import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.engine.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: fleetmind dispatch [--loop]
 * <p>
 * Runs one dispatcher tick, or keeps ticking at the configured interval.
 */
@Command(name = "dispatch", mixinStandardHelpOptions = true, description = "Run dispatcher ticks")
@Component
public class DispatchCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DispatchCommand.class);

    @Option(names = {"--loop", "-l"}, description = "Keep ticking until interrupted")
    private boolean loop;

    @Option(names = {"--interval", "-i"}, description = "Seconds between ticks (default: fleetmind.dispatcher.interval-seconds)")
    private Integer intervalSeconds;

    @Option(names = "--ticks", description = "Stop looping after this many ticks (0 = unlimited)", defaultValue = "0")
    private int maxTicks;

    private final Dispatcher dispatcher;
    private final FleetProperties properties;

    public DispatchCommand(Dispatcher dispatcher, FleetProperties properties) {
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    @Override
    public void run() {
        if (!loop) {
            ConsoleOutput.tick(dispatcher.tick());
            return;
        }
        int interval = intervalSeconds != null ? intervalSeconds : properties.getDispatcher().getIntervalSeconds();
        ConsoleOutput.info("Dispatching every " + interval + "s (Ctrl-C to stop)");
        int done = 0;
        while (!Thread.currentThread().isInterrupted()) {
            ConsoleOutput.tick(dispatcher.tick());
            done++;
            if (maxTicks > 0 && done >= maxTicks) {
                break;
            }
            try {
                Thread.sleep(interval * 1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Dispatch loop interrupted after {} tick(s)", done);
            }
        }
    }
}
