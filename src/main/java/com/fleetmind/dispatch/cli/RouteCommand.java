package com.fleetmind.dispatch.cli;

import com.fleetmind.core.routing.CapabilityRouter;
import com.fleetmind.core.routing.InvalidBloomLevelException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetmind route &lt;level&gt;
 * <p>
 * Prints the recommended model for a bloom level, or the capability of a model.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Recommend a model for a bloom level")
@Component
public class RouteCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Bloom level, 1-6")
    private Integer level;

    @Option(names = {"--model", "-m"}, description = "Print this model's maximum bloom level instead")
    private String model;

    private final CapabilityRouter router;

    public RouteCommand(CapabilityRouter router) {
        this.router = router;
    }

    @Override
    public Integer call() {
        if (model != null) {
            System.out.println(router.capability(model));
            return 0;
        }
        if (level == null) {
            ConsoleOutput.error("Give a bloom level or --model");
            return 2;
        }
        try {
            Optional<String> recommended = router.recommend(level);
            if (recommended.isEmpty()) {
                ConsoleOutput.info("Routing not configured");
                return 0;
            }
            System.out.println(recommended.get());
            return 0;
        } catch (InvalidBloomLevelException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
