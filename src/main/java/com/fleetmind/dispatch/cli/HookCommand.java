package com.fleetmind.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetmind.core.hook.HookDecision;
import com.fleetmind.core.hook.TurnCompletionHook;
import com.fleetmind.core.metrics.FleetMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetmind hook --worker &lt;id&gt;
 * <p>
 * Registered as the worker program's end-of-turn hook. Reads the hook payload from stdin and
 * prints a block decision when unread mail should be processed first; prints nothing to allow.
 * Always exits 0: a broken hook must not wedge the worker.
 */
@Command(name = "hook", mixinStandardHelpOptions = true, description = "End-of-turn hook: hold the turn open for unread mail")
@Component
public class HookCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HookCommand.class);

    @Option(names = {"--worker", "-w"}, defaultValue = "${env:FLEETMIND_WORKER_ID}",
            description = "Worker id (default: $FLEETMIND_WORKER_ID)")
    private String workerId;

    private final TurnCompletionHook hook;
    private final ObjectMapper objectMapper;
    private final FleetMetrics metrics;

    InputStream in = System.in;
    PrintStream out = System.out;

    public HookCommand(TurnCompletionHook hook, ObjectMapper objectMapper, FleetMetrics metrics) {
        this.hook = hook;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public Integer call() {
        HookDecision decision = hook.evaluate(workerId, alreadyContinuing(readPayload()));
        metrics.recordHookDecision(decision.blocks());
        if (decision.blocks()) {
            try {
                out.println(objectMapper.writeValueAsString(decision));
            } catch (JsonProcessingException e) {
                log.warn("Cannot render hook decision: {}", e.getMessage());
            }
        }
        return 0;
    }

    private String readPayload() {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("No hook payload: {}", e.getMessage());
            return "";
        }
    }

    boolean alreadyContinuing(String payload) {
        if (payload == null || payload.isBlank()) {
            return false;
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            return root != null && root.path("stop_hook_active").asBoolean(false);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable hook payload: {}", e.getOriginalMessage());
            return false;
        }
    }
}
