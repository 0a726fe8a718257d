package com.fleetmind.core.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetmind.core.model.CliFamily;
import com.fleetmind.core.store.Yamls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the capability configuration file on every call, so edits take effect on the next
 * routing decision without a restart.
 *
 * <p>Never throws: a missing, unreadable or malformed file yields
 * {@link CapabilityConfig#disabled()}, and a tier without a usable {@code max_bloom} is left
 * out (which makes that model unbounded).
 */
public class CapabilityConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CapabilityConfigLoader.class);

    private final Path configFile;

    public CapabilityConfigLoader(Path configFile) {
        this.configFile = configFile;
    }

    public Path configFile() {
        return configFile;
    }

    public CapabilityConfig load() {
        if (configFile == null || !Files.isRegularFile(configFile)) {
            log.debug("No capability configuration at {}; routing disabled", configFile);
            return CapabilityConfig.disabled();
        }
        try {
            JsonNode root = Yamls.mapper().readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                return CapabilityConfig.disabled();
            }
            Map<String, CapabilityTier> tiers = parseTiers(root.path("capability_tiers"));
            if (tiers.isEmpty()) {
                return CapabilityConfig.disabled();
            }
            RoutingMode mode = RoutingMode.fromString(root.path("bloom_routing").asText(null), RoutingMode.MANUAL);
            return new CapabilityConfig(mode, tiers, parsePreference(root.path("cost_group_preference")));
        } catch (Exception e) {
            log.warn("Ignoring unreadable capability configuration {}: {}", configFile, e.getMessage());
            return CapabilityConfig.disabled();
        }
    }

    private Map<String, CapabilityTier> parseTiers(JsonNode node) {
        var tiers = new LinkedHashMap<String, CapabilityTier>();
        if (!node.isObject()) {
            return tiers;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode spec = entry.getValue();
            JsonNode maxBloom = spec.path("max_bloom");
            if (!maxBloom.canConvertToInt()
                    || maxBloom.asInt() < CapabilityRouter.MIN_BLOOM
                    || maxBloom.asInt() > CapabilityRouter.MAX_BLOOM) {
                log.warn("Tier {} has no valid max_bloom; treating it as unbounded", entry.getKey());
                continue;
            }
            tiers.put(entry.getKey(), new CapabilityTier(
                    entry.getKey(),
                    maxBloom.asInt(),
                    spec.path("cost_group").asText(""),
                    parseFamily(entry.getKey(), spec.path("cli").asText(null))));
        }
        return tiers;
    }

    private CliFamily parseFamily(String modelId, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return CliFamily.fromString(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Tier {} names unknown cli '{}'; inferring from model id", modelId, raw);
            return null;
        }
    }

    private List<String> parsePreference(JsonNode node) {
        var groups = new ArrayList<String>();
        if (node.isArray()) {
            for (JsonNode group : node) {
                if (group.isTextual() && !group.asText().isBlank()) {
                    groups.add(group.asText().trim());
                }
            }
        }
        return groups;
    }
}
