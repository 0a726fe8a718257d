package com.fleetmind.core.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps a task's bloom level to the cheapest model tier that is just sufficient for it.
 *
 * <p>A pure function of the configuration snapshot and the request: identical inputs always
 * give identical outputs. Selection among sufficient tiers (max_bloom &gt;= level) is by
 * smallest max_bloom, then cost-group order (explicit {@code cost_group_preference} first,
 * otherwise the order groups first appear in the file), then listing order. When no tier is
 * sufficient the tier with the largest max_bloom is returned (same tie-breaks).
 */
@Service
public class CapabilityRouter {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRouter.class);

    public static final int MIN_BLOOM = 1;
    public static final int MAX_BLOOM = 6;

    private final Supplier<CapabilityConfig> configSource;

    @Autowired
    public CapabilityRouter(CapabilityConfigLoader loader) {
        this(loader::load);
    }

    public CapabilityRouter(Supplier<CapabilityConfig> configSource) {
        this.configSource = configSource;
    }

    public CapabilityConfig config() {
        try {
            CapabilityConfig config = configSource.get();
            return config != null ? config : CapabilityConfig.disabled();
        } catch (RuntimeException e) {
            log.warn("Capability configuration unavailable, routing disabled: {}", e.getMessage());
            return CapabilityConfig.disabled();
        }
    }

    public RoutingMode mode() {
        CapabilityConfig config = config();
        return config.enabled() ? config.mode() : RoutingMode.OFF;
    }

    /**
     * Recommends a model for {@code bloomLevel}.
     *
     * @return the model id, or empty when routing is not configured (routing disabled, not an error)
     * @throws InvalidBloomLevelException if the level is outside 1..6
     */
    public Optional<String> recommend(int bloomLevel) {
        if (bloomLevel < MIN_BLOOM || bloomLevel > MAX_BLOOM) {
            throw new InvalidBloomLevelException(bloomLevel);
        }
        CapabilityConfig config = config();
        if (!config.enabled()) {
            return Optional.empty();
        }
        List<CapabilityTier> listed = List.copyOf(config.tiers().values());
        List<String> costOrder = config.effectiveCostOrder();
        Comparator<CapabilityTier> byCost = Comparator.comparingInt(tier -> costRank(costOrder, tier));
        Comparator<CapabilityTier> byListing = Comparator.comparingInt(listed::indexOf);

        Optional<CapabilityTier> sufficient = listed.stream()
                .filter(tier -> tier.maxBloom() >= bloomLevel)
                .min(Comparator.comparingInt(CapabilityTier::maxBloom).thenComparing(byCost).thenComparing(byListing));
        if (sufficient.isPresent()) {
            return Optional.of(sufficient.get().modelId());
        }
        CapabilityTier strongest = listed.stream()
                .min(Comparator.comparingInt((CapabilityTier tier) -> -tier.maxBloom())
                        .thenComparing(byCost).thenComparing(byListing))
                .orElseThrow();
        log.debug("No tier reaches bloom {}; escalating to {}", bloomLevel, strongest.modelId());
        return Optional.of(strongest.modelId());
    }

    /**
     * Highest bloom level {@code modelId} is configured for. Unknown models and missing or
     * unreadable configuration count as unbounded ({@value #MAX_BLOOM}).
     */
    public int capability(String modelId) {
        CapabilityConfig config = config();
        if (!config.enabled() || modelId == null) {
            return MAX_BLOOM;
        }
        CapabilityTier tier = config.tiers().get(modelId);
        return tier == null ? MAX_BLOOM : tier.maxBloom();
    }

    public Optional<CapabilityTier> tier(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(config().tiers().get(modelId));
    }

    private static int costRank(List<String> costOrder, CapabilityTier tier) {
        int rank = costOrder.indexOf(tier.costGroup() == null ? "" : tier.costGroup());
        return rank < 0 ? costOrder.size() : rank;
    }
}
