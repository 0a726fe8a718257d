package com.fleetmind.core.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the capability configuration.
 *
 * @param mode                 routing-mode flag
 * @param tiers                tiers in configuration order, keyed by model id
 * @param costGroupPreference  explicit cost-group order for tie-breaks (may be empty)
 */
public record CapabilityConfig(RoutingMode mode, Map<String, CapabilityTier> tiers, List<String> costGroupPreference) {

    public CapabilityConfig {
        tiers = tiers == null ? Map.of() : tiers;
        costGroupPreference = costGroupPreference == null ? List.of() : List.copyOf(costGroupPreference);
    }

    public static CapabilityConfig disabled() {
        return new CapabilityConfig(RoutingMode.OFF, Map.of(), List.of());
    }

    public boolean enabled() {
        return mode != RoutingMode.OFF && !tiers.isEmpty();
    }

    /**
     * Cost groups in tie-break order: explicitly preferred groups first, then the remaining
     * groups in the order their first tier is listed.
     */
    public List<String> effectiveCostOrder() {
        var order = new ArrayList<>(costGroupPreference);
        for (CapabilityTier tier : tiers.values()) {
            String group = tier.costGroup() == null ? "" : tier.costGroup();
            if (!order.contains(group)) {
                order.add(group);
            }
        }
        return order;
    }
}
