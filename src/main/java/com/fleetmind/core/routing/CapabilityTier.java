package com.fleetmind.core.routing;

import com.fleetmind.core.model.CliFamily;

import java.util.Optional;

/**
 * Configured capability of one model.
 *
 * @param modelId   model identifier as workers know it
 * @param maxBloom  highest bloom level the model handles well, 1..6
 * @param costGroup billing/cost classification used for tie-breaking
 * @param cli       family that serves the model, if configured explicitly
 */
public record CapabilityTier(String modelId, int maxBloom, String costGroup, CliFamily cli) {

    public Optional<CliFamily> family() {
        return cli != null ? Optional.of(cli) : CliFamily.fromModel(modelId);
    }
}
