package com.fleetmind.core.routing;

import com.fleetmind.core.FleetException;

/**
 * A bloom level outside 1..6 was passed to the router.
 */
public class InvalidBloomLevelException extends FleetException {

    public InvalidBloomLevelException(int level) {
        super("Bloom level must be between " + CapabilityRouter.MIN_BLOOM + " and "
                + CapabilityRouter.MAX_BLOOM + ": " + level);
    }
}
