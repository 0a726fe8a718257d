package com.fleetmind.core.bridge;

/**
 * What the bridge did with one relay event.
 */
public enum BridgeOutcome {
    /** Not a message event, or empty content. */
    IGNORED,
    /** Carried the outbound tag: this system's own acknowledgment echoed back. */
    DROPPED_OUTBOUND,
    /** Appended to the owner mailbox and acknowledged. */
    DELIVERED,
    /** Appended to the owner mailbox; the acknowledgment could not be sent. */
    DELIVERED_UNACKNOWLEDGED
}
