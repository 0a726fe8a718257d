package com.fleetmind.core.routing;

import java.util.Locale;

/**
 * How capability routing participates in dispatch.
 * <ul>
 *   <li>{@code AUTO}: the dispatcher switches a worker's model before handing it a demanding task</li>
 *   <li>{@code MANUAL}: recommendations are available and logged, switches are left to the operator</li>
 *   <li>{@code OFF}: routing disabled; every model counts as fully capable</li>
 * </ul>
 */
public enum RoutingMode {
    AUTO,
    MANUAL,
    OFF;

    /**
     * Lenient parse; anything unrecognised disables routing.
     */
    public static RoutingMode fromString(String raw, RoutingMode whenAbsent) {
        if (raw == null || raw.isBlank()) {
            return whenAbsent;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OFF;
        }
    }
}
