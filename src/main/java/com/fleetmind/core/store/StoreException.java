package com.fleetmind.core.store;

import com.fleetmind.core.FleetException;

/**
 * A document could not be read, parsed, or atomically replaced. The previously stored
 * document is left untouched.
 */
public class StoreException extends FleetException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
