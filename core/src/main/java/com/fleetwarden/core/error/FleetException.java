package com.fleetwarden.core.error;

/**
 * Root of the failures surfaced by audit, flag and report operations.
 * <p>
 * Client errors map to 4xx responses on a caller surface, everything else to 5xx.
 * </p>
 */
public abstract class FleetException extends RuntimeException {

    protected FleetException(String message) {
        super(message);
    }

    protected FleetException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isClientError();
}
