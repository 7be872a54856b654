package com.fleetwarden.core.error;

import lombok.Getter;

/**
 * A store write was not acknowledged with the expected reply.
 */
@Getter
public class PersistenceException extends FleetException {

    private final String key;

    public PersistenceException(String key, String reply) {
        super("Unable to set " + key + " (reply: " + reply + ")");
        this.key = key;
    }

    public PersistenceException(String key, Throwable cause) {
        super("Unable to set " + key, cause);
        this.key = key;
    }

    @Override
    public boolean isClientError() {
        return false;
    }
}
