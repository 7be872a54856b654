package com.fleetwarden.core.error;

/**
 * An external collaborator (tracker, cloud inventory, flag lookup) failed mid-request.
 */
public class DependencyException extends FleetException {

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isClientError() {
        return false;
    }
}
