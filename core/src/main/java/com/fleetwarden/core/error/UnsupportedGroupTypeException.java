package com.fleetwarden.core.error;

import lombok.Getter;

/**
 * Reports need a typed group to pick the status classification rules.
 */
@Getter
public class UnsupportedGroupTypeException extends FleetException {

    private final String groupName;

    public UnsupportedGroupTypeException(String groupName) {
        super("Only typed groups are supported for report generation (group " + groupName + ")");
        this.groupName = groupName;
    }

    @Override
    public boolean isClientError() {
        return true;
    }
}
