package com.fleetwarden.core.error;

import lombok.Getter;

@Getter
public class GroupNotFoundException extends FleetException {

    private final String groupName;

    public GroupNotFoundException(String groupName) {
        super("Group " + groupName + " not found, failed to generate report");
        this.groupName = groupName;
    }

    @Override
    public boolean isClientError() {
        return true;
    }
}
