package com.fleetwarden.core.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of per-instance audit events, with the tag persisted in the {@code type} field and the key suffix.
 */
public enum InstanceEventType {
    LAUNCH_REQUESTED("request-to-launch"),
    TERMINATE_REQUESTED("request-to-terminate"),
    LATEST_STATUS("latest-status");

    private final String wireName;

    InstanceEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<InstanceEventType> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(wireName))
            .findFirst();
    }
}
