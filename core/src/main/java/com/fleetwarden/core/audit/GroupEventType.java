package com.fleetwarden.core.audit;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of per-group audit events.
 * <p>
 * Run markers have one key per group and are overwritten; action items get a key per timestamp.
 * </p>
 */
public enum GroupEventType {
    LAST_LAUNCHER_RUN("last-launcher-run"),
    LAST_AUTOSCALER_RUN("last-autoScaler-run"),
    LAUNCHER_ACTION_ITEM("launcher-action-item"),
    AUTOSCALER_ACTION_ITEM("autoScaler-action-item");

    private final String wireName;

    GroupEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<GroupEventType> fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(wireName))
            .findFirst();
    }
}
