package com.fleetwarden.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * An instance's state as last reported into the tracker, by the instance itself or by the control loop.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class InstanceState {
    String instanceId;
    String instanceType;
    Long timestamp;
    InstanceStatus status;
    InstanceMetadata metadata;

    /**
     * Whether the tracker already knows the instance is shutting down.
     */
    Boolean shutdownStatus;

    @JsonIgnore
    public boolean isShuttingDown() {
        return Boolean.TRUE.equals(shutdownStatus);
    }
}
