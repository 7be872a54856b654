package com.fleetwarden.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable identity of a compute instance, shared by every subsystem.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class InstanceDetails {
    /**
     * Unique identifier, stable for the lifetime of the instance.
     */
    String instanceId;

    /**
     * Instance type (e.g. {@code jibri}, {@code JVB}); selects stats handling.
     */
    String instanceType;

    String cloud;

    String region;

    /**
     * Name of the scaling group the instance belongs to.
     */
    String group;
}
