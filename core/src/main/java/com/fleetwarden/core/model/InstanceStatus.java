package com.fleetwarden.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Tracked status of an instance.
 * <p>
 * {@code provisioning} wins over any type-specific sub-status when classifying.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class InstanceStatus {
    boolean provisioning;

    /**
     * Present only for jibri instances that have reported at least once.
     */
    JibriStatus jibriStatus;
}
