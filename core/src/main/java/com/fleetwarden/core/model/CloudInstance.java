package com.fleetwarden.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * An instance as currently listed by the cloud provider's inventory.
 */
@Value
@Builder(toBuilder = true)
@With
public class CloudInstance {
    String instanceId;
    String displayName;

    /**
     * Provider status string, e.g. {@link #PROVISIONING} or {@link #RUNNING}.
     */
    String cloudStatus;

    public static final String PROVISIONING = "Provisioning";
    public static final String RUNNING = "Running";

    /**
     * Whether the status counts the instance as existing in the cloud.
     */
    public static boolean isLive(String cloudStatus) {
        return PROVISIONING.equals(cloudStatus) || RUNNING.equals(cloudStatus);
    }
}
