package com.fleetwarden.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Reconciled view of one instance; recomputed on every report request, never persisted.
 */
@Value
@Builder(toBuilder = true)
@With
public class InstanceReport {
    public static final String UNKNOWN = "unknown";
    public static final String PROVISIONING = "PROVISIONING";
    public static final String ONLINE = "ONLINE";

    String instanceId;
    String displayName;

    /**
     * Status from the tracked view; {@link #UNKNOWN} when the instance is not tracked.
     */
    String scaleStatus;

    /**
     * Status from the cloud view; {@link #UNKNOWN} when the cloud does not list the instance.
     */
    String cloudStatus;

    @JsonProperty("isShuttingDown")
    boolean shuttingDown;

    @JsonProperty("isScaleDownProtected")
    boolean scaleDownProtected;

    String privateIp;
    String publicIp;
}
