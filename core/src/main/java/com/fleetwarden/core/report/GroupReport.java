package com.fleetwarden.core.report;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time report of a group; every counter is a fold over {@link #instances}
 * except {@code count}, which is the size of the tracked view.
 */
@Value
@Builder(toBuilder = true)
public class GroupReport {
    String groupName;
    int desiredCount;
    int count;
    int cloudCount;
    int provisioningCount;
    int availableCount;
    int busyCount;
    int unTrackedCount;
    int shuttingDownCount;
    int scaleDownProtectedCount;
    List<InstanceReport> instances;
}
