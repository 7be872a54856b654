package com.fleetwarden.core.audit;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * One launcher decision: how many instances were launched or terminated to meet the desired count.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class LauncherActionItem {
    long timestamp;
    String actionType;
    int count;
    int desiredCount;
    int scaleQuantity;
}
