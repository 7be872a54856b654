package com.fleetwarden.core.audit;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One autoscaler decision: the desired count change and the metrics that drove it.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class AutoScalerActionItem {
    long timestamp;
    String actionType;
    int count;
    int oldDesiredCount;
    int newDesiredCount;
    List<Double> scaleMetrics;
}
