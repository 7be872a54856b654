package com.fleetwarden.core.audit;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Operator view of an {@link AutoScalerActionItem} with a formatted UTC timestamp.
 */
@Value
@Builder
public class AutoScalerActionReport {
    String timestamp;
    String actionType;
    int count;
    int oldDesiredCount;
    int newDesiredCount;
    List<Double> scaleMetrics;

    public static AutoScalerActionReport from(AutoScalerActionItem item, String formattedTimestamp) {
        return AutoScalerActionReport.builder()
            .timestamp(formattedTimestamp)
            .actionType(item.getActionType())
            .count(item.getCount())
            .oldDesiredCount(item.getOldDesiredCount())
            .newDesiredCount(item.getNewDesiredCount())
            .scaleMetrics(item.getScaleMetrics())
            .build();
    }
}
