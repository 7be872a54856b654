package com.fleetwarden.core.audit;

import lombok.Builder;
import lombok.Value;

/**
 * Operator view of a {@link LauncherActionItem} with a formatted UTC timestamp.
 */
@Value
@Builder
public class LauncherActionReport {
    String timestamp;
    String actionType;
    int count;
    int desiredCount;
    int scaleQuantity;

    public static LauncherActionReport from(LauncherActionItem item, String formattedTimestamp) {
        return LauncherActionReport.builder()
            .timestamp(formattedTimestamp)
            .actionType(item.getActionType())
            .count(item.getCount())
            .desiredCount(item.getDesiredCount())
            .scaleQuantity(item.getScaleQuantity())
            .build();
    }
}
