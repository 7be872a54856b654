package com.fleetwarden.core.audit;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Group-level audit event: a run marker or one control-loop decision.
 * <p>
 * Exactly one payload is set for action items, matching {@link #type}; run markers carry none.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class GroupEvent {
    String groupName;
    GroupEventType type;
    long timestamp;
    LauncherActionItem launcherActionItem;
    AutoScalerActionItem autoScalerActionItem;
}
