package com.fleetwarden.core.audit;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Group audit summary; action item lists are ordered most recent first.
 */
@Value
@Builder(toBuilder = true)
public class GroupAuditResponse {
    String lastLauncherRun;
    String lastAutoScalerRun;
    List<AutoScalerActionReport> autoScalerActionItems;
    List<LauncherActionReport> launcherActionItems;
}
