package com.fleetwarden.core.audit;

import com.fleetwarden.core.model.InstanceState;
import lombok.Builder;
import lombok.Value;

/**
 * Per-instance audit summary. Each timestamp field is a formatted UTC string or {@code "unknown"}.
 */
@Value
@Builder(toBuilder = true)
public class InstanceAuditResponse {
    String instanceId;
    String requestToLaunch;
    String latestStatus;
    String requestToTerminate;
    InstanceState latestStatusInfo;
}
