package com.fleetwarden.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Status payload a jibri worker sends with each stats report.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class JibriStatus {
    JibriBusyStatus busyStatus;
    JibriHealth health;
}
