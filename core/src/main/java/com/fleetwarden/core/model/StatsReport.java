package com.fleetwarden.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Telemetry an instance posts on each heartbeat.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class StatsReport {
    InstanceDetails instance;
    Long timestamp;

    /**
     * Opaque payload; stored verbatim unless the instance type has a dedicated tracker.
     */
    JsonNode stats;
}
