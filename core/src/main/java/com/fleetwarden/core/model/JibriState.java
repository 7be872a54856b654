package com.fleetwarden.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * State handed to the dedicated jibri tracker when a jibri reports stats.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class JibriState {
    String jibriId;
    JibriStatus status;
    Long timestamp;
    InstanceMetadata metadata;
}
