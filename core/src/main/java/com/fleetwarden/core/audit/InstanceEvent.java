package com.fleetwarden.core.audit;

import com.fleetwarden.core.model.InstanceState;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Lifecycle event of a single instance, persisted under {@code audit:{group}:{instanceId}:{type}}.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class InstanceEvent {
    String instanceId;
    InstanceEventType type;

    /**
     * Wall-clock time of the write, epoch millis.
     */
    long timestamp;

    /**
     * Only set on {@link InstanceEventType#LATEST_STATUS} events.
     */
    InstanceState state;
}
