package com.fleetwarden.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Configuration of one scaling group, owned by the group registry.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class InstanceGroup {
    String name;

    /**
     * Instance type of the group; report generation requires it.
     */
    String type;

    String region;
    String cloud;
    ScalingOptions scalingOptions;

    @JsonIgnore
    public boolean isTyped() {
        return type != null && !type.isBlank();
    }
}
