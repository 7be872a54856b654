package com.fleetwarden.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class ScalingOptions {
    int minDesired;
    int maxDesired;
    int desiredCount;
}
