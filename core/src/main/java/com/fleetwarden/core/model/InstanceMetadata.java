package com.fleetwarden.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Descriptive metadata an instance reports alongside its status.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class InstanceMetadata {
    String group;
    String publicIp;
    String privateIp;
    String region;
    String cloud;
    String name;
    String version;

    public static InstanceMetadata from(InstanceDetails details) {
        return InstanceMetadata.builder()
            .group(details.getGroup())
            .region(details.getRegion())
            .cloud(details.getCloud())
            .build();
    }
}
