package com.fleetwarden.autoscaler.group;

import com.fleetwarden.core.model.InstanceGroup;
import reactor.core.publisher.Mono;

/**
 * Registry of instance group configuration.
 */
public interface IInstanceGroupManager {

    /**
     * @return the group, or empty when no group has that name
     */
    Mono<InstanceGroup> getInstanceGroup(String groupName);
}
