package com.fleetwarden.autoscaler.cloud;

import com.fleetwarden.core.model.CloudInstance;
import com.fleetwarden.core.model.InstanceGroup;
import com.fleetwarden.core.retry.CloudRetryStrategy;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Cloud provider adapter: source of the live view.
 */
public interface ICloudManager {

    /**
     * Instances the provider currently lists for a group, fetched under the given retry policy.
     */
    Mono<List<CloudInstance>> getInstances(InstanceGroup group, CloudRetryStrategy retryStrategy);
}
