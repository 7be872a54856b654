package com.fleetwarden.autoscaler.status;

import reactor.core.publisher.Mono;

/**
 * Per-instance shutdown and scale-down protection lookups used when annotating reports.
 */
public interface IShutdownStatusProvider {

    Mono<Boolean> getShutdownStatus(String instanceId);

    Mono<Boolean> isScaleDownProtected(String instanceId);
}
