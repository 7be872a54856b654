package com.fleetwarden.autoscaler.tracker;

import com.fleetwarden.core.model.JibriState;
import reactor.core.publisher.Mono;

/**
 * Dedicated tracker for jibri workers, which keep a richer state machine than a stats blob.
 */
public interface IJibriTracker {

    /**
     * Records the latest state of a jibri.
     *
     * @return whether the state was stored
     */
    Mono<Boolean> track(JibriState state);
}
