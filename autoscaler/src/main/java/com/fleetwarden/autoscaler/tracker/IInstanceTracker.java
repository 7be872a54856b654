package com.fleetwarden.autoscaler.tracker;

import com.fleetwarden.core.model.InstanceState;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of the tracked view: what the control loop believes about each instance.
 */
public interface IInstanceTracker {

    /**
     * Current tracked states of a group.
     *
     * @param strict when false, states of instances that stopped reporting recently are still returned
     */
    Mono<List<InstanceState>> getCurrent(String groupName, boolean strict);
}
