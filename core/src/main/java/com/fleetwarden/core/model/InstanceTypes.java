package com.fleetwarden.core.model;

/**
 * Instance and group types with type-specific status handling.
 */
public final class InstanceTypes {
    private InstanceTypes() {
    }

    /**
     * Recording/streaming worker with an idle/busy state machine and its own tracker.
     */
    public static final String JIBRI = "jibri";

    /**
     * Media bridge; no richer status model yet, reported as online.
     */
    public static final String JVB = "JVB";
}
