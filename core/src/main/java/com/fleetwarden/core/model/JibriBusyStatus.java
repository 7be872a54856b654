package com.fleetwarden.core.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Busy state reported by a jibri worker.
 */
public enum JibriBusyStatus {
    IDLE,
    BUSY,
    EXPIRED,
    @JsonEnumDefaultValue
    UNKNOWN
}
